package com.oniongateway.core.dispatch;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;

import java.util.function.IntSupplier;

/**
 * Dispatcher counters, kept in a Dropwizard {@link MetricRegistry} so a
 * reporter can be attached by the embedding process.
 */
public class DispatcherMetrics {

    private static final String PREFIX = "dispatcher";

    private final MetricRegistry registry;

    private final Meter received;
    private final Meter rejected;
    private final Meter accepted;
    private final Counter limitRejections;
    private final Counter rejectFailures;
    private final Counter acceptFailures;
    private final Counter tlsFailures;
    private final Counter serveFailures;
    private final Counter idleTimeouts;
    private final Counter completed;

    public DispatcherMetrics() {
        this(new MetricRegistry());
    }

    public DispatcherMetrics(MetricRegistry registry) {
        this.registry = registry;
        received = registry.meter(MetricRegistry.name(PREFIX, "requests", "received"));
        rejected = registry.meter(MetricRegistry.name(PREFIX, "requests", "rejected"));
        accepted = registry.meter(MetricRegistry.name(PREFIX, "requests", "accepted"));
        limitRejections = registry.counter(MetricRegistry.name(PREFIX, "requests", "overLimit"));
        rejectFailures = registry.counter(MetricRegistry.name(PREFIX, "errors", "reject"));
        acceptFailures = registry.counter(MetricRegistry.name(PREFIX, "errors", "accept"));
        tlsFailures = registry.counter(MetricRegistry.name(PREFIX, "errors", "tls"));
        serveFailures = registry.counter(MetricRegistry.name(PREFIX, "errors", "serve"));
        idleTimeouts = registry.counter(MetricRegistry.name(PREFIX, "connections", "idleTimeout"));
        completed = registry.counter(MetricRegistry.name(PREFIX, "connections", "completed"));
    }

    void registerInFlight(IntSupplier inFlight) {
        String name = MetricRegistry.name(PREFIX, "connections", "inFlight");
        registry.remove(name);
        registry.register(name, (Gauge<Integer>) inFlight::getAsInt);
    }

    void received() {
        received.mark();
    }

    void rejected() {
        rejected.mark();
    }

    void rejectedOverLimit() {
        limitRejections.inc();
        rejected.mark();
    }

    void rejectFailed() {
        rejectFailures.inc();
    }

    void accepted() {
        accepted.mark();
    }

    void acceptFailed() {
        acceptFailures.inc();
    }

    void outcome(ConnectionOutcome outcome) {
        switch (outcome) {
            case COMPLETED:
                completed.inc();
                break;
            case TLS_FAILED:
                tlsFailures.inc();
                break;
            case SERVE_FAILED:
                serveFailures.inc();
                break;
            case IDLE_TIMEOUT:
                idleTimeouts.inc();
                break;
            default:
                throw new IllegalArgumentException("Unknown outcome: " + outcome);
        }
    }

    public MetricRegistry getRegistry() {
        return registry;
    }

    public long getReceived() {
        return received.getCount();
    }

    public long getRejected() {
        return rejected.getCount();
    }

    public long getAccepted() {
        return accepted.getCount();
    }

    public long getLimitRejections() {
        return limitRejections.getCount();
    }

    public long getRejectFailures() {
        return rejectFailures.getCount();
    }

    public long getAcceptFailures() {
        return acceptFailures.getCount();
    }

    public long getTlsFailures() {
        return tlsFailures.getCount();
    }

    public long getServeFailures() {
        return serveFailures.getCount();
    }

    public long getIdleTimeouts() {
        return idleTimeouts.getCount();
    }

    public long getCompleted() {
        return completed.getCount();
    }

    @Override
    public String toString() {
        return "received=" + getReceived()
                + ", rejected=" + getRejected()
                + ", limitRejections=" + getLimitRejections()
                + ", rejectFailures=" + getRejectFailures()
                + ", accepted=" + getAccepted()
                + ", acceptFailures=" + getAcceptFailures()
                + ", tlsFailures=" + getTlsFailures()
                + ", serveFailures=" + getServeFailures()
                + ", idleTimeouts=" + getIdleTimeouts()
                + ", completed=" + getCompleted();
    }
}
