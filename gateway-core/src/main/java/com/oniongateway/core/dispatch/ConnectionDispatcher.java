package com.oniongateway.core.dispatch;

import com.oniongateway.core.config.DispatcherConfig;
import com.oniongateway.core.gate.PortGate;
import com.oniongateway.core.http.HttpBridge;
import com.oniongateway.core.http.RequestHandler;
import com.oniongateway.core.tls.TlsTerminator;
import com.oniongateway.core.transport.RequestDescriptor;
import com.oniongateway.core.transport.StreamRequest;
import com.oniongateway.core.transport.StreamRequestSource;
import com.oniongateway.core.transport.TransportException;
import com.oniongateway.core.util.Sensitive;
import io.netty.channel.Channel;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.ChannelGroupFuture;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Accept loop of the hidden service.
 * <p>
 * {@link #run(StreamRequestSource)} pulls stream requests in arrival order and
 * decides each one on the calling thread: requests the {@link PortGate} refuses
 * are rejected, the others are accepted and promoted to a connection task that
 * performs the TLS handshake and HTTP serving on its own channel. The loop
 * never waits for a connection; waiting for the next request is its only
 * suspension point.
 * <p>
 * Connection failures stay inside their task. The only error that leaves
 * {@code run} is a {@link TransportException} from the request source.
 */
@Slf4j
public class ConnectionDispatcher {

    private final PortGate portGate;
    private final TlsTerminator tlsTerminator;
    private final HttpBridge httpBridge;
    private final RequestHandler requestHandler;
    private final int maxConnections;
    private final DispatcherMetrics metrics;

    private final Set<ConnectionTask> inFlight = ConcurrentHashMap.newKeySet();
    private final ChannelGroup connections = new DefaultChannelGroup("gateway-connections",
            GlobalEventExecutor.INSTANCE);
    private final AtomicBoolean running = new AtomicBoolean();
    private final Object loopLock = new Object();
    private volatile boolean stopRequested;
    // guarded by loopLock
    private Thread loopThread;

    /**
     * @param tlsTerminator {@code null} serves admitted streams as plaintext
     */
    @Builder
    public ConnectionDispatcher(PortGate portGate, TlsTerminator tlsTerminator, HttpBridge httpBridge,
            RequestHandler requestHandler, DispatcherConfig config, DispatcherMetrics metrics) {
        DispatcherConfig effective = config == null ? new DispatcherConfig() : config;
        effective.validate();
        this.portGate = Objects.requireNonNull(portGate, "portGate");
        this.tlsTerminator = tlsTerminator;
        this.httpBridge = Objects.requireNonNull(httpBridge, "httpBridge");
        this.requestHandler = Objects.requireNonNull(requestHandler, "requestHandler");
        this.maxConnections = effective.isBounded() ? effective.getMaxConnections() : Integer.MAX_VALUE;
        this.metrics = metrics == null ? new DispatcherMetrics() : metrics;
        this.metrics.registerInFlight(inFlight::size);
    }

    /**
     * Runs the loop until the source reports the end of its sequence or
     * {@link #stop()} is called. Connections still being served when this
     * method returns keep running.
     *
     * @throws TransportException   if the source fails for good
     * @throws InterruptedException if the thread is interrupted other than by
     *                              {@link #stop()}
     */
    public void run(StreamRequestSource source) throws TransportException, InterruptedException {
        Objects.requireNonNull(source, "source");
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Dispatcher loop is already running");
        }
        synchronized (loopLock) {
            loopThread = Thread.currentThread();
        }
        log.info("Dispatcher loop started ({}, TLS {})", portGate, tlsTerminator == null ? "off" : "on");
        try {
            while (!stopRequested) {
                Optional<StreamRequest> next;
                try {
                    next = source.next();
                } catch (InterruptedException e) {
                    if (stopRequested) {
                        break;
                    }
                    throw e;
                }
                if (next.isEmpty()) {
                    log.info("Stream request sequence ended");
                    return;
                }
                dispatch(next.get());
            }
            log.info("Dispatcher loop stopped on request");
        } catch (TransportException e) {
            log.error("Transport failed, dispatcher loop cannot continue", e);
            throw e;
        } finally {
            synchronized (loopLock) {
                loopThread = null;
                if (stopRequested) {
                    // the interrupt was ours
                    Thread.interrupted();
                }
            }
            running.set(false);
        }
    }

    /**
     * Decides a single stream request. Visible for tests.
     */
    void dispatch(StreamRequest request) {
        metrics.received();
        RequestDescriptor descriptor = request.descriptor();
        Sensitive<RequestDescriptor> redacted = Sensitive.of(descriptor);

        // 端口闸门
        if (!portGate.admit(descriptor)) {
            log.debug("Rejecting stream request {}", redacted);
            metrics.rejected();
            reject(request, redacted);
            return;
        }
        // 连接上限
        if (inFlight.size() >= maxConnections) {
            log.warn("Connection limit of {} reached, rejecting stream request {}", maxConnections, redacted);
            metrics.rejectedOverLimit();
            reject(request, redacted);
            return;
        }

        Channel channel;
        try {
            channel = request.accept();
        } catch (IOException | RuntimeException e) {
            metrics.acceptFailed();
            ConnectionException failure = new ConnectionException(ConnectionStage.ACCEPT, redacted, e);
            log.warn(failure.getMessage());
            log.debug("Accept failure detail", failure);
            return;
        }
        metrics.accepted();
        log.debug("Accepted stream request {} on channel {}", redacted, channel.id().asShortText());

        ConnectionTask task = new ConnectionTask(descriptor, channel, tlsTerminator, httpBridge, requestHandler,
                metrics);
        inFlight.add(task);
        connections.add(channel);
        try {
            task.start().whenComplete((outcome, error) -> inFlight.remove(task));
        } catch (RuntimeException e) {
            inFlight.remove(task);
            task.fail(task.stage(), e);
        }
    }

    private void reject(StreamRequest request, Sensitive<RequestDescriptor> redacted) {
        try {
            request.reject();
        } catch (IOException | RuntimeException e) {
            metrics.rejectFailed();
            log.warn("Failed to reject stream request {}: {}", redacted, e.toString());
        }
    }

    /**
     * Interrupts the loop waiting for the next request. In-flight connections
     * are left alone.
     */
    public void stop() {
        synchronized (loopLock) {
            stopRequested = true;
            // once run has left the loop there is nobody to wake
            if (loopThread != null) {
                loopThread.interrupt();
            }
        }
    }

    /**
     * Closes every connection still being served.
     */
    public ChannelGroupFuture closeConnections() {
        log.info("Closing {} open connection(s)", connections.size());
        return connections.close();
    }

    /**
     * Waits for in-flight connections to end on their own.
     *
     * @return {@code true} if none is left
     */
    public boolean awaitConnections(Duration timeout) throws InterruptedException {
        CompletableFuture<?>[] pending = inFlight.stream()
                .map(ConnectionTask::completion)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Connection task completed exceptionally", e.getCause());
        }
    }

    public int inFlightConnections() {
        return inFlight.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    public DispatcherMetrics metrics() {
        return metrics;
    }
}
