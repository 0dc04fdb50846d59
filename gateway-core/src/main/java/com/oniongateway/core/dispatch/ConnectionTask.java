package com.oniongateway.core.dispatch;

import com.oniongateway.core.http.HttpBridge;
import com.oniongateway.core.http.RequestHandler;
import com.oniongateway.core.tls.TlsTerminator;
import com.oniongateway.core.transport.RequestDescriptor;
import com.oniongateway.core.util.Sensitive;
import io.netty.channel.Channel;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One accepted connection, from TLS handshake through HTTP serving to close.
 * <p>
 * The task owns its channel exclusively and runs on the channel's event loop
 * (request handling on the bridge's executor group); it shares nothing mutable
 * with sibling tasks or with the dispatcher loop. Every failure is recorded and
 * logged here and only ever closes this task's channel.
 */
@Slf4j
final class ConnectionTask {

    private final Sensitive<RequestDescriptor> descriptor;
    private final Channel channel;
    private final TlsTerminator tlsTerminator;
    private final HttpBridge httpBridge;
    private final RequestHandler requestHandler;
    private final DispatcherMetrics metrics;

    private final CompletableFuture<ConnectionOutcome> completion = new CompletableFuture<>();
    private final AtomicReference<ConnectionOutcome> terminal = new AtomicReference<>();
    private volatile ConnectionStage stage = ConnectionStage.TLS;
    private volatile Future<Channel> handshake;

    ConnectionTask(RequestDescriptor descriptor, Channel channel, TlsTerminator tlsTerminator,
            HttpBridge httpBridge, RequestHandler requestHandler, DispatcherMetrics metrics) {
        this.descriptor = Sensitive.of(descriptor);
        this.channel = channel;
        this.tlsTerminator = tlsTerminator;
        this.httpBridge = httpBridge;
        this.requestHandler = requestHandler;
        this.metrics = metrics;
    }

    /**
     * Wires the pipeline and lets the channel start reading. Returns
     * immediately; the future completes once the channel is closed.
     */
    CompletableFuture<ConnectionOutcome> start() {
        if (!channel.isRegistered()) {
            // peer went away between accept and start; pipeline changes would never run
            fail(tlsTerminator != null ? ConnectionStage.TLS : ConnectionStage.SERVE, new ClosedChannelException());
            finish();
            return completion;
        }
        channel.pipeline().addLast(HttpBridge.TAIL_HANDLER, new ConnectionGuard(this));
        if (tlsTerminator != null) {
            Future<Channel> handshakeFuture = tlsTerminator.handshake(channel);
            handshake = handshakeFuture;
            handshakeFuture.addListener(future -> onHandshake(future));
        } else {
            stage = ConnectionStage.SERVE;
        }
        httpBridge.serve(channel, requestHandler);
        channel.closeFuture().addListener(future -> finish());

        channel.config().setAutoRead(true);
        channel.read();
        return completion;
    }

    ConnectionStage stage() {
        return stage;
    }

    Channel channel() {
        return channel;
    }

    CompletableFuture<ConnectionOutcome> completion() {
        return completion;
    }

    void fail(ConnectionStage failedStage, Throwable cause) {
        ConnectionOutcome outcome = failedStage == ConnectionStage.TLS
                ? ConnectionOutcome.TLS_FAILED
                : ConnectionOutcome.SERVE_FAILED;
        if (terminal.compareAndSet(null, outcome)) {
            ConnectionException failure = new ConnectionException(failedStage, descriptor, cause);
            log.warn(failure.getMessage());
            log.debug("Failure detail for channel {}", channel.id().asShortText(), failure);
        }
        channel.close();
    }

    void idle() {
        if (terminal.compareAndSet(null, ConnectionOutcome.IDLE_TIMEOUT)) {
            log.info("Closing idle connection {}", descriptor);
        }
        channel.close();
    }

    private void onHandshake(Future<?> future) {
        if (future.isSuccess()) {
            stage = ConnectionStage.SERVE;
            log.debug("TLS established for {} on channel {}", descriptor, channel.id().asShortText());
        } else {
            fail(ConnectionStage.TLS, future.cause());
        }
    }

    private void finish() {
        Future<Channel> pending = handshake;
        if (pending != null && !pending.isDone()) {
            if (channel.isRegistered()) {
                // the handshake future fails right after the close; wait for its cause
                pending.addListener(future -> finish());
                return;
            }
            fail(ConnectionStage.TLS, new ClosedChannelException());
        }
        terminal.compareAndSet(null, ConnectionOutcome.COMPLETED);
        ConnectionOutcome outcome = terminal.get();
        if (completion.complete(outcome)) {
            metrics.outcome(outcome);
            log.debug("Connection {} on channel {} ended: {}", descriptor, channel.id().asShortText(), outcome);
        }
    }
}
