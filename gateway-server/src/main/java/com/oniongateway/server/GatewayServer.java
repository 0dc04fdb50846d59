package com.oniongateway.server;

import com.oniongateway.core.dispatch.ConnectionDispatcher;
import com.oniongateway.core.gate.PortGate;
import com.oniongateway.core.http.HttpBridge;
import com.oniongateway.core.http.RequestHandler;
import com.oniongateway.core.http.WebSocketHandler;
import com.oniongateway.core.tls.TlsTerminator;
import com.oniongateway.core.transport.OverlayTransport;
import com.oniongateway.core.transport.ServiceHandle;
import com.oniongateway.core.transport.TransportException;
import com.oniongateway.core.util.Sensitive;
import com.oniongateway.server.config.GatewayConfig;
import com.oniongateway.server.config.ServiceConfig;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Wires the overlay transport, gate, TLS terminator and HTTP bridge together and
 * runs the dispatch loop until the stream request sequence ends or
 * {@link #shutdown()} is called.
 */
@Slf4j
public class GatewayServer {

    private final GatewayConfig config;
    private final OverlayTransport<ServiceConfig> transport;
    private final RequestHandler requestHandler;
    private final WebSocketHandler webSocketHandler;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile ConnectionDispatcher dispatcher;
    private volatile Consumer<ServiceHandle> readyListener = handle -> {
    };

    public GatewayServer(GatewayConfig config, OverlayTransport<ServiceConfig> transport,
                         RequestHandler requestHandler, WebSocketHandler webSocketHandler) {
        this.config = config;
        this.transport = transport;
        this.requestHandler = requestHandler;
        this.webSocketHandler = webSocketHandler;
    }

    /** Called with the live handle once the service is reachable. */
    public void onReady(Consumer<ServiceHandle> listener) {
        this.readyListener = listener;
    }

    /**
     * Blocks until the gateway has stopped. Returns normally on a clean exit,
     * a transport failure ends the process.
     */
    public void run() throws TransportException, InterruptedException, SSLException {
        Sensitive.setSafeLogging(config.getLogging().isSafeLogging());
        if (!Sensitive.isSafeLogging()) {
            log.warn("Safe logging is disabled, request descriptors will appear in logs");
        }
        try {
            TlsTerminator tls = null;
            if (config.getTls().isEnabled()) {
                tls = TlsTerminator.fromConfig(config.getTls());
            } else {
                log.warn("TLS termination is disabled, serving plaintext HTTP");
            }
            try (HttpBridge bridge = new HttpBridge(config.getHttp(), webSocketHandler)) {
                ConnectionDispatcher dispatcher = ConnectionDispatcher.builder()
                        .portGate(PortGate.fromConfig(config.getGate()))
                        .tlsTerminator(tls)
                        .httpBridge(bridge)
                        .requestHandler(requestHandler)
                        .config(config.getDispatcher())
                        .build();
                this.dispatcher = dispatcher;
                try (ServiceHandle handle = transport.launch(config.getService())) {
                    log.info("Service name: {}", handle.identity().getServiceName());
                    log.info("Onion service {} ready to serve connections", handle.identity().getNickname());
                    readyListener.accept(handle);
                    dispatcher.run(handle.streamRequests());
                    // 序列结束后，给已建立的连接一个宽限期
                    drain(dispatcher);
                }
                log.info("Onion service exited cleanly: {}", dispatcher.metrics());
            }
        } finally {
            terminated.countDown();
        }
    }

    /** Stops pulling new stream requests. Safe to call from any thread. */
    public void shutdown() {
        ConnectionDispatcher current = dispatcher;
        if (current != null) {
            current.stop();
        }
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminated.await(timeout, unit);
    }

    public ConnectionDispatcher dispatcher() {
        return dispatcher;
    }

    private void drain(ConnectionDispatcher dispatcher) throws InterruptedException {
        int open = dispatcher.inFlightConnections();
        if (open == 0) {
            return;
        }
        Duration grace = Duration.ofSeconds(config.getShutdownGraceSeconds());
        log.info("Waiting up to {}s for {} open connection(s)", grace.getSeconds(), open);
        if (!dispatcher.awaitConnections(grace)) {
            log.warn("Closing {} connection(s) still open after the grace period", dispatcher.inFlightConnections());
            dispatcher.closeConnections().awaitUninterruptibly(grace.toMillis());
        }
    }
}
