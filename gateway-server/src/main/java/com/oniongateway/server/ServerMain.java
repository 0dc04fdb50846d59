package com.oniongateway.server;

import com.oniongateway.server.config.GatewayConfig;
import com.oniongateway.server.config.GatewayConfigLoader;
import com.oniongateway.server.handler.EchoWebSocketHandler;
import com.oniongateway.server.handler.HelloWorldHandler;
import com.oniongateway.server.transport.ForwardedPortTransport;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Slf4j
public class ServerMain {

    public static void main(String[] args) throws Exception {
        GatewayConfig config = args.length > 0
                ? GatewayConfigLoader.load(Path.of(args[0]))
                : GatewayConfigLoader.loadDefault();

        GatewayServer server = new GatewayServer(config,
                new ForwardedPortTransport(config.getTransport()),
                new HelloWorldHandler(),
                new EchoWebSocketHandler());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down onion gateway...");
            server.shutdown();
            try {
                if (!server.awaitTermination(config.getShutdownGraceSeconds() + 5L, TimeUnit.SECONDS)) {
                    log.warn("Gateway did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for the gateway to stop");
            }
        }, "gateway-shutdown"));

        server.run();
    }
}
