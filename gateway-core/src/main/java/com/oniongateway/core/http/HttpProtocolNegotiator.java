package com.oniongateway.core.http;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.ssl.ApplicationProtocolNames;
import io.netty.handler.ssl.ApplicationProtocolNegotiationHandler;

/**
 * Waits for the TLS handshake and installs the HTTP flavour ALPN agreed on.
 * Nothing is decoded as HTTP before the handshake has succeeded.
 */
class HttpProtocolNegotiator extends ApplicationProtocolNegotiationHandler {

    private final HttpBridge bridge;
    private final RequestHandler requestHandler;

    HttpProtocolNegotiator(HttpBridge bridge, RequestHandler requestHandler) {
        super(ApplicationProtocolNames.HTTP_1_1);
        this.bridge = bridge;
        this.requestHandler = requestHandler;
    }

    @Override
    protected void configurePipeline(ChannelHandlerContext ctx, String protocol) {
        if (ApplicationProtocolNames.HTTP_2.equals(protocol)) {
            bridge.configureHttp2(ctx.pipeline(), requestHandler);
        } else if (ApplicationProtocolNames.HTTP_1_1.equals(protocol)) {
            bridge.configureHttp1(ctx.pipeline(), requestHandler);
        } else {
            throw new IllegalStateException("Unsupported application protocol: " + protocol);
        }
    }

    @Override
    protected void handshakeFailure(ChannelHandlerContext ctx, Throwable cause) {
        // reported by whoever owns the handshake future
        ctx.close();
    }
}
