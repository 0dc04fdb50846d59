package com.oniongateway.core.http;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Feeds data frames of an upgraded connection to the {@link WebSocketHandler}.
 * Control frames are consumed by {@link WebSocketServerProtocolHandler} first.
 */
@Slf4j
class WebSocketFrameDispatcher extends SimpleChannelInboundHandler<WebSocketFrame> {

    private final WebSocketHandler webSocketHandler;
    private boolean open;

    WebSocketFrameDispatcher(WebSocketHandler webSocketHandler) {
        this.webSocketHandler = Objects.requireNonNull(webSocketHandler, "webSocketHandler");
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            open = true;
            log.debug("WebSocket upgrade completed on channel {}", ctx.channel().id().asShortText());
            webSocketHandler.onOpen(ctx.channel());
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) throws Exception {
        webSocketHandler.onFrame(ctx.channel(), frame);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (open) {
            open = false;
            webSocketHandler.onClose(ctx.channel());
        }
        super.channelInactive(ctx);
    }
}
