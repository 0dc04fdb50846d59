package com.oniongateway.server.handler;

import com.oniongateway.core.http.WebSocketHandler;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends every text or binary frame back to the peer.
 */
@Slf4j
public class EchoWebSocketHandler implements WebSocketHandler {

    @Override
    public void onOpen(Channel channel) {
        log.debug("WebSocket session opened: channel={}", channel.id());
    }

    @Override
    public void onFrame(Channel channel, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame || frame instanceof BinaryWebSocketFrame) {
            channel.writeAndFlush(frame.retainedDuplicate());
        } else {
            log.debug("Ignoring {} on channel {}", frame.getClass().getSimpleName(), channel.id());
        }
    }

    @Override
    public void onClose(Channel channel) {
        log.debug("WebSocket session closed: channel={}", channel.id());
    }
}
