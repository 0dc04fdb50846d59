package com.oniongateway.core.http;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;

/**
 * Application logic for connections upgraded to WebSocket. Ping, pong and close
 * frames are answered by the bridge and never reach the handler.
 */
public interface WebSocketHandler {

    default void onOpen(Channel channel) {
    }

    /**
     * Frames are released after this method returns; call
     * {@code frame.retainedDuplicate()} to write one back.
     */
    void onFrame(Channel channel, WebSocketFrame frame) throws Exception;

    default void onClose(Channel channel) {
    }
}
