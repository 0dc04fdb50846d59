package com.oniongateway.core.transport;

import io.netty.channel.Channel;

import java.io.IOException;

/**
 * One inbound logical connection attempt surfaced by the overlay transport.
 * <p>
 * Exactly one of {@link #accept()} and {@link #reject()} must be invoked per
 * request. Invoking neither leaks the underlying circuit, invoking both is an
 * error.
 */
public interface StreamRequest {

    RequestDescriptor descriptor();

    /**
     * Accepts the stream and hands over the raw duplex channel. The channel is
     * registered with an event loop and has auto-read disabled; the caller owns
     * it from here on.
     *
     * @throws IOException if the circuit was torn down before the stream could
     *                     be opened
     */
    Channel accept() throws IOException;

    /**
     * Refuses the stream without transferring any data.
     *
     * @throws IOException if the underlying channel is already gone
     */
    void reject() throws IOException;
}
