package com.oniongateway.server.transport;

import com.oniongateway.core.transport.AbstractStreamRequest;
import com.oniongateway.core.transport.RequestDescriptor;
import io.netty.channel.Channel;

import java.io.IOException;

/**
 * A forwarded TCP connection that has not been answered yet. The channel stays
 * registered with auto-read off until the dispatcher decides.
 */
final class ForwardedStreamRequest extends AbstractStreamRequest {

    private final Channel channel;

    ForwardedStreamRequest(RequestDescriptor descriptor, Channel channel) {
        super(descriptor);
        this.channel = channel;
    }

    @Override
    protected Channel doAccept() throws IOException {
        if (!channel.isActive()) {
            throw new IOException("Peer closed the stream before it was accepted");
        }
        return channel;
    }

    @Override
    protected void doReject() {
        channel.close();
    }

    Channel channel() {
        return channel;
    }
}
