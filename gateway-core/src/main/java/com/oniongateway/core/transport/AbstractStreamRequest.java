package com.oniongateway.core.transport;

import io.netty.channel.Channel;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class for transports that enforces the accept-or-reject-once contract.
 */
public abstract class AbstractStreamRequest implements StreamRequest {

    private final RequestDescriptor descriptor;
    private final AtomicBoolean consumed = new AtomicBoolean();

    protected AbstractStreamRequest(RequestDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    }

    @Override
    public final RequestDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public final Channel accept() throws IOException {
        consume("accept");
        return doAccept();
    }

    @Override
    public final void reject() throws IOException {
        consume("reject");
        doReject();
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    protected abstract Channel doAccept() throws IOException;

    protected abstract void doReject() throws IOException;

    private void consume(String operation) {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Stream request already consumed, cannot " + operation);
        }
    }
}
