package com.oniongateway.core.transport;

/**
 * Process-wide registration of the running hidden service.
 * <p>
 * Held for the whole lifetime of the dispatch loop and closed exactly once,
 * after {@link #streamRequests()} is exhausted.
 */
public interface ServiceHandle extends AutoCloseable {

    ServiceIdentity identity();

    StreamRequestSource streamRequests();

    @Override
    void close();
}
