package com.oniongateway.core.transport;

import java.util.Optional;

/**
 * Lazy, ordered sequence of stream requests produced by the overlay transport.
 */
public interface StreamRequestSource {

    /**
     * Blocks until the next stream request arrives.
     *
     * @return the next request, or empty once the sequence has ended for good
     * @throws TransportException   if the sequence cannot continue
     * @throws InterruptedException if the waiting thread is interrupted
     */
    Optional<StreamRequest> next() throws TransportException, InterruptedException;
}
