package com.oniongateway.core.transport;

/**
 * Entry point into an overlay network implementation.
 *
 * @param <C> transport specific service configuration
 */
public interface OverlayTransport<C> {

    /**
     * Registers the hidden service and returns once it is reachable.
     */
    ServiceHandle launch(C serviceConfig) throws TransportException;
}
