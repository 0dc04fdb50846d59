package com.oniongateway.core.transport;

/**
 * The overlay transport failed in a way the request sequence cannot recover
 * from. This is distinct from the normal end of the sequence and is fatal to
 * the whole service.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
