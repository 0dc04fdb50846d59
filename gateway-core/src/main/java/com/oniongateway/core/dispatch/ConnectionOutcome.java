package com.oniongateway.core.dispatch;

/**
 * How a connection task ended.
 */
public enum ConnectionOutcome {
    /** The peer or the server closed the connection after serving. */
    COMPLETED,
    TLS_FAILED,
    SERVE_FAILED,
    /** Closed after the idle deadline passed without traffic. */
    IDLE_TIMEOUT
}
