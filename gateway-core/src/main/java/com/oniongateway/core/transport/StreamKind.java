package com.oniongateway.core.transport;

/**
 * The kind of stream an overlay peer asked for.
 */
public enum StreamKind {
    BEGIN,
    BEGIN_DIR, // 目录流，不是 HTTP
    RESOLVE,
    OTHER
}
