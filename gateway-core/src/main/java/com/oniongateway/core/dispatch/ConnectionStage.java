package com.oniongateway.core.dispatch;

public enum ConnectionStage {
    REJECT,
    ACCEPT,
    TLS,
    SERVE
}
