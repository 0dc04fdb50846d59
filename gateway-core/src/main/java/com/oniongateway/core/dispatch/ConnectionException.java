package com.oniongateway.core.dispatch;

import com.oniongateway.core.transport.RequestDescriptor;
import com.oniongateway.core.util.Sensitive;
import lombok.Getter;

import java.io.IOException;

/**
 * A failure confined to one connection. The message names the stage and the
 * request descriptor, the latter redacted while safe logging is on.
 */
@Getter
public class ConnectionException extends IOException {

    private final ConnectionStage stage;
    private final Sensitive<RequestDescriptor> descriptor;

    public ConnectionException(ConnectionStage stage, Sensitive<RequestDescriptor> descriptor, Throwable cause) {
        super(describe(stage, descriptor, cause), cause);
        this.stage = stage;
        this.descriptor = descriptor;
    }

    private static String describe(ConnectionStage stage, Sensitive<RequestDescriptor> descriptor, Throwable cause) {
        String reason = cause == null ? "unknown cause" : cause.toString();
        return "Connection " + descriptor + " failed during " + stage + ": " + reason;
    }
}
