package com.oniongateway.core.transport;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Protocol-level intent of a stream request: what kind of stream the remote peer
 * opened and which destination it declared.
 * <p>
 * The descriptor identifies what a peer is doing on the hidden service and must
 * only reach logs wrapped in {@link com.oniongateway.core.util.Sensitive}.
 */
@Value
@Builder
public class RequestDescriptor {

    @NonNull
    StreamKind kind;

    /** Target address as declared by the peer, may be empty. */
    @Builder.Default
    String address = "";

    /** Declared destination port, 0 when the kind has none. */
    int port;

    public static RequestDescriptor begin(String address, int port) {
        return RequestDescriptor.builder().kind(StreamKind.BEGIN).address(address).port(port).build();
    }

    @Override
    public String toString() {
        return kind + " " + address + ":" + port;
    }
}
