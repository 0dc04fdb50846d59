package com.oniongateway.core.http;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;

/**
 * Application logic turning one HTTP request into one HTTP response.
 * <p>
 * A single instance serves every connection concurrently; guarding internal
 * mutable state is the implementation's responsibility. The request is released
 * after the call returns, so implementations must copy or retain anything they
 * keep. Implementations must not block indefinitely.
 */
@FunctionalInterface
public interface RequestHandler {

    FullHttpResponse handle(FullHttpRequest request) throws Exception;
}
