package com.oniongateway.server.handler;

import com.oniongateway.core.http.HttpResponses;
import com.oniongateway.core.http.RequestHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

public class HelloWorldHandler implements RequestHandler {

    public static final String GREETING = "Hello, World!";

    @Override
    public FullHttpResponse handle(FullHttpRequest request) {
        String path = new QueryStringDecoder(request.uri()).path();
        if (!"/".equals(path)) {
            return HttpResponses.status(HttpResponseStatus.NOT_FOUND);
        }
        HttpMethod method = request.method();
        if (!HttpMethod.GET.equals(method) && !HttpMethod.HEAD.equals(method)) {
            FullHttpResponse response = HttpResponses.status(HttpResponseStatus.METHOD_NOT_ALLOWED);
            response.headers().set(HttpHeaderNames.ALLOW, "GET, HEAD");
            return response;
        }
        return HttpResponses.text(HttpResponseStatus.OK, GREETING);
    }
}
