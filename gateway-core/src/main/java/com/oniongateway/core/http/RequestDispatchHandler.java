package com.oniongateway.core.http;

import com.oniongateway.core.util.Sensitive;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;

/**
 * Hands aggregated requests to the {@link RequestHandler}, one at a time per connection.
 */
@Slf4j
class RequestDispatchHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final RequestHandler requestHandler;

    RequestDispatchHandler(RequestHandler requestHandler) {
        this.requestHandler = Objects.requireNonNull(requestHandler, "requestHandler");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        // 解码失败：回 400 并关闭
        if (!request.decoderResult().isSuccess()) {
            log.debug("Malformed request on channel {}: {}", ctx.channel().id().asShortText(),
                    request.decoderResult().cause().toString());
            FullHttpResponse response = HttpResponses.status(BAD_REQUEST);
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        FullHttpResponse response = invokeHandler(ctx, request);

        if (!response.headers().contains(HttpHeaderNames.CONTENT_LENGTH) && !HttpUtil.isTransferEncodingChunked(response)) {
            HttpUtil.setContentLength(response, response.content().readableBytes());
        }
        if (keepAlive) {
            if (!request.protocolVersion().isKeepAliveDefault()) {
                response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            }
        } else {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        }

        ChannelFuture written = ctx.writeAndFlush(response);
        if (!keepAlive) {
            written.addListener(ChannelFutureListener.CLOSE);
        }
    }

    private FullHttpResponse invokeHandler(ChannelHandlerContext ctx, FullHttpRequest request) {
        try {
            FullHttpResponse response = requestHandler.handle(request);
            if (response == null) {
                throw new IllegalStateException("Request handler returned no response");
            }
            return response;
        } catch (Exception e) {
            log.warn("Request handler failed for {} {} on channel {}", request.method(), Sensitive.of(request.uri()),
                    ctx.channel().id().asShortText(), e);
            return HttpResponses.status(INTERNAL_SERVER_ERROR);
        }
    }
}
