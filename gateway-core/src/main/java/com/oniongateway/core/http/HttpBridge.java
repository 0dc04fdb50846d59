package com.oniongateway.core.http;

import com.oniongateway.core.config.HttpConfig;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpServerExpectContinueHandler;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http2.Http2FrameCodecBuilder;
import io.netty.handler.codec.http2.Http2MultiplexHandler;
import io.netty.handler.codec.http2.Http2StreamChannel;
import io.netty.handler.codec.http2.Http2StreamFrameToHttpObjectCodec;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Installs HTTP serving on a prepared channel.
 * <p>
 * On a TLS channel the protocol is chosen once the handshake completes: HTTP/2
 * when ALPN settled on {@code h2}, HTTP/1.1 otherwise. A plaintext channel is
 * served as HTTP/1.1 right away. HTTP/1.1 connections serve any number of
 * exchanges and may be upgraded to WebSocket on the configured path.
 * <p>
 * Handlers are inserted ahead of the handler named {@link #TAIL_HANDLER} when
 * the pipeline has one, so a connection level handler can stay last.
 */
@Slf4j
public final class HttpBridge implements AutoCloseable {

    public static final String TAIL_HANDLER = "connection-tail";

    private static final int MAX_CHUNK_SIZE = 8192;

    private final HttpConfig config;
    private final WebSocketHandler webSocketHandler;
    private final EventExecutorGroup handlerExecutor;

    public HttpBridge(HttpConfig config) {
        this(config, null);
    }

    /**
     * @param webSocketHandler serves upgraded connections, {@code null} turns
     *                         upgrades off
     */
    public HttpBridge(HttpConfig config, WebSocketHandler webSocketHandler) {
        config.validate();
        this.config = config;
        this.webSocketHandler = webSocketHandler;
        this.handlerExecutor = new DefaultEventExecutorGroup(config.getHandlerThreads(),
                new DefaultThreadFactory("request-handler", true));
    }

    /**
     * Starts serving HTTP on the channel.
     *
     * @return the channel's close future, completing when the peer or an error
     *         ends the connection
     */
    public ChannelFuture serve(Channel channel, RequestHandler requestHandler) {
        Objects.requireNonNull(requestHandler, "requestHandler");
        ChannelPipeline pipeline = channel.pipeline();
        if (pipeline.get(SslHandler.class) != null) {
            insert(pipeline, "protocol-negotiation", new HttpProtocolNegotiator(this, requestHandler));
        } else {
            configureHttp1(pipeline, requestHandler);
        }
        return channel.closeFuture();
    }

    void configureHttp1(ChannelPipeline pipeline, RequestHandler requestHandler) {
        addIdleHandler(pipeline);
        insert(pipeline, "http-codec",
                new HttpServerCodec(config.getMaxInitialLineLength(), config.getMaxHeaderSize(), MAX_CHUNK_SIZE));
        insert(pipeline, "http-expect-continue", new HttpServerExpectContinueHandler());
        insert(pipeline, "http-aggregator", new HttpObjectAggregator(config.getMaxContentLength()));
        if (isWebSocketEnabled()) {
            insert(pipeline, "websocket-protocol",
                    new WebSocketServerProtocolHandler(config.getWebsocketPath(), null, true));
            insert(pipeline, handlerExecutor, "websocket-frames", new WebSocketFrameDispatcher(webSocketHandler));
        }
        insert(pipeline, handlerExecutor, "request-dispatch", new RequestDispatchHandler(requestHandler));
    }

    void configureHttp2(ChannelPipeline pipeline, RequestHandler requestHandler) {
        addIdleHandler(pipeline);
        insert(pipeline, "http2-codec", Http2FrameCodecBuilder.forServer().build());
        insert(pipeline, "http2-multiplex", new Http2MultiplexHandler(new ChannelInitializer<Http2StreamChannel>() {
            @Override
            protected void initChannel(Http2StreamChannel stream) {
                stream.pipeline().addLast(new Http2StreamFrameToHttpObjectCodec(true));
                stream.pipeline().addLast(new HttpObjectAggregator(config.getMaxContentLength()));
                stream.pipeline().addLast(handlerExecutor, "request-dispatch",
                        new RequestDispatchHandler(requestHandler));
                stream.pipeline().addLast(new StreamErrorHandler());
            }
        }));
    }

    public boolean isWebSocketEnabled() {
        return webSocketHandler != null && config.isWebSocketEnabled();
    }

    public HttpConfig config() {
        return config;
    }

    private void addIdleHandler(ChannelPipeline pipeline) {
        if (config.getIdleTimeoutSeconds() > 0) {
            insert(pipeline, "idle-state",
                    new IdleStateHandler(0, 0, config.getIdleTimeoutSeconds(), TimeUnit.SECONDS));
        }
    }

    private static void insert(ChannelPipeline pipeline, String name, ChannelHandler handler) {
        insert(pipeline, null, name, handler);
    }

    private static void insert(ChannelPipeline pipeline, EventExecutorGroup group, String name,
            ChannelHandler handler) {
        if (pipeline.get(TAIL_HANDLER) != null) {
            pipeline.addBefore(group, TAIL_HANDLER, name, handler);
        } else {
            pipeline.addLast(group, name, handler);
        }
    }

    /**
     * Stops the request handler threads. Connections still open stop being
     * answered.
     */
    @Override
    public void close() {
        Future<?> terminated = handlerExecutor.shutdownGracefully(0, 5, TimeUnit.SECONDS);
        terminated.awaitUninterruptibly();
        log.debug("Request handler executor terminated");
    }

    /** Errors on a single HTTP/2 stream end that stream only. */
    private static final class StreamErrorHandler extends ChannelInboundHandlerAdapter {

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.debug("HTTP/2 stream {} failed: {}", ctx.channel().id().asShortText(), cause.toString());
            ctx.close();
        }
    }
}
