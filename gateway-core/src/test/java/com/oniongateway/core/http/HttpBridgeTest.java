package com.oniongateway.core.http;

import com.oniongateway.core.config.HttpConfig;
import com.oniongateway.core.support.Await;
import com.oniongateway.core.support.HttpTestClient;
import com.oniongateway.core.support.RawTestClient;
import io.netty.bootstrap.Bootstrap;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.DefaultEventLoopGroup;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.local.LocalAddress;
import io.netty.channel.local.LocalChannel;
import io.netty.channel.local.LocalServerChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HttpBridgeTest {

    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();

    private EventLoopGroup group;
    private HttpBridge bridge;
    private Channel listener;
    private LocalAddress address;

    @BeforeEach
    void setUp() throws Exception {
        HttpConfig config = new HttpConfig();
        config.setMaxContentLength(1024);
        bridge = new HttpBridge(config, new EchoFrames());
        group = new DefaultEventLoopGroup(2);
        address = new LocalAddress("http-bridge-" + UUID.randomUUID());
        RequestHandler handler = this::handle;
        listener = new ServerBootstrap()
                .group(group)
                .channel(LocalServerChannel.class)
                .childHandler(new ChannelInitializer<LocalChannel>() {
                    @Override
                    protected void initChannel(LocalChannel ch) {
                        bridge.serve(ch, handler);
                    }
                })
                .bind(address).sync().channel();
    }

    @AfterEach
    void tearDown() {
        listener.close().syncUninterruptibly();
        bridge.close();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private FullHttpResponse handle(FullHttpRequest request) throws Exception {
        switch (request.uri()) {
            case "/boom":
                throw new IllegalStateException("handler exploded");
            case "/nothing":
                return null;
            case "/slow":
                Thread.sleep(200);
                return HttpResponses.text(HttpResponseStatus.OK, "slow");
            default:
                return HttpResponses.text(HttpResponseStatus.OK, request.method() + " " + request.uri());
        }
    }

    @Test
    void servesPlaintextRequest() throws Exception {
        try (HttpTestClient client = HttpTestClient.connect(group, address, null)) {
            HttpTestClient.Reply reply = client.get("/index.html");

            assertEquals(HttpResponseStatus.OK, reply.status());
            assertEquals("GET /index.html", reply.body());
            assertEquals("15", reply.headers().get(HttpHeaderNames.CONTENT_LENGTH));
        }
    }

    @Test
    void answersPipelinedRequestsInOrder() throws Exception {
        try (RawTestClient client = RawTestClient.connect(group, address)) {
            client.write("GET /slow HTTP/1.1\r\nHost: example.onion\r\n\r\n"
                    + "GET /fast HTTP/1.1\r\nHost: example.onion\r\n\r\n");

            Await.until(() -> client.received().contains("GET /fast"), "second response arrived");
            String received = client.received();
            assertTrue(received.indexOf("slow") < received.indexOf("GET /fast"), received);
        }
    }

    @Test
    void malformedRequestGetsBadRequestAndClose() throws Exception {
        RawTestClient client = RawTestClient.connect(group, address);
        client.write("GET / HTTP/9.x\r\nHost: example.onion\r\n\r\n");

        assertTrue(client.awaitClosed());
        assertTrue(client.received().startsWith("HTTP/1.1 400 Bad Request"), client.received());
    }

    @Test
    void handlerFailureGetsServerErrorAndConnectionSurvives() throws Exception {
        try (HttpTestClient client = HttpTestClient.connect(group, address, null)) {
            assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, client.get("/boom").status());
            assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, client.get("/nothing").status());
            assertEquals(HttpResponseStatus.OK, client.get("/").status());
        }
    }

    @Test
    void honoursConnectionClose() throws Exception {
        HttpTestClient client = HttpTestClient.connect(group, address, null);
        FullHttpRequest request = HttpTestClient.request(HttpMethod.GET, "/bye");
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        client.send(request);

        HttpTestClient.Reply reply = client.nextReply();
        assertEquals("GET /bye", reply.body());
        assertEquals(HttpHeaderValues.CLOSE.toString(), reply.headers().get(HttpHeaderNames.CONNECTION));
        assertTrue(client.awaitClosed());
    }

    @Test
    void rejectsOversizedBody() throws Exception {
        try (RawTestClient client = RawTestClient.connect(group, address)) {
            client.write("POST /upload HTTP/1.1\r\nHost: example.onion\r\nContent-Length: 4096\r\n\r\n");

            Await.until(() -> client.received().contains("413"), "413 response");
        }
    }

    @Test
    void upgradesToWebSocketAndEchoes() throws Exception {
        CompletableFuture<Void> handshake = new CompletableFuture<>();
        BlockingQueue<String> echoes = new LinkedBlockingQueue<>();
        Channel channel = new Bootstrap()
                .group(group)
                .channel(LocalChannel.class)
                .handler(new ChannelInitializer<LocalChannel>() {
                    @Override
                    protected void initChannel(LocalChannel ch) {
                        ch.pipeline().addLast(new HttpClientCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(8192));
                        ch.pipeline().addLast(new WebSocketClientProtocolHandler(
                                WebSocketClientHandshakerFactory.newHandshaker(URI.create("ws://example.onion/ws"),
                                        WebSocketVersion.V13, null, false, new DefaultHttpHeaders())));
                        ch.pipeline().addLast(new SimpleChannelInboundHandler<TextWebSocketFrame>() {
                            @Override
                            public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
                                if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                                    handshake.complete(null);
                                }
                                super.userEventTriggered(ctx, evt);
                            }

                            @Override
                            protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
                                echoes.add(frame.text());
                            }
                        });
                    }
                })
                .connect(address).sync().channel();

        handshake.get(5, TimeUnit.SECONDS);
        channel.writeAndFlush(new TextWebSocketFrame("ping"));
        assertEquals("ping", echoes.poll(5, TimeUnit.SECONDS));
        assertEquals(1, opened.get());

        channel.close().sync();
        Await.until(() -> closed.get() == 1, "close callback");
    }

    private final class EchoFrames implements WebSocketHandler {

        @Override
        public void onOpen(Channel channel) {
            opened.incrementAndGet();
        }

        @Override
        public void onFrame(Channel channel, WebSocketFrame frame) {
            if (frame instanceof TextWebSocketFrame) {
                channel.writeAndFlush(new TextWebSocketFrame(((TextWebSocketFrame) frame).text()));
            }
        }

        @Override
        public void onClose(Channel channel) {
            closed.incrementAndGet();
        }
    }
}
