package com.oniongateway.server.transport;

import com.oniongateway.core.transport.OverlayTransport;
import com.oniongateway.core.transport.RequestDescriptor;
import com.oniongateway.core.transport.ServiceHandle;
import com.oniongateway.core.transport.ServiceIdentity;
import com.oniongateway.core.transport.StreamRequestSource;
import com.oniongateway.core.transport.TransportException;
import com.oniongateway.server.config.ServiceConfig;
import com.oniongateway.server.config.TransportConfig;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Overlay transport backed by a tor daemon configured with {@code HiddenServicePort}
 * lines that forward each virtual port to a local TCP listener.
 * <p>
 * Every connection arriving on a local listener becomes a {@code BEGIN} stream
 * request whose declared port is the virtual port it was forwarded from.
 */
@Slf4j
public class ForwardedPortTransport implements OverlayTransport<ServiceConfig> {

    private final TransportConfig config;

    public ForwardedPortTransport(TransportConfig config) {
        this.config = config;
    }

    @Override
    public ForwardedServiceHandle launch(ServiceConfig serviceConfig) throws TransportException {
        ServiceIdentity identity = new ServiceIdentity(serviceConfig.getNickname(), resolveServiceName(serviceConfig));
        EventLoopGroup bossGroup = new NioEventLoopGroup(config.getAcceptorThreads(),
                new DefaultThreadFactory("forward-acceptor", true));
        EventLoopGroup workerGroup = new NioEventLoopGroup(config.getIoThreads(),
                new DefaultThreadFactory("forward-io", true));
        ForwardedRequestQueue queue = new ForwardedRequestQueue();
        Map<Integer, Channel> listeners = new LinkedHashMap<>();
        try {
            for (Map.Entry<Integer, Integer> forward : config.getForwardedPorts().entrySet()) {
                int virtualPort = forward.getKey();
                Channel listener = bind(bossGroup, workerGroup, queue, identity, virtualPort, forward.getValue());
                listeners.put(virtualPort, listener);
                log.info("Forwarding virtual port {} from {}", virtualPort, listener.localAddress());
            }
        } catch (Exception e) {
            // 绑定失败，释放已打开的监听和线程组
            listeners.values().forEach(Channel::close);
            bossGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            workerGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new TransportException("Failed to bind forwarded ports on " + config.getBindAddress(), e);
        }
        return new ForwardedServiceHandle(identity, queue, listeners, bossGroup, workerGroup);
    }

    private Channel bind(EventLoopGroup bossGroup, EventLoopGroup workerGroup, ForwardedRequestQueue queue,
                         ServiceIdentity identity, int virtualPort, int localPort) throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        // 声明端口取转发来源的虚拟端口
                        RequestDescriptor descriptor = RequestDescriptor.begin(identity.getServiceName(), virtualPort);
                        queue.offer(new ForwardedStreamRequest(descriptor, ch));
                    }
                });
        return bootstrap.bind(new InetSocketAddress(config.getBindAddress(), localPort)).sync().channel();
    }

    static String resolveServiceName(ServiceConfig serviceConfig) throws TransportException {
        String literal = serviceConfig.getServiceName();
        if (literal != null && !literal.isBlank()) {
            return literal.trim();
        }
        Path hostnameFile = Path.of(serviceConfig.getHostnameFile());
        try {
            String name = Files.readString(hostnameFile, StandardCharsets.US_ASCII).trim();
            if (name.isEmpty()) {
                throw new TransportException("Hostname file is empty: " + hostnameFile);
            }
            return name;
        } catch (IOException e) {
            throw new TransportException("Cannot read hostname file " + hostnameFile, e);
        }
    }

    /**
     * Handle on the running listeners. {@link #stopListening()} ends the stream
     * request sequence, {@link #close()} releases the event loops.
     */
    public static final class ForwardedServiceHandle implements ServiceHandle {

        private final ServiceIdentity identity;
        private final ForwardedRequestQueue queue;
        private final Map<Integer, Channel> listeners;
        private final EventLoopGroup bossGroup;
        private final EventLoopGroup workerGroup;
        private final AtomicBoolean closed = new AtomicBoolean();

        ForwardedServiceHandle(ServiceIdentity identity, ForwardedRequestQueue queue, Map<Integer, Channel> listeners,
                               EventLoopGroup bossGroup, EventLoopGroup workerGroup) {
            this.identity = identity;
            this.queue = queue;
            this.listeners = Collections.unmodifiableMap(listeners);
            this.bossGroup = bossGroup;
            this.workerGroup = workerGroup;
        }

        @Override
        public ServiceIdentity identity() {
            return identity;
        }

        @Override
        public StreamRequestSource streamRequests() {
            return queue;
        }

        /** Local address a virtual port is forwarded to. */
        public InetSocketAddress localAddress(int virtualPort) {
            Channel listener = listeners.get(virtualPort);
            if (listener == null) {
                throw new IllegalArgumentException("Virtual port " + virtualPort + " is not forwarded");
            }
            return (InetSocketAddress) listener.localAddress();
        }

        public void stopListening() {
            if (queue.isEnded()) {
                return;
            }
            List<Channel> open = new ArrayList<>(listeners.values());
            for (Channel listener : open) {
                listener.close().syncUninterruptibly();
            }
            queue.end();
            log.info("Stopped accepting forwarded connections");
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            stopListening();
            int discarded = queue.discardPending();
            if (discarded > 0) {
                log.info("Closed {} forwarded connection(s) that were never answered", discarded);
            }
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            log.info("Released hidden service {}", identity.getNickname());
        }
    }
}
