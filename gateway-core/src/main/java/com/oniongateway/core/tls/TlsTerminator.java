package com.oniongateway.core.tls;

import com.oniongateway.core.config.TlsConfig;
import io.netty.channel.Channel;
import io.netty.handler.ssl.ApplicationProtocolConfig;
import io.netty.handler.ssl.ApplicationProtocolConfig.Protocol;
import io.netty.handler.ssl.ApplicationProtocolConfig.SelectedListenerFailureBehavior;
import io.netty.handler.ssl.ApplicationProtocolConfig.SelectorFailureBehavior;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLException;
import java.io.File;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;

/**
 * Turns an accepted raw channel into an encrypted one.
 * <p>
 * The {@link SslContext} is built once from the service identity and shared by
 * every connection; it is never mutated after construction.
 */
@Slf4j
public final class TlsTerminator {

    public static final String HANDLER_NAME = "tls";

    private final SslContext sslContext;
    private final long handshakeTimeoutMillis;

    public TlsTerminator(SslContext sslContext, long handshakeTimeoutMillis) {
        if (!Objects.requireNonNull(sslContext, "sslContext").isServer()) {
            throw new IllegalArgumentException("A server side SslContext is required");
        }
        if (handshakeTimeoutMillis < 0) {
            throw new IllegalArgumentException("handshakeTimeoutMillis must not be negative");
        }
        this.sslContext = sslContext;
        this.handshakeTimeoutMillis = handshakeTimeoutMillis;
    }

    /**
     * Loads the certificate chain and PKCS#8 key named by the configuration.
     */
    public static TlsTerminator fromConfig(TlsConfig config) throws SSLException {
        config.validate();
        if (!config.isEnabled()) {
            throw new IllegalArgumentException("TLS is disabled in the configuration");
        }
        File chain = new File(config.getCertificateChain());
        File key = new File(config.getPrivateKey());
        SslContextBuilder builder = SslContextBuilder.forServer(chain, key, config.getPrivateKeyPassword());
        SslContext context = withAlpn(builder, config.getAlpnProtocols()).build();
        log.info("Loaded TLS identity from {} (ALPN {})", chain, context.applicationProtocolNegotiator().protocols());
        return new TlsTerminator(context, config.getHandshakeTimeoutMillis());
    }

    public static TlsTerminator fromKeyMaterial(PrivateKey key, List<String> alpnProtocols,
            long handshakeTimeoutMillis, X509Certificate... chain) throws SSLException {
        SslContextBuilder builder = SslContextBuilder.forServer(key, chain);
        return new TlsTerminator(withAlpn(builder, alpnProtocols).build(), handshakeTimeoutMillis);
    }

    private static SslContextBuilder withAlpn(SslContextBuilder builder, List<String> protocols) {
        if (protocols == null || protocols.isEmpty()) {
            return builder;
        }
        return builder.applicationProtocolConfig(new ApplicationProtocolConfig(
                Protocol.ALPN,
                SelectorFailureBehavior.NO_ADVERTISE,
                SelectedListenerFailureBehavior.ACCEPT,
                protocols));
    }

    /**
     * Installs the TLS layer at the head of the channel pipeline. The handshake
     * starts once the channel reads the client hello.
     *
     * @return completes with the now encrypted channel, or fails with the
     *         handshake error (including the handshake deadline expiring)
     */
    public Future<Channel> handshake(Channel raw) {
        SslHandler sslHandler = sslContext.newHandler(raw.alloc());
        sslHandler.setHandshakeTimeoutMillis(handshakeTimeoutMillis);
        raw.pipeline().addFirst(HANDLER_NAME, sslHandler);
        return sslHandler.handshakeFuture();
    }

    public boolean isAlpnEnabled() {
        return !sslContext.applicationProtocolNegotiator().protocols().isEmpty();
    }

    public SslContext sslContext() {
        return sslContext;
    }

    public long handshakeTimeoutMillis() {
        return handshakeTimeoutMillis;
    }
}
