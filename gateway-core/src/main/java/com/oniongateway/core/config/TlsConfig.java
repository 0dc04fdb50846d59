package com.oniongateway.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.netty.handler.ssl.ApplicationProtocolNames;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * TLS identity and handshake settings.
 */
@Data
@NoArgsConstructor
public class TlsConfig {

    private static final Set<String> SUPPORTED_PROTOCOLS = Set.of(
            ApplicationProtocolNames.HTTP_2, ApplicationProtocolNames.HTTP_1_1);

    /** When false admitted streams are served as plaintext HTTP/1.1. */
    @JsonProperty("enabled")
    private boolean enabled = true;

    /** PEM file holding the certificate chain, leaf first. */
    @JsonProperty("certificate_chain")
    private String certificateChain;

    /** PEM file holding the PKCS#8 private key. */
    @JsonProperty("private_key")
    private String privateKey;

    @JsonProperty("private_key_password")
    private String privateKeyPassword;

    /** 0 disables the handshake deadline. */
    @JsonProperty("handshake_timeout_millis")
    private long handshakeTimeoutMillis = 10_000;

    /** ALPN protocols in preference order; empty disables ALPN. */
    @JsonProperty("alpn_protocols")
    private List<String> alpnProtocols = new ArrayList<>(
            List.of(ApplicationProtocolNames.HTTP_2, ApplicationProtocolNames.HTTP_1_1));

    public void validate() {
        if (!enabled) {
            return;
        }
        if (certificateChain == null || certificateChain.isBlank()) {
            throw new IllegalArgumentException("tls.certificate_chain is required when TLS is enabled");
        }
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalArgumentException("tls.private_key is required when TLS is enabled");
        }
        if (handshakeTimeoutMillis < 0) {
            throw new IllegalArgumentException("tls.handshake_timeout_millis must not be negative");
        }
        if (alpnProtocols != null) {
            for (String protocol : alpnProtocols) {
                if (!SUPPORTED_PROTOCOLS.contains(protocol)) {
                    throw new IllegalArgumentException("tls.alpn_protocols contains unsupported protocol: " + protocol);
                }
            }
        }
    }
}
