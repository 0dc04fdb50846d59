package com.oniongateway.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local endpoints the overlay daemon forwards hidden service ports to.
 */
@Data
@NoArgsConstructor
public class TransportConfig {

    @JsonProperty("bind_address")
    private String bindAddress = "127.0.0.1";

    /** Virtual (hidden service) port to local port. Local port 0 picks a free one. */
    @JsonProperty("forwarded_ports")
    private Map<Integer, Integer> forwardedPorts = new LinkedHashMap<>(Map.of(80, 8080, 443, 8443));

    @JsonProperty("acceptor_threads")
    private int acceptorThreads = 1;

    @JsonProperty("io_threads")
    private int ioThreads = 0; // 0 用 Netty 默认值

    public void validate() {
        if (bindAddress == null || bindAddress.isBlank()) {
            throw new IllegalArgumentException("transport.bind_address must not be empty");
        }
        if (forwardedPorts == null || forwardedPorts.isEmpty()) {
            throw new IllegalArgumentException("transport.forwarded_ports must map at least one port");
        }
        forwardedPorts.forEach((virtualPort, localPort) -> {
            if (virtualPort == null || virtualPort < 1 || virtualPort > 65535) {
                throw new IllegalArgumentException("transport.forwarded_ports has an invalid virtual port: "
                        + virtualPort);
            }
            if (localPort == null || localPort < 0 || localPort > 65535) {
                throw new IllegalArgumentException("transport.forwarded_ports has an invalid local port: "
                        + localPort);
            }
        });
        if (acceptorThreads < 1 || ioThreads < 0) {
            throw new IllegalArgumentException("transport thread counts are invalid");
        }
    }
}
