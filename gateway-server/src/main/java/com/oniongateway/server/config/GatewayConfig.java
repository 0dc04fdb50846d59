package com.oniongateway.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.oniongateway.core.config.DispatcherConfig;
import com.oniongateway.core.config.GateConfig;
import com.oniongateway.core.config.HttpConfig;
import com.oniongateway.core.config.TlsConfig;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Root of the gateway configuration file.
 */
@Data
@NoArgsConstructor
public class GatewayConfig {

    @JsonProperty("service")
    private ServiceConfig service = new ServiceConfig();

    @JsonProperty("transport")
    private TransportConfig transport = new TransportConfig();

    @JsonProperty("gate")
    private GateConfig gate = new GateConfig();

    @JsonProperty("tls")
    private TlsConfig tls = new TlsConfig();

    @JsonProperty("http")
    private HttpConfig http = new HttpConfig();

    @JsonProperty("dispatcher")
    private DispatcherConfig dispatcher = new DispatcherConfig();

    @JsonProperty("logging")
    private LoggingConfig logging = new LoggingConfig();

    /** How long in-flight connections may finish after the loop stops. */
    @JsonProperty("shutdown_grace_seconds")
    private int shutdownGraceSeconds = 10;

    public void validate() {
        service.validate();
        transport.validate();
        gate.validate();
        tls.validate();
        http.validate();
        dispatcher.validate();
        if (shutdownGraceSeconds < 0) {
            throw new IllegalArgumentException("shutdown_grace_seconds must not be negative");
        }
    }
}
