package com.oniongateway.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * HTTP serving settings.
 */
@Data
@NoArgsConstructor
public class HttpConfig {

    @JsonProperty("max_initial_line_length")
    private int maxInitialLineLength = 4096;

    @JsonProperty("max_header_size")
    private int maxHeaderSize = 8192;

    /** Largest aggregated request body in bytes. */
    @JsonProperty("max_content_length")
    private int maxContentLength = 1024 * 1024;

    /** Connections with no traffic in either direction for this long are closed. 0 disables. */
    @JsonProperty("idle_timeout_seconds")
    private int idleTimeoutSeconds = 120;

    /** Path accepting WebSocket upgrades, null or empty disables upgrades. */
    @JsonProperty("websocket_path")
    private String websocketPath = "/ws";

    /** Threads running the request handler. */
    @JsonProperty("handler_threads")
    private int handlerThreads = 16;

    @JsonIgnore
    public boolean isWebSocketEnabled() {
        return websocketPath != null && !websocketPath.isEmpty();
    }

    public void validate() {
        if (maxInitialLineLength <= 0 || maxHeaderSize <= 0 || maxContentLength <= 0) {
            throw new IllegalArgumentException("http size limits must be positive");
        }
        if (idleTimeoutSeconds < 0) {
            throw new IllegalArgumentException("http.idle_timeout_seconds must not be negative");
        }
        if (handlerThreads <= 0) {
            throw new IllegalArgumentException("http.handler_threads must be positive");
        }
        if (isWebSocketEnabled() && !websocketPath.startsWith("/")) {
            throw new IllegalArgumentException("http.websocket_path must start with '/'");
        }
    }
}
