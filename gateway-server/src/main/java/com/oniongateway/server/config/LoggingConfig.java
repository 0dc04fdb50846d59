package com.oniongateway.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class LoggingConfig {

    /** Redact request descriptors in logs. Only turn off for local debugging. */
    @JsonProperty("safe_logging")
    private boolean safeLogging = true;
}
