package com.oniongateway.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class DispatcherConfig {

    @JsonProperty("max_connections")
    private int maxConnections = 1024; // 同时服务的连接上限，0 表示不限

    @JsonIgnore
    public boolean isBounded() {
        return maxConnections > 0;
    }

    public void validate() {
        if (maxConnections < 0) {
            throw new IllegalArgumentException("dispatcher.max_connections must not be negative");
        }
    }
}
