package com.oniongateway.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class GateConfig {

    @JsonProperty("allowed_ports")
    private List<Integer> allowedPorts = new ArrayList<>(List.of(80, 443));

    public void validate() {
        if (allowedPorts == null || allowedPorts.isEmpty()) {
            throw new IllegalArgumentException("gate.allowed_ports must name at least one port");
        }
        for (Integer port : allowedPorts) {
            if (port == null || port < 1 || port > 65535) {
                throw new IllegalArgumentException("gate.allowed_ports contains an invalid port: " + port);
            }
        }
    }
}
