package com.oniongateway.server.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class ServiceConfig {

    @JsonProperty("nickname")
    private String nickname = "allium-ampeloprasum";

    @JsonProperty("hostname_file")
    private String hostnameFile; // tor 写入服务目录的 hostname 文件

    @JsonProperty("service_name")
    private String serviceName; // 优先于 hostname 文件

    public void validate() {
        if (nickname == null || nickname.isBlank()) {
            throw new IllegalArgumentException("service.nickname must not be empty");
        }
        if (isBlank(serviceName) && isBlank(hostnameFile)) {
            throw new IllegalArgumentException("service.service_name or service.hostname_file is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
