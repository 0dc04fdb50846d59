package com.oniongateway.server.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and validates the JSON configuration.
 */
@Slf4j
public final class GatewayConfigLoader {

    public static final String DEFAULT_RESOURCE = "gateway.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    private GatewayConfigLoader() {
    }

    public static GatewayConfig load(Path path) throws IOException {
        log.info("Loading configuration from {}", path.toAbsolutePath());
        try (InputStream in = Files.newInputStream(path)) {
            return validated(OBJECT_MAPPER.readValue(in, GatewayConfig.class));
        }
    }

    public static GatewayConfig loadDefault() throws IOException {
        try (InputStream in = GatewayConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IOException("Configuration resource not found: " + DEFAULT_RESOURCE);
            }
            log.info("Loading configuration from classpath resource {}", DEFAULT_RESOURCE);
            return validated(OBJECT_MAPPER.readValue(in, GatewayConfig.class));
        }
    }

    public static GatewayConfig fromJson(String json) throws JsonProcessingException {
        return validated(OBJECT_MAPPER.readValue(json, GatewayConfig.class));
    }

    public static String toJson(GatewayConfig config) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(config);
    }

    private static GatewayConfig validated(GatewayConfig config) {
        config.validate();
        return config;
    }
}
