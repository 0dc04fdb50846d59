package com.oniongateway.server.config;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GatewayConfigLoaderTest {

    @Test
    void loadsBundledDefaults() throws Exception {
        GatewayConfig config = GatewayConfigLoader.loadDefault();

        assertEquals("allium-ampeloprasum", config.getService().getNickname());
        assertEquals(List.of(80, 443), config.getGate().getAllowedPorts());
        assertEquals(Map.of(80, 8080, 443, 8443), config.getTransport().getForwardedPorts());
        assertTrue(config.getTls().isEnabled());
        assertEquals(List.of("h2", "http/1.1"), config.getTls().getAlpnProtocols());
        assertEquals(1024, config.getDispatcher().getMaxConnections());
        assertTrue(config.getLogging().isSafeLogging());
    }

    @Test
    void loadsFileAndKeepsDefaultsForMissingSections(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("gateway.json");
        Files.writeString(file, "{\n"
                + "  \"service\": {\"service_name\": \"abcdef.onion\"},\n"
                + "  \"tls\": {\"enabled\": false},\n"
                + "  \"logging\": {\"safe_logging\": false}\n"
                + "}\n");

        GatewayConfig config = GatewayConfigLoader.load(file);

        assertEquals("abcdef.onion", config.getService().getServiceName());
        assertFalse(config.getTls().isEnabled());
        assertFalse(config.getLogging().isSafeLogging());
        assertEquals(120, config.getHttp().getIdleTimeoutSeconds());
        assertEquals(10, config.getShutdownGraceSeconds());
    }

    @Test
    void rejectsUnknownProperties() {
        assertThrows(UnrecognizedPropertyException.class,
                () -> GatewayConfigLoader.fromJson("{\"service\": {\"service_name\": \"a.onion\"}, \"colour\": 1}"));
    }

    @Test
    void rejectsInvalidSections() {
        assertThrows(IllegalArgumentException.class, () -> GatewayConfigLoader.fromJson(
                "{\"service\": {\"service_name\": \"a.onion\"}, \"tls\": {\"enabled\": false},"
                        + " \"gate\": {\"allowed_ports\": []}}"));
        assertThrows(IllegalArgumentException.class, () -> GatewayConfigLoader.fromJson(
                "{\"tls\": {\"enabled\": false}, \"service\": {\"hostname_file\": \"\"}}"));
        assertThrows(IllegalArgumentException.class, () -> GatewayConfigLoader.fromJson(
                "{\"service\": {\"service_name\": \"a.onion\"}, \"tls\": {\"enabled\": false},"
                        + " \"transport\": {\"forwarded_ports\": {\"80\": 70000}}}"));
    }

    @Test
    void writesJsonThatReadsBack() throws Exception {
        GatewayConfig config = GatewayConfigLoader.loadDefault();

        String json = GatewayConfigLoader.toJson(config);

        assertTrue(json.contains("\"forwarded_ports\""));
        assertEquals(config, GatewayConfigLoader.fromJson(json));
    }
}
