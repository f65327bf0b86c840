package com.agenthost.common.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("client.json");
    }

    private ConfigService service(Map<String, String> env) {
        return new ConfigService(configPath, Duration.ofMillis(200), ConfigService.envOf(env));
    }

    @Test
    void loadConfig_validJson_returnsConfig() throws IOException {
        String json = """
                {
                  "server": { "baseUrl": "https://tutor.example.com/api", "accessToken": "${AGENTHOST_TOKEN}" },
                  "transport": { "kind": "duplex-socket" },
                  "reconnect": { "maxAttempts": 3 },
                  "unknownSection": { "x": 1 }
                }
                """;
        Files.writeString(configPath, json);

        AgentHostConfig config = service(Map.of("AGENTHOST_TOKEN", "tok-123")).loadConfig();

        assertEquals("https://tutor.example.com/api", config.getServer().getBaseUrl());
        assertEquals("tok-123", config.getServer().getAccessToken());
        assertEquals("duplex-socket", config.getTransport().getKind());
        assertEquals(3, config.getReconnect().getMaxAttempts());
        assertEquals(1000, config.getReconnect().getInitialDelayMs());
        assertEquals("/chat/send", config.getServer().getPaths().getChatSend());
        assertEquals(30_000, config.getKeepalive().getIntervalMs());
    }

    @Test
    void loadConfig_missingFile_returnsDefaults() {
        AgentHostConfig config = service(Map.of()).loadConfig();

        assertNotNull(config.getServer());
        assertEquals("request-stream", config.getTransport().getKind());
        assertEquals(5, config.getReconnect().getMaxAttempts());
        assertEquals(2.0, config.getReconnect().getFactor());
    }

    @Test
    void loadConfig_malformedJson_returnsDefaults() throws IOException {
        Files.writeString(configPath, "{ not json");
        AgentHostConfig config = service(Map.of()).loadConfig();
        assertEquals("info", config.getLogging().getLevel());
    }

    @Test
    void loadConfig_cachedUntilReload() throws IOException {
        Files.writeString(configPath, "{\"logging\": {\"level\": \"debug\"}}");
        ConfigService service = new ConfigService(configPath, Duration.ofMinutes(5), ConfigService.envOf(Map.of()));
        assertEquals("debug", service.loadConfig().getLogging().getLevel());

        Files.writeString(configPath, "{\"logging\": {\"level\": \"trace\"}}");
        assertEquals("debug", service.loadConfig().getLogging().getLevel());
        assertEquals("trace", service.reloadConfig().getLogging().getLevel());
    }

    @Test
    void substituteEnvVars_defaultUsedWhenUnset() {
        ConfigService service = service(Map.of("SET", "yes"));
        assertEquals("a=yes b=fallback c=", service.substituteEnvVars("a=${SET} b=${UNSET:-fallback} c=${UNSET}"));
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        assertEquals("hello", service(Map.of()).substituteEnvVars("hello"));
    }
}
