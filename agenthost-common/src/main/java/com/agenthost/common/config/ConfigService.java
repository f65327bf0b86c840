package com.agenthost.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the client configuration from a JSON file.
 * <p>
 * {@code ${VAR}} and {@code ${VAR:-default}} are substituted from the
 * environment before parsing. A missing or unreadable file yields defaults.
 */
@Slf4j
public class ConfigService {

    public static final Path DEFAULT_PATH = Path.of("~/.agenthost/client.json");

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, AgentHostConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            configPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public AgentHostConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public AgentHostConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private AgentHostConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new AgentHostConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            AgentHostConfig config = applyDefaults(objectMapper.readValue(raw, AgentHostConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new AgentHostConfig());
        }
    }

    /**
     * Fill in every section left out of the file so callers never null-check.
     */
    public static AgentHostConfig applyDefaults(AgentHostConfig config) {
        if (config.getServer() == null) {
            config.setServer(new AgentHostConfig.ServerConfig());
        }
        if (config.getServer().getPaths() == null) {
            config.getServer().setPaths(new AgentHostConfig.PathsConfig());
        }
        if (config.getTransport() == null) {
            config.setTransport(new AgentHostConfig.TransportConfig());
        }
        if (config.getReconnect() == null) {
            config.setReconnect(new AgentHostConfig.ReconnectConfig());
        }
        if (config.getKeepalive() == null) {
            config.setKeepalive(new AgentHostConfig.KeepaliveConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new AgentHostConfig.LoggingConfig());
        }
        return config;
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns. Unset variables without a
     * default become the empty string.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fixed environment, for tests and embedding.
     */
    public static Function<String, String> envOf(Map<String, String> values) {
        return values::get;
    }
}
