package com.agenthost.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Root configuration for the streaming client.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentHostConfig {

    /** Agent host server endpoints and credentials. */
    private ServerConfig server;

    /** Transport selection and HTTP timeouts. */
    private TransportConfig transport;

    /** Reconnect backoff for dirty closes. */
    private ReconnectConfig reconnect;

    /** Duplex socket keepalive. */
    private KeepaliveConfig keepalive;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerConfig {
        private String baseUrl = "http://localhost:8080/api";
        /** Bearer token; usually supplied as ${AGENTHOST_TOKEN}. */
        private String accessToken;
        private PathsConfig paths = new PathsConfig();
    }

    /**
     * Path templates, relative to {@code server.baseUrl}. Placeholders are
     * {@code {agentId}}, {@code {requestId}} and {@code {conversationId}}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PathsConfig {
        private String chatSend = "/chat/send";
        private String cancel = "/chat/cancel/{requestId}";
        private String respond = "/agents/{agentId}/respond";
        private String stream = "/agents/{agentId}/stream";
        private String socket = "/chat/ws";
        private String conversation = "/chat/conversations/{conversationId}";
        private String session = "/agents/{agentId}/sessions/current";
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TransportConfig {
        /** "request-stream" or "duplex-socket". */
        private String kind = "request-stream";
        private long connectTimeoutMs = 10_000;
        /** 0 disables the read timeout, which long-lived streams need. */
        private long readTimeoutMs = 0;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReconnectConfig {
        private long initialDelayMs = 1000;
        private long maxDelayMs = 60_000;
        private double factor = 2.0;
        private int maxAttempts = 5;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeepaliveConfig {
        private long intervalMs = 30_000;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoggingConfig {
        private String level = "info";
    }
}
