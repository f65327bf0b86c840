package com.agenthost.protocol;

import java.util.Locale;

/**
 * The two wire shapes a session can be carried over.
 */
public enum TransportKind {

    /** HTTP response streamed as server-sent events. */
    REQUEST_STREAM("request-stream"),

    /** Full-duplex WebSocket carrying one JSON object per text message. */
    DUPLEX_SOCKET("duplex-socket");

    private final String configName;

    TransportKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public FrameDecoder newDecoder() {
        return switch (this) {
            case REQUEST_STREAM -> new SseFrameDecoder();
            case DUPLEX_SOCKET -> new SocketFrameDecoder();
        };
    }

    /**
     * Parse a config value; accepts "sse" and "websocket" as aliases.
     */
    public static TransportKind fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return REQUEST_STREAM;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "request-stream", "sse", "stream" -> REQUEST_STREAM;
            case "duplex-socket", "websocket", "ws", "socket" -> DUPLEX_SOCKET;
            default -> throw new IllegalArgumentException("Unknown transport kind: " + value);
        };
    }
}
