package com.agenthost.protocol;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of server events understood by the client.
 * <p>
 * The request-stream transport and the duplex socket use different names for
 * the same semantics; both spellings map onto one constant here. A constant
 * with a {@code null} name for a transport is never produced by that
 * transport's decoder.
 */
public enum EventType {

    // --- exchange lifecycle ---
    STREAM_STARTED("stream_started", null),
    ASSISTANT_THINKING("assistant_thinking", null),
    PROACTIVE_START("proactive_start", null),
    STREAM_COMPLETE("stream_complete", null),
    SESSION_COMPLETED("session_completed", null),
    CANCELLED("cancelled", null),
    ERROR("error", "error"),

    // --- message content ---
    CONTENT_CHUNK("content_chunk", "content"),
    MESSAGE_COMPLETE("message_complete", "message_complete"),
    MESSAGE_ADDED("message_added", "message_added"),

    // --- tools ---
    TOOL_CALLS_DETECTED("tool_calls_detected", null),
    TOOL_CALL(null, "tool_call"),
    TOOL_EXECUTING("tool_executing", null),
    TOOL_RESULT("tool_result", "tool_result"),

    // --- suspend / resume ---
    CLIENT_ACTION("client_action", "widget"),
    RUN_SUSPENDED("run_suspended", null),
    RUN_RESUMED("run_resumed", null),
    STATE("state", null),

    // --- session and template ---
    CONNECTED("connected", "connected"),
    TEMPLATE_CONFIG("template_config", "template_config"),
    TEMPLATE_PROGRESS("template_progress", "progress"),
    TEMPLATE_COMPLETE("template_complete", "complete"),
    RESTRICTIONS_UPDATED("restrictions_updated", "restrictions_updated"),

    // --- liveness ---
    HEARTBEAT("heartbeat", null),
    PONG(null, "pong");

    private static final Map<String, EventType> BY_STREAM_NAME = new HashMap<>();
    private static final Map<String, EventType> BY_SOCKET_NAME = new HashMap<>();

    static {
        for (EventType type : values()) {
            if (type.streamName != null) {
                BY_STREAM_NAME.put(type.streamName, type);
            }
            if (type.socketName != null) {
                BY_SOCKET_NAME.put(type.socketName, type);
            }
        }
    }

    private final String streamName;
    private final String socketName;

    EventType(String streamName, String socketName) {
        this.streamName = streamName;
        this.socketName = socketName;
    }

    public String streamName() {
        return streamName;
    }

    public String socketName() {
        return socketName;
    }

    /**
     * Events after which the server closes the exchange on purpose. A close
     * right after one of these is never retried.
     */
    public boolean isTerminal() {
        return this == STREAM_COMPLETE || this == SESSION_COMPLETED || this == CANCELLED;
    }

    public static Optional<EventType> fromStreamName(String name) {
        return lookup(BY_STREAM_NAME, name);
    }

    public static Optional<EventType> fromSocketName(String name) {
        return lookup(BY_SOCKET_NAME, name);
    }

    private static Optional<EventType> lookup(Map<String, EventType> names, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(names.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
