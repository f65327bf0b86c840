package com.agenthost.client.message;

import java.util.List;

/**
 * Immutable view of a message handed to the rendering side.
 */
public record MessageSnapshot(String id, String role, String content, List<ToolCallRecord> toolCalls,
        List<ToolResultRecord> toolResults, MessageStatus status) {

    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_USER = "user";
    public static final String ROLE_SYSTEM = "system";

    public MessageSnapshot {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        toolResults = toolResults == null ? List.of() : List.copyOf(toolResults);
    }

    public boolean hasContent() {
        return !content.isBlank();
    }

    public boolean hasToolData() {
        return !toolCalls.isEmpty() || !toolResults.isEmpty();
    }

    public boolean isAssistant() {
        return ROLE_ASSISTANT.equals(role);
    }
}
