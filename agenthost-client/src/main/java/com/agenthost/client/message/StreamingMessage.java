package com.agenthost.client.message;

import java.util.ArrayList;
import java.util.List;

/**
 * The assistant message currently being assembled. Content is append-only
 * until the status becomes final, after which every mutator throws.
 */
public class StreamingMessage {

    private final String id;
    private final StringBuilder content = new StringBuilder();
    private final List<ToolCallRecord> toolCalls = new ArrayList<>();
    private final List<ToolResultRecord> toolResults = new ArrayList<>();
    private MessageStatus status = MessageStatus.THINKING;

    StreamingMessage(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public MessageStatus getStatus() {
        return status;
    }

    public String getContent() {
        return content.toString();
    }

    public List<ToolCallRecord> getToolCalls() {
        return List.copyOf(toolCalls);
    }

    public List<ToolResultRecord> getToolResults() {
        return List.copyOf(toolResults);
    }

    public boolean hasToolData() {
        return !toolCalls.isEmpty() || !toolResults.isEmpty();
    }

    public MessageSnapshot snapshot() {
        return new MessageSnapshot(id, MessageSnapshot.ROLE_ASSISTANT, content.toString(),
                toolCalls, toolResults, status);
    }

    // ==================== content ====================

    void append(String text) {
        ensureOpen();
        content.append(text);
        status = MessageStatus.STREAMING;
    }

    void complete(String authoritativeText) {
        ensureOpen();
        if (authoritativeText != null && !authoritativeText.isEmpty()) {
            content.setLength(0);
            content.append(authoritativeText);
        }
        status = MessageStatus.COMPLETE;
    }

    void cancel(String placeholder) {
        ensureOpen();
        if (content.length() == 0) {
            content.append(placeholder);
        }
        status = MessageStatus.CANCELLED;
    }

    void fail(String text, boolean keepContent) {
        ensureOpen();
        if (!keepContent || content.length() == 0) {
            content.setLength(0);
            content.append(text);
        }
        status = MessageStatus.ERROR;
    }

    // ==================== tools ====================

    void addToolCall(ToolCallRecord call) {
        ensureOpen();
        toolCalls.add(call);
    }

    /**
     * Update the newest unsettled call matching {@code callId}, or {@code name}
     * when the id is unknown. Returns false if none matched.
     */
    boolean updateToolCall(String callId, String name, String newStatus) {
        ensureOpen();
        int index = findCall(callId, name);
        if (index < 0) {
            return false;
        }
        toolCalls.set(index, toolCalls.get(index).withStatus(newStatus));
        return true;
    }

    /**
     * Correlate the call id of a result that arrived without one.
     */
    String resolveCallId(String callId, String name) {
        if (callId != null) {
            return callId;
        }
        int index = findCall(null, name);
        return index < 0 ? null : toolCalls.get(index).callId();
    }

    void markToolCalling() {
        ensureOpen();
        status = MessageStatus.TOOL_CALLING;
    }

    void addToolResult(ToolResultRecord result) {
        ensureOpen();
        toolResults.add(result);
        status = MessageStatus.STREAMING;
    }

    void absorb(List<ToolCallRecord> calls, List<ToolResultRecord> results) {
        toolCalls.addAll(0, calls);
        toolResults.addAll(0, results);
    }

    private int findCall(String callId, String name) {
        for (int i = toolCalls.size() - 1; i >= 0; i--) {
            ToolCallRecord call = toolCalls.get(i);
            if (callId != null) {
                if (callId.equals(call.callId())) {
                    return i;
                }
            } else if (name != null && name.equals(call.name()) && !call.isSettled()) {
                return i;
            }
        }
        return -1;
    }

    private void ensureOpen() {
        if (status.isFinal()) {
            throw new IllegalStateException("Message " + id + " is already " + status);
        }
    }
}
