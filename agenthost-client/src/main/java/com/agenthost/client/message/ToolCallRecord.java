package com.agenthost.client.message;

/**
 * @param callId correlation id, {@code null} when the server did not send one
 * @param name   tool name
 * @param status {@code calling}, {@code executing}, {@code completed} or
 *               {@code failed}; the socket may send its own values
 */
public record ToolCallRecord(String callId, String name, String status) {

    public static final String CALLING = "calling";
    public static final String EXECUTING = "executing";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    public ToolCallRecord withStatus(String newStatus) {
        return new ToolCallRecord(callId, name, newStatus);
    }

    public boolean isSettled() {
        return COMPLETED.equals(status) || FAILED.equals(status);
    }
}
