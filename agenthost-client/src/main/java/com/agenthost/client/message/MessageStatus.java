package com.agenthost.client.message;

/**
 * Lifecycle of a message being produced by the agent.
 * Moves forward only, except TOOL_CALLING and STREAMING which alternate while
 * tools run mid-stream.
 */
public enum MessageStatus {
    THINKING,
    STREAMING,
    TOOL_CALLING,
    COMPLETE,
    ERROR,
    CANCELLED;

    public boolean isFinal() {
        return this == COMPLETE || this == ERROR || this == CANCELLED;
    }
}
