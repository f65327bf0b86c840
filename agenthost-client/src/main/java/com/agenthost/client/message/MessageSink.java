package com.agenthost.client.message;

/**
 * Receives message lifecycle notifications from a {@link MessageAccumulator}.
 */
public interface MessageSink {

    void onMessageUpdated(MessageSnapshot message);

    /**
     * The message reached a final status and is detached from the session.
     */
    void onMessageFinalized(MessageSnapshot message);

    /**
     * A message that was shown while in progress is withdrawn, either because
     * it ended empty or because its tool data moved to the next message.
     */
    void onMessageDropped(String messageId);
}
