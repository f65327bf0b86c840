package com.agenthost.client.error;

/**
 * Conversation history was requested while the session in front forbids
 * browsing it.
 */
public class HistoryDeniedException extends ProtocolViolationException {

    public HistoryDeniedException(String sessionId, String message) {
        super(sessionId, message);
    }
}
