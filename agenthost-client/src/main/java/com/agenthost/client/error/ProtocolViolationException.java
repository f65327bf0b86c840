package com.agenthost.client.error;

/**
 * An operation was rejected because it would break a session invariant. The
 * session is left exactly as it was.
 */
public class ProtocolViolationException extends Exception {

    private final String sessionId;

    public ProtocolViolationException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
