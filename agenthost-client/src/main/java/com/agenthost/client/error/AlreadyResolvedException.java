package com.agenthost.client.error;

/**
 * The widget action was already answered or cleared.
 */
public class AlreadyResolvedException extends ProtocolViolationException {

    public AlreadyResolvedException(String sessionId, String message) {
        super(sessionId, message);
    }
}
