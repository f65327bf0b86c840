package com.agenthost.client.error;

/**
 * Free-text input is not allowed for the session right now.
 */
public class FreeTextDeniedException extends ProtocolViolationException {

    public FreeTextDeniedException(String sessionId, String message) {
        super(sessionId, message);
    }
}
