package com.agenthost.client.error;

/**
 * The active session does not allow switching away from it.
 */
public class SwitchDeniedException extends ProtocolViolationException {

    public SwitchDeniedException(String sessionId, String message) {
        super(sessionId, message);
    }
}
