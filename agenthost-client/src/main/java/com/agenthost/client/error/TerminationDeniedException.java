package com.agenthost.client.error;

/**
 * The session does not allow ending early.
 */
public class TerminationDeniedException extends ProtocolViolationException {

    public TerminationDeniedException(String sessionId, String message) {
        super(sessionId, message);
    }
}
