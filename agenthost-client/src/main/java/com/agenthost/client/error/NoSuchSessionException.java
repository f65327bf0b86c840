package com.agenthost.client.error;

/**
 * No session is registered under the given id.
 */
public class NoSuchSessionException extends ProtocolViolationException {

    public NoSuchSessionException(String sessionId, String message) {
        super(sessionId, message);
    }
}
