package com.agenthost.client.error;

/**
 * Base class for runtime failures of the streaming client.
 */
public class AgentHostException extends RuntimeException {

    public AgentHostException(String message) {
        super(message);
    }

    public AgentHostException(String message, Throwable cause) {
        super(message, cause);
    }
}
