package com.agenthost.client.error;

/**
 * {@code connect} was called for a different target while a connection is
 * still connecting or open.
 */
public class ConnectionBusyException extends AgentHostException {

    public ConnectionBusyException(String message) {
        super(message);
    }
}
