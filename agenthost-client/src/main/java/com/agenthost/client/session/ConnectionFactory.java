package com.agenthost.client.session;

import com.agenthost.client.connection.Connection;
import com.agenthost.client.connection.ConnectionListener;

/**
 * Creates the connection that backs one session.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection create(String sessionId, ConnectionListener listener);
}
