package com.agenthost.client.connection;

import com.agenthost.protocol.ProtocolFrame;

/**
 * Owner-side callbacks of a {@link Connection}. Never invoked while the
 * connection holds its own lock.
 */
public interface ConnectionListener {

    void onOpen(Connection connection);

    void onFrame(Connection connection, ProtocolFrame frame);

    void onClosed(Connection connection, CloseOutcome outcome);
}
