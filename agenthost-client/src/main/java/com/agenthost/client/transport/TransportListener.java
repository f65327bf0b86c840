package com.agenthost.client.transport;

import com.agenthost.protocol.ProtocolFrame;

/**
 * Callbacks from a {@link Transport}, invoked on the transport's own thread,
 * one at a time and in arrival order.
 */
public interface TransportListener {

    void onOpen();

    void onFrame(ProtocolFrame frame);

    /**
     * The transport ended. Not called after {@link #onFailure}.
     */
    void onClosed(int code, String reason);

    /**
     * The transport failed to open or broke.
     *
     * @param httpStatus status of the failed HTTP exchange, 0 if none
     */
    void onFailure(Throwable error, int httpStatus);
}
