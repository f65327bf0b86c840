package com.agenthost.client.transport;

import com.agenthost.protocol.TransportKind;
import com.agenthost.protocol.outbound.OutboundMessage;

import java.util.concurrent.CompletableFuture;

/**
 * One physical connection attempt. A transport is opened at most once; the
 * connection manager creates a fresh one for every (re)connect.
 */
public interface Transport {

    TransportKind kind();

    /**
     * Start opening; progress is reported through {@code listener}.
     *
     * @throws com.agenthost.client.error.TransportException if the request
     *         cannot even be built
     */
    void open(ConnectionTarget target, TransportListener listener);

    /**
     * Deliver an outbound message. Request streams carry these as separate
     * HTTP calls; a kind of message the transport cannot carry completes
     * without effect.
     */
    CompletableFuture<Void> send(OutboundMessage message);

    /**
     * Close on the caller's request. The listener still receives
     * {@link TransportListener#onClosed}.
     */
    void close(int code, String reason);
}
