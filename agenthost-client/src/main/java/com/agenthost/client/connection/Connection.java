package com.agenthost.client.connection;

import com.agenthost.client.error.ConnectionBusyException;
import com.agenthost.client.error.TransportException;
import com.agenthost.client.transport.CloseCodes;
import com.agenthost.client.transport.ConnectionTarget;
import com.agenthost.client.transport.Transport;
import com.agenthost.client.transport.TransportFactory;
import com.agenthost.client.transport.TransportListener;
import com.agenthost.common.infra.Backoff;
import com.agenthost.common.infra.TaskScheduler;
import com.agenthost.common.logging.LogRedact;
import com.agenthost.common.logging.SubsystemLogger;
import com.agenthost.protocol.ProtocolFrame;
import com.agenthost.protocol.TransportKind;
import com.agenthost.protocol.outbound.OutboundMessage;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One physical connection of a session:
 * {@code DISCONNECTED -> CONNECTING -> OPEN -> CLOSING/DISCONNECTED}.
 * <p>
 * A close is clean when the client asked for it, the close code is normal, or
 * the last frame received was a terminal event; anything else is dirty and is
 * retried with exponential backoff until the policy's attempt cap is reached.
 * Every (re)connect uses a fresh {@link Transport}; callbacks from a
 * transport that has been superseded are ignored, so at most one attempt is
 * ever in flight.
 * <p>
 * Duplex sockets are kept alive with a periodic ping while open.
 */
public class Connection {

    private static final SubsystemLogger LOG = SubsystemLogger.create("client/connection");

    private final String sessionId;
    private final TransportFactory transportFactory;
    private final TaskScheduler scheduler;
    private final Backoff.Policy reconnectPolicy;
    private final ConnectionListener listener;
    private final KeepaliveTimer keepalive;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private ConnectionTarget target;
    private Transport transport;
    private Transport lastTransport;
    private int epoch;
    private int reconnectAttempt;
    private boolean closeRequested;
    private boolean lastFrameTerminal;
    private boolean gaveUp;
    private TaskScheduler.Cancellable pendingReconnect;

    public Connection(String sessionId, TransportFactory transportFactory, TaskScheduler scheduler,
            Backoff.Policy reconnectPolicy, long keepaliveIntervalMs, ConnectionListener listener) {
        this.sessionId = sessionId;
        this.transportFactory = transportFactory;
        this.scheduler = scheduler;
        this.reconnectPolicy = reconnectPolicy;
        this.listener = listener;
        this.keepalive = new KeepaliveTimer(scheduler, keepaliveIntervalMs, this::ping);
    }

    // ==================== accessors ====================

    public String getSessionId() {
        return sessionId;
    }

    public synchronized ConnectionState getState() {
        return state;
    }

    public synchronized int getReconnectAttempt() {
        return reconnectAttempt;
    }

    public synchronized ConnectionTarget getTarget() {
        return target;
    }

    /**
     * True once a drop exhausted the reconnect budget, until the next
     * explicit {@link #connect}.
     */
    public synchronized boolean hasGivenUp() {
        return gaveUp;
    }

    /**
     * Waiting for a scheduled reconnect.
     */
    public synchronized boolean isReconnecting() {
        return pendingReconnect != null;
    }

    boolean isKeepaliveRunning() {
        return keepalive.isRunning();
    }

    // ==================== lifecycle ====================

    /**
     * Open a transport to {@code newTarget}. Does nothing if already
     * connecting or open to the same target.
     *
     * @throws ConnectionBusyException if connecting or open to another target
     * @throws TransportException      if the transport cannot be started
     */
    public synchronized void connect(ConnectionTarget newTarget) {
        if (state == ConnectionState.CONNECTING || state == ConnectionState.OPEN) {
            if (newTarget.equals(target)) {
                LOG.debug("Already connected", Map.of("sessionId", sessionId));
                return;
            }
            throw new ConnectionBusyException("Session " + sessionId + " is already connected to "
                    + LogRedact.redact(target.url()));
        }
        cancelPendingReconnect();
        target = newTarget;
        reconnectAttempt = 0;
        gaveUp = false;
        openTransport();
    }

    /**
     * Drop whatever is open and connect to {@code newTarget}. Used to start a
     * new exchange on a request stream.
     */
    public void restart(ConnectionTarget newTarget) {
        close();
        connect(newTarget);
    }

    /**
     * Close on the client's request. Never triggers a reconnect, and frames
     * the transport still delivers are dropped.
     */
    public void close() {
        Transport closing;
        synchronized (this) {
            closeRequested = true;
            cancelPendingReconnect();
            keepalive.stop();
            closing = transport;
            if (closing == null) {
                state = ConnectionState.DISCONNECTED;
                return;
            }
            state = ConnectionState.CLOSING;
        }
        closing.close(CloseCodes.NORMAL, "client closing");
    }

    // ==================== outbound ====================

    /**
     * Send through the current transport. Request streams may still send
     * (as separate HTTP calls) after their stream ended.
     */
    public CompletableFuture<Void> send(OutboundMessage message) {
        Transport current;
        synchronized (this) {
            current = transport;
            if (current == null && lastTransport != null && lastTransport.kind() == TransportKind.REQUEST_STREAM) {
                current = lastTransport;
            }
        }
        if (current == null) {
            return CompletableFuture.failedFuture(new TransportException("Session " + sessionId + " is not connected"));
        }
        return current.send(message);
    }

    /**
     * Ask the server to cancel the running exchange. A request stream is also
     * closed, cleanly.
     */
    public CompletableFuture<Void> cancelExchange(String requestId) {
        CompletableFuture<Void> sent = send(new OutboundMessage.CancelExchange(requestId));
        boolean stream;
        synchronized (this) {
            stream = target != null && target.kind() == TransportKind.REQUEST_STREAM;
        }
        if (stream) {
            close();
        }
        return sent;
    }

    private void ping() {
        send(new OutboundMessage.Ping()).whenComplete((ok, error) -> {
            if (error != null) {
                LOG.debug("Ping failed", Map.of("sessionId", sessionId, "error", String.valueOf(error.getMessage())));
            }
        });
    }

    // ==================== internals ====================

    private void openTransport() {
        int attemptEpoch = ++epoch;
        closeRequested = false;
        lastFrameTerminal = false;
        state = ConnectionState.CONNECTING;
        Transport created = transportFactory.create(target.kind());
        transport = created;
        lastTransport = created;
        try {
            created.open(target, new EpochListener(attemptEpoch));
        } catch (RuntimeException e) {
            state = ConnectionState.DISCONNECTED;
            transport = null;
            epoch++;
            throw e instanceof TransportException te ? te
                    : new TransportException("Cannot open transport: " + e.getMessage(), 0, e);
        }
    }

    private void reconnect() {
        CloseOutcome failure = null;
        synchronized (this) {
            pendingReconnect = null;
            if (state != ConnectionState.DISCONNECTED || closeRequested || target == null) {
                return;
            }
            LOG.info("Reconnecting", Map.of("sessionId", sessionId, "attempt", reconnectAttempt));
            try {
                openTransport();
            } catch (TransportException e) {
                failure = scheduleReconnect(e.getMessage());
            }
        }
        if (failure != null) {
            listener.onClosed(this, failure);
        }
    }

    /**
     * Classify the end of the transport opened under {@code attemptEpoch}.
     * Returns null if that transport has been superseded.
     */
    private synchronized CloseOutcome handleEnd(int attemptEpoch, boolean normalClose, int httpStatus, String detail) {
        if (attemptEpoch != epoch) {
            return null;
        }
        epoch++;
        keepalive.stop();
        transport = null;
        if (closeRequested || normalClose || lastFrameTerminal) {
            state = ConnectionState.DISCONNECTED;
            return CloseOutcome.CLEAN;
        }
        if (httpStatus == 401 || httpStatus == 403) {
            state = ConnectionState.DISCONNECTED;
            LOG.warn("Connection rejected as unauthorized", Map.of("sessionId", sessionId, "status", httpStatus));
            return CloseOutcome.AUTH_FAILED;
        }
        if (httpStatus == 429) {
            state = ConnectionState.DISCONNECTED;
            LOG.warn("Connection rate limited", Map.of("sessionId", sessionId));
            return CloseOutcome.RATE_LIMITED;
        }
        return scheduleReconnect(detail);
    }

    private CloseOutcome scheduleReconnect(String detail) {
        state = ConnectionState.DISCONNECTED;
        int next = reconnectAttempt + 1;
        if (!reconnectPolicy.allowsAttempt(next)) {
            gaveUp = true;
            LOG.warn("Giving up after repeated drops",
                    Map.of("sessionId", sessionId, "attempts", reconnectAttempt, "reason", String.valueOf(detail)));
            return CloseOutcome.GAVE_UP;
        }
        reconnectAttempt = next;
        long delayMs = Backoff.compute(reconnectPolicy, next);
        LOG.info("Reconnect scheduled", Map.of("sessionId", sessionId, "attempt", next, "delayMs", delayMs,
                "reason", String.valueOf(detail)));
        pendingReconnect = scheduler.schedule(this::reconnect, delayMs);
        return CloseOutcome.RECONNECTING;
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel();
            pendingReconnect = null;
        }
    }

    /**
     * Transport callbacks bound to one connection attempt.
     */
    private final class EpochListener implements TransportListener {

        private final int attemptEpoch;

        EpochListener(int attemptEpoch) {
            this.attemptEpoch = attemptEpoch;
        }

        @Override
        public void onOpen() {
            synchronized (Connection.this) {
                if (attemptEpoch != epoch || state != ConnectionState.CONNECTING) {
                    return;
                }
                state = ConnectionState.OPEN;
                reconnectAttempt = 0;
                if (target.kind() == TransportKind.DUPLEX_SOCKET) {
                    keepalive.start();
                }
            }
            LOG.debug("Connection open", Map.of("sessionId", sessionId));
            listener.onOpen(Connection.this);
        }

        @Override
        public void onFrame(ProtocolFrame frame) {
            synchronized (Connection.this) {
                // nothing read after a requested close reaches the session
                if (attemptEpoch != epoch || closeRequested) {
                    return;
                }
                lastFrameTerminal = frame.type().isTerminal();
            }
            listener.onFrame(Connection.this, frame);
        }

        @Override
        public void onClosed(int code, String reason) {
            CloseOutcome outcome = handleEnd(attemptEpoch, CloseCodes.isNormal(code), 0,
                    "closed with " + code + (reason == null || reason.isEmpty() ? "" : " " + reason));
            if (outcome != null) {
                listener.onClosed(Connection.this, outcome);
            }
        }

        @Override
        public void onFailure(Throwable error, int httpStatus) {
            CloseOutcome outcome = handleEnd(attemptEpoch, false, httpStatus, error.getMessage());
            if (outcome != null) {
                listener.onClosed(Connection.this, outcome);
            }
        }
    }
}
