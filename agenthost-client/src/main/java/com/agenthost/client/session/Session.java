package com.agenthost.client.session;

import com.agenthost.client.action.ActionSink;
import com.agenthost.client.action.PendingAction;
import com.agenthost.client.action.SuspendCoordinator;
import com.agenthost.client.connection.Connection;
import com.agenthost.client.connection.ConnectionState;
import com.agenthost.client.error.TransportException;
import com.agenthost.client.message.MessageAccumulator;
import com.agenthost.client.message.MessageSink;
import com.agenthost.client.message.MessageSnapshot;
import com.agenthost.client.message.StreamingMessage;
import com.agenthost.client.transport.ConnectionTarget;
import com.agenthost.protocol.TransportKind;
import com.agenthost.protocol.outbound.OutboundEncoder;
import com.agenthost.protocol.outbound.OutboundMessage;
import com.agenthost.protocol.payload.WidgetResponses;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One agent conversation owned by a {@link SessionMultiplexer}.
 * <p>
 * State is mutated only under the multiplexer's lock; the public accessors
 * are meant for reads from listener callbacks and tests.
 */
public class Session {

    private final String id;
    private final SessionKind kind;
    private final ConnectionTarget target;
    private final String definitionId;
    private final TemplateState templateState = new TemplateState();
    private final Deque<BufferedEvent> eventBuffer = new ArrayDeque<>();
    private final MessageAccumulator accumulator;
    private final SuspendCoordinator coordinator;

    private RestrictionSet restrictions;
    private SessionStatus status = SessionStatus.IDLE;
    private Connection connection;
    private String conversationId;
    private String requestId;
    private long receivedSequence;
    private long appliedSequence;
    private boolean exchangeOpen;
    private boolean exchangeCancelled;
    private boolean failed;
    private boolean completed;
    private boolean terminated;

    Session(String id, SessionKind kind, RestrictionSet restrictions, ConnectionTarget target, String definitionId,
            SessionListener listener) {
        this.id = id;
        this.kind = kind;
        this.restrictions = restrictions;
        this.target = target;
        this.definitionId = definitionId;
        this.accumulator = new MessageAccumulator(id + "-msg", new MessageSink() {
            @Override
            public void onMessageUpdated(MessageSnapshot message) {
                listener.onMessageUpdated(id, message);
            }

            @Override
            public void onMessageFinalized(MessageSnapshot message) {
                listener.onMessageFinalized(id, message);
            }

            @Override
            public void onMessageDropped(String messageId) {
                listener.onMessageDropped(id, messageId);
            }
        });
        this.coordinator = new SuspendCoordinator(id, this::sendResponse, new ActionSink() {
            @Override
            public void onWidgetRequested(PendingAction action) {
                listener.onWidgetRequested(id, action);
            }

            @Override
            public void onWidgetCleared(PendingAction action) {
                listener.onWidgetCleared(id, action);
            }
        });
    }

    // ==================== identity ====================

    public String getId() {
        return id;
    }

    public SessionKind getKind() {
        return kind;
    }

    public TransportKind getTransportKind() {
        return target.kind();
    }

    public ConnectionTarget getTarget() {
        return target;
    }

    public String getDefinitionId() {
        return definitionId;
    }

    // ==================== state ====================

    public SessionStatus getStatus() {
        return status;
    }

    public RestrictionSet getRestrictions() {
        return restrictions;
    }

    public TemplateState getTemplateState() {
        return templateState;
    }

    public String getConversationId() {
        return conversationId;
    }

    public String getRequestId() {
        return requestId;
    }

    public Optional<MessageSnapshot> activeMessage() {
        return accumulator.current().map(StreamingMessage::snapshot);
    }

    public Optional<PendingAction> pendingAction() {
        return coordinator.pendingAction();
    }

    public boolean isSuspended() {
        return coordinator.isSuspended();
    }

    public boolean isCompleted() {
        return completed;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public Connection getConnection() {
        return connection;
    }

    /**
     * Buffered events in receipt order. A copy.
     */
    public List<BufferedEvent> bufferedEvents() {
        return new ArrayList<>(eventBuffer);
    }

    /**
     * Free text may be sent: allowed by the restrictions and the template,
     * and either not suspended or a proactive session, where chat runs
     * alongside widgets.
     */
    public boolean canSendFreeText() {
        if (terminated || completed || !restrictions.canFreeTypeText() || templateState.chatInputLocked()) {
            return false;
        }
        return !coordinator.isSuspended() || kind == SessionKind.PROACTIVE;
    }

    // ==================== owned by the multiplexer ====================

    MessageAccumulator accumulator() {
        return accumulator;
    }

    SuspendCoordinator coordinator() {
        return coordinator;
    }

    Deque<BufferedEvent> eventBuffer() {
        return eventBuffer;
    }

    void attach(Connection connection) {
        this.connection = connection;
    }

    void setRestrictions(RestrictionSet restrictions) {
        this.restrictions = restrictions;
    }

    void setConversationId(String conversationId) {
        this.conversationId = conversationId;
    }

    void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    boolean isExchangeOpen() {
        return exchangeOpen;
    }

    void setExchangeOpen(boolean exchangeOpen) {
        this.exchangeOpen = exchangeOpen;
    }

    /**
     * The exchange in progress was cancelled by the user; its remaining
     * output is dropped until the next exchange starts.
     */
    boolean isExchangeCancelled() {
        return exchangeCancelled;
    }

    void setExchangeCancelled(boolean exchangeCancelled) {
        this.exchangeCancelled = exchangeCancelled;
    }

    void markFailed() {
        this.failed = true;
    }

    void clearFailure() {
        this.failed = false;
    }

    void markCompleted() {
        this.completed = true;
    }

    void markTerminated() {
        this.terminated = true;
    }

    long nextSequence() {
        return ++receivedSequence;
    }

    /**
     * Record that the event with {@code sequence} has been applied.
     *
     * @return false if it was applied before
     */
    boolean markApplied(long sequence) {
        if (sequence <= appliedSequence) {
            return false;
        }
        appliedSequence = sequence;
        return true;
    }

    /**
     * Recompute the status.
     *
     * @return true if it changed
     */
    boolean refreshStatus(boolean foreground) {
        SessionStatus next;
        if (terminated || completed) {
            next = SessionStatus.TERMINATED;
        } else if (failed) {
            next = SessionStatus.ERROR;
        } else if (!foreground) {
            next = SessionStatus.BACKGROUND;
        } else if (coordinator.isSuspended()) {
            next = SessionStatus.SUSPENDED;
        } else if (accumulator.hasActiveMessage()) {
            next = SessionStatus.ACTIVE_STREAMING;
        } else if (connection != null && (connection.getState() == ConnectionState.CONNECTING
                || connection.isReconnecting())) {
            next = SessionStatus.CONNECTING;
        } else {
            next = SessionStatus.IDLE;
        }
        if (next == status) {
            return false;
        }
        status = next;
        return true;
    }

    /**
     * Request-stream chat sessions have no respond endpoint: the answer goes
     * back as the text of a new exchange.
     */
    private CompletableFuture<Void> sendResponse(OutboundMessage.SubmitResponse response) {
        if (connection == null) {
            return CompletableFuture.failedFuture(new TransportException("Session " + id + " has no connection"));
        }
        if (target.kind() == TransportKind.REQUEST_STREAM && target.agentId() == null) {
            OutboundMessage.StartExchange answer = new OutboundMessage.StartExchange(
                    WidgetResponses.displayText(response.value()), conversationId, null, definitionId);
            exchangeOpen = true;
            connection.restart(target.withBody(OutboundEncoder.toChatRequest(answer)));
            return CompletableFuture.completedFuture(null);
        }
        return connection.send(response);
    }

    @Override
    public String toString() {
        return "Session{" + id + ", " + kind + ", " + status + "}";
    }
}
