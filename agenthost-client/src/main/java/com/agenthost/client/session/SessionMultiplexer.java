package com.agenthost.client.session;

import com.agenthost.client.action.PendingAction;
import com.agenthost.client.connection.CloseOutcome;
import com.agenthost.client.connection.Connection;
import com.agenthost.client.connection.ConnectionListener;
import com.agenthost.client.connection.ConnectionState;
import com.agenthost.client.error.AlreadyResolvedException;
import com.agenthost.client.error.FreeTextDeniedException;
import com.agenthost.client.error.NoSuchSessionException;
import com.agenthost.client.error.SwitchDeniedException;
import com.agenthost.client.error.TerminationDeniedException;
import com.agenthost.client.message.MessageAccumulator;
import com.agenthost.client.transport.ConnectionTarget;
import com.agenthost.common.logging.SubsystemLogger;
import com.agenthost.protocol.EventType;
import com.agenthost.protocol.ProtocolFrame;
import com.agenthost.protocol.TransportKind;
import com.agenthost.protocol.outbound.OutboundEncoder;
import com.agenthost.protocol.outbound.OutboundMessage;
import com.agenthost.protocol.payload.ErrorPayload;
import com.agenthost.protocol.payload.PayloadException;
import com.agenthost.protocol.payload.Payloads;
import com.agenthost.protocol.payload.WidgetResponses;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns every {@link Session} and decides which one is in front.
 * <p>
 * Connection callbacks are handed to a single dispatch executor. Each event
 * is routed under the multiplexer lock: it is applied at once if its session
 * is the active one at that moment, otherwise appended to the session's
 * buffer. Switching to a session replays its buffer, in receipt order,
 * through the same path. API calls take the same lock, so a switch never
 * lands in the middle of routing an event.
 * <p>
 * Within a session events are applied in receipt order and at most once.
 */
public class SessionMultiplexer {

    private static final SubsystemLogger LOG = SubsystemLogger.create("client/multiplexer");

    private final Object lock = new Object();
    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final ConnectionFactory connectionFactory;
    private final SessionListener listener;
    private final AuthNotifier authNotifier;
    private final Executor dispatcher;
    private final RemoteSessionEnder remoteSessions;
    private final SessionEventHandler handler;

    private String activeSessionId;

    public SessionMultiplexer(ConnectionFactory connectionFactory, SessionListener listener,
            AuthNotifier authNotifier, Executor dispatcher, RemoteSessionEnder remoteSessions) {
        this.connectionFactory = connectionFactory;
        this.listener = listener;
        this.authNotifier = authNotifier;
        this.dispatcher = dispatcher;
        this.remoteSessions = remoteSessions;
        this.handler = new SessionEventHandler(listener);
    }

    // ==================== queries ====================

    public Optional<String> activeSessionId() {
        synchronized (lock) {
            return Optional.ofNullable(activeSessionId);
        }
    }

    public Optional<Session> session(String sessionId) {
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(sessionId));
        }
    }

    public List<String> sessionIds() {
        synchronized (lock) {
            return new ArrayList<>(sessions.keySet());
        }
    }

    /**
     * Restrictions of the session in front; everything is allowed when no
     * session is.
     */
    public RestrictionSet activeRestrictions() {
        synchronized (lock) {
            Session active = activeSessionId == null ? null : sessions.get(activeSessionId);
            return active == null ? RestrictionSet.PERMISSIVE : active.getRestrictions();
        }
    }

    public boolean canAccessHistory() {
        return activeRestrictions().canAccessHistory();
    }

    // ==================== lifecycle ====================

    /**
     * Register a session. It becomes the active one if none is; otherwise it
     * starts in the background.
     *
     * @param sessionId    id, or null to generate one
     * @param serverConfig session configuration from the server, may be null
     */
    public Session createSession(String sessionId, SessionKind kind, ConnectionTarget target, String definitionId,
            JsonNode serverConfig) {
        String id = sessionId != null ? sessionId : "session-" + UUID.randomUUID();
        synchronized (lock) {
            if (sessions.containsKey(id)) {
                throw new IllegalArgumentException("Session " + id + " already exists");
            }
            Session session = new Session(id, kind, RestrictionPolicy.derive(kind, serverConfig), target,
                    definitionId, listener);
            session.attach(connectionFactory.create(id, new RoutingListener(id)));
            sessions.put(id, session);
            if (activeSessionId == null) {
                activeSessionId = id;
            }
            LOG.info("Session created", Map.of("sessionId", id, "kind", kind, "transport", target.kind(),
                    "restrictions", session.getRestrictions()));
            refresh(session);
            return session;
        }
    }

    /**
     * Open the session's connection to its target. Request-stream chat
     * sessions connect through {@link #startExchange} instead.
     */
    public void connect(String sessionId) throws NoSuchSessionException {
        synchronized (lock) {
            Session session = require(sessionId);
            session.clearFailure();
            session.getConnection().connect(session.getTarget());
            refresh(session);
        }
    }

    /**
     * Bring a session to the front, replaying whatever it buffered while in
     * the background.
     *
     * @throws SwitchDeniedException if the session in front may not be left
     */
    public void switchTo(String sessionId) throws SwitchDeniedException, NoSuchSessionException {
        synchronized (lock) {
            Session target = require(sessionId);
            if (sessionId.equals(activeSessionId)) {
                return;
            }
            Session current = activeSessionId == null ? null : sessions.get(activeSessionId);
            if (current != null && !current.getRestrictions().canSwitchSessions() && !current.isCompleted()) {
                LOG.warn("Switch denied", Map.of("from", current.getId(), "to", sessionId));
                throw new SwitchDeniedException(current.getId(),
                        "Session " + current.getId() + " does not allow switching");
            }
            activeSessionId = sessionId;
            if (current != null) {
                refresh(current);
            }
            replay(target);
            refresh(target);
        }
    }

    /**
     * Send the session in front to the background without bringing another
     * forward. Its connection keeps running.
     */
    public void deactivate() {
        synchronized (lock) {
            Session current = activeSessionId == null ? null : sessions.get(activeSessionId);
            activeSessionId = null;
            if (current != null) {
                refresh(current);
            }
        }
    }

    /**
     * End a session at the user's request: close its connection, drop its
     * buffer and forget it. A session that already completed may always be
     * ended.
     *
     * @throws TerminationDeniedException if the session may not end early
     */
    public void terminateSession(String sessionId, String reason)
            throws TerminationDeniedException, NoSuchSessionException {
        synchronized (lock) {
            Session session = require(sessionId);
            if (!session.getRestrictions().canEndEarly() && !session.isCompleted()) {
                throw new TerminationDeniedException(sessionId, "Session " + sessionId + " cannot be ended early");
            }
            String agentId = session.getTarget().agentId();
            boolean endRemotely = agentId != null && !session.isCompleted();
            remove(session, reason);
            if (endRemotely) {
                remoteSessions.endSession(agentId, reason).whenComplete((ok, error) -> {
                    if (error != null) {
                        LOG.warn("Ending remote session failed",
                                Map.of("sessionId", sessionId, "error", String.valueOf(error.getMessage())));
                    }
                });
            }
        }
    }

    /**
     * End every session regardless of restrictions.
     */
    public void logout() {
        synchronized (lock) {
            for (Session session : new ArrayList<>(sessions.values())) {
                remove(session, "logout");
            }
            activeSessionId = null;
        }
    }

    // ==================== user actions ====================

    /**
     * Start an exchange: send user text, or with {@code text == null} ask the
     * agent to speak first.
     *
     * @throws FreeTextDeniedException if free text is not allowed right now
     */
    public CompletableFuture<Void> startExchange(String sessionId, String text, String modelId)
            throws FreeTextDeniedException, NoSuchSessionException {
        synchronized (lock) {
            Session session = require(sessionId);
            if (session.isTerminated() || session.isCompleted()) {
                throw new FreeTextDeniedException(sessionId, "Session " + sessionId + " has ended");
            }
            if (text != null && !session.canSendFreeText()) {
                throw new FreeTextDeniedException(sessionId, "Free text is not allowed in session " + sessionId);
            }
            OutboundMessage.StartExchange start = new OutboundMessage.StartExchange(text,
                    session.getConversationId(), modelId, session.getDefinitionId());
            Connection connection = session.getConnection();
            session.clearFailure();
            session.setExchangeOpen(true);
            session.setExchangeCancelled(false);
            CompletableFuture<Void> sent;
            if (session.getTransportKind() == TransportKind.DUPLEX_SOCKET) {
                if (connection.getState() == ConnectionState.DISCONNECTED) {
                    connection.connect(session.getTarget());
                }
                sent = connection.send(start);
            } else {
                connection.restart(session.getTarget().withBody(OutboundEncoder.toChatRequest(start)));
                sent = CompletableFuture.completedFuture(null);
            }
            refresh(session);
            return sent;
        }
    }

    /**
     * Answer the pending widget of a session.
     *
     * @return completes when the answer has been delivered to the server
     * @throws AlreadyResolvedException if {@code actionId} is not pending
     */
    public CompletableFuture<Void> submitResponse(String sessionId, String actionId, JsonNode value)
            throws AlreadyResolvedException, NoSuchSessionException {
        synchronized (lock) {
            Session session = require(sessionId);
            Optional<PendingAction> pending = session.pendingAction();
            CompletableFuture<Void> sent = session.coordinator().resolve(actionId, value);
            session.setExchangeCancelled(false);
            if (pending.map(PendingAction::isShowUserResponseAsBubble).orElse(false)) {
                listener.onUserResponse(sessionId, WidgetResponses.displayText(value));
            }
            refresh(session);
            return sent;
        }
    }

    /**
     * Cancel the exchange running in the session in front. Background
     * sessions are not affected.
     *
     * @return completes when the server has been told; already completed if
     *         no session is in front
     */
    public CompletableFuture<Void> cancelActive() {
        synchronized (lock) {
            Session session = activeSessionId == null ? null : sessions.get(activeSessionId);
            if (session == null) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> sent = session.getConnection().cancelExchange(session.getRequestId());
            MessageAccumulator accumulator = session.accumulator();
            accumulator.cancel();
            if (accumulator.hasCarriedToolData()) {
                accumulator.finishExchange();
            }
            session.setExchangeOpen(false);
            session.setExchangeCancelled(true);
            LOG.info("Exchange cancelled", Map.of("sessionId", session.getId(),
                    "requestId", String.valueOf(session.getRequestId())));
            refresh(session);
            return sent;
        }
    }

    // ==================== routing ====================

    private void route(String sessionId, ProtocolFrame frame) {
        synchronized (lock) {
            Session session = sessions.get(sessionId);
            if (session == null) {
                LOG.debug("Dropping frame for unknown session", Map.of("sessionId", sessionId,
                        "event", frame.wireName()));
                return;
            }
            long sequence = session.nextSequence();
            if (sessionId.equals(activeSessionId)) {
                applyFrame(session, sequence, frame);
            } else {
                session.eventBuffer().addLast(BufferedEvent.frame(sequence, frame));
                if (frame.type() == EventType.SESSION_COMPLETED) {
                    session.markCompleted();
                }
                LOG.trace("Buffered event", Map.of("sessionId", sessionId, "event", frame.wireName(),
                        "buffered", session.eventBuffer().size()));
            }
            refresh(session);
        }
    }

    private void routeClose(String sessionId, CloseOutcome outcome) {
        synchronized (lock) {
            Session session = sessions.get(sessionId);
            if (session == null) {
                return;
            }
            long sequence = session.nextSequence();
            if (sessionId.equals(activeSessionId)) {
                applyClose(session, sequence, outcome);
            } else {
                session.eventBuffer().addLast(BufferedEvent.closed(sequence, outcome));
                if (outcome == CloseOutcome.GAVE_UP || outcome == CloseOutcome.AUTH_FAILED) {
                    session.markFailed();
                }
            }
            refresh(session);
        }
    }

    private void connectionOpened(String sessionId) {
        synchronized (lock) {
            Session session = sessions.get(sessionId);
            if (session != null) {
                session.clearFailure();
                refresh(session);
            }
        }
    }

    private void replay(Session session) {
        int count = session.eventBuffer().size();
        if (count == 0) {
            return;
        }
        LOG.debug("Replaying buffered events", Map.of("sessionId", session.getId(), "count", count));
        BufferedEvent event;
        while ((event = session.eventBuffer().pollFirst()) != null) {
            if (event.isFrame()) {
                applyFrame(session, event.sequence(), event.frame());
            } else {
                applyClose(session, event.sequence(), event.outcome());
            }
        }
    }

    private void applyFrame(Session session, long sequence, ProtocolFrame frame) {
        if (!session.markApplied(sequence)) {
            LOG.debug("Skipping event applied before", Map.of("sessionId", session.getId(),
                    "event", frame.wireName()));
            return;
        }
        EventType type = frame.type();
        if (type == EventType.STREAM_STARTED || type == EventType.PROACTIVE_START) {
            session.setExchangeCancelled(false);
        } else if (session.isExchangeCancelled() && isExchangeOutput(type)) {
            LOG.debug("Dropping output of cancelled exchange", Map.of("sessionId", session.getId(),
                    "event", frame.wireName()));
            return;
        }
        try {
            handler.apply(session, frame);
        } catch (RuntimeException e) {
            LOG.error("Event handling failed", Map.of("sessionId", session.getId(), "event", frame.wireName()), e);
        }
    }

    private void applyClose(Session session, long sequence, CloseOutcome outcome) {
        if (!session.markApplied(sequence)) {
            return;
        }
        try {
            handler.applyClose(session, outcome);
        } catch (RuntimeException e) {
            LOG.error("Close handling failed", Map.of("sessionId", session.getId(), "outcome", outcome), e);
        }
    }

    // ==================== internals ====================

    private Session require(String sessionId) throws NoSuchSessionException {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new NoSuchSessionException(sessionId, "No session " + sessionId);
        }
        return session;
    }

    private void remove(Session session, String reason) {
        String id = session.getId();
        session.markTerminated();
        session.coordinator().terminate(reason);
        session.accumulator().discard();
        session.eventBuffer().clear();
        session.getConnection().close();
        sessions.remove(id);
        if (id.equals(activeSessionId)) {
            activeSessionId = null;
        }
        refresh(session);
        LOG.info("Session removed", Map.of("sessionId", id, "reason", String.valueOf(reason)));
        listener.onSessionRemoved(id);
    }

    private void refresh(Session session) {
        if (session.refreshStatus(session.getId().equals(activeSessionId))) {
            listener.onStatusChanged(session.getId(), session.getStatus());
        }
    }

    private static boolean isExchangeOutput(EventType type) {
        return switch (type) {
            case ASSISTANT_THINKING, CONTENT_CHUNK, TOOL_CALLS_DETECTED, TOOL_CALL, TOOL_EXECUTING, TOOL_RESULT,
                    MESSAGE_COMPLETE -> true;
            default -> false;
        };
    }

        private static ErrorPayload readError(ProtocolFrame frame) {
        try {
            return Payloads.read(frame, ErrorPayload.class);
        } catch (PayloadException e) {
            LOG.debug("Unreadable error payload", Map.of("error", String.valueOf(e.getMessage())));
            return null;
        }
    }

    /**
     * Connection callbacks of one session, handed to the dispatcher.
     * Credential failures reach the auth notifier at once, even for
     * background sessions.
     */
    private final class RoutingListener implements ConnectionListener {

        private final String sessionId;

        RoutingListener(String sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void onOpen(Connection connection) {
            dispatch(() -> connectionOpened(sessionId), "open");
        }

        @Override
        public void onFrame(Connection connection, ProtocolFrame frame) {
            if (frame.type() == EventType.ERROR) {
                onErrorFrame(connection, frame);
            }
            dispatch(() -> route(sessionId, frame), frame.wireName());
        }

        /**
         * An error ends a request stream, and credential or rate-limit errors
         * end any connection. Closing here, before the transport reports the
         * end, keeps that end from counting as a drop.
         */
        private void onErrorFrame(Connection connection, ProtocolFrame frame) {
            ErrorPayload error = readError(frame);
            boolean auth = error != null && error.isAuthFailure();
            boolean rateLimited = error != null && error.isRateLimited();
            if (auth) {
                authNotifier.notifyTokenExpired();
            }
            ConnectionTarget target = connection.getTarget();
            if (auth || rateLimited || (target != null && target.kind() == TransportKind.REQUEST_STREAM)) {
                connection.close();
            }
        }

        @Override
        public void onClosed(Connection connection, CloseOutcome outcome) {
            if (outcome == CloseOutcome.AUTH_FAILED) {
                authNotifier.notifyTokenExpired();
            }
            dispatch(() -> routeClose(sessionId, outcome), "close");
        }

        /**
         * Transports may still report after the client shut its dispatcher
         * down; those late callbacks are dropped.
         */
        private void dispatch(Runnable task, String event) {
            try {
                dispatcher.execute(task);
            } catch (RejectedExecutionException e) {
                LOG.debug("Dispatcher stopped, dropping callback", Map.of("sessionId", sessionId, "event", event));
            }
        }
    }
}
