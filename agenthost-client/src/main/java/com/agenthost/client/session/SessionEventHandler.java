package com.agenthost.client.session;

import com.agenthost.client.connection.CloseOutcome;
import com.agenthost.client.error.ErrorKind;
import com.agenthost.client.message.MessageAccumulator;
import com.agenthost.protocol.ProtocolFrame;
import com.agenthost.protocol.TransportKind;
import com.agenthost.protocol.payload.ErrorPayload;
import com.agenthost.protocol.payload.Payloads;
import com.agenthost.protocol.payload.StreamStartedPayload;
import com.agenthost.protocol.payload.TemplateCompletePayload;
import com.agenthost.protocol.payload.TemplateConfigPayload;
import com.agenthost.protocol.payload.TemplateProgressPayload;
import com.agenthost.protocol.payload.ToolCallPayload;
import com.agenthost.protocol.payload.ToolCallsDetectedPayload;
import com.agenthost.protocol.payload.ToolResultPayload;
import com.agenthost.protocol.payload.WidgetRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Applies one event to a session: the live path, used both for fresh frames
 * of the session in front and for replaying a background session's buffer.
 * <p>
 * Every event type has a branch; adding a type to
 * {@link com.agenthost.protocol.EventType} without handling it here does not
 * compile.
 */
@Slf4j
class SessionEventHandler {

    static final String CONNECTION_LOST_PLACEHOLDER = "_Connection lost_";

    private final SessionListener listener;

    SessionEventHandler(SessionListener listener) {
        this.listener = listener;
    }

    /**
     * @return false if the frame had no effect on the session
     */
    boolean apply(Session session, ProtocolFrame frame) {
        return switch (frame.type()) {
            case STREAM_STARTED -> onStreamStarted(session, frame);
            case ASSISTANT_THINKING -> onThinking(session);
            case PROACTIVE_START -> onProactiveStart(session);
            case CONTENT_CHUNK -> onContent(session, frame);
            case TOOL_CALLS_DETECTED -> onToolCallsDetected(session, frame);
            case TOOL_CALL -> onToolCall(session, frame);
            case TOOL_EXECUTING -> onToolExecuting(session, frame);
            case TOOL_RESULT -> onToolResult(session, frame);
            case MESSAGE_COMPLETE -> onMessageComplete(session, frame);
            case MESSAGE_ADDED -> onMessageAdded(session, frame);
            case STREAM_COMPLETE -> onStreamComplete(session);
            case SESSION_COMPLETED -> onSessionCompleted(session);
            case CANCELLED -> onCancelled(session);
            case ERROR -> onError(session, frame);
            case CLIENT_ACTION -> onClientAction(session, frame);
            case RUN_SUSPENDED -> onRunSuspended(session, frame);
            case RUN_RESUMED -> onRunResumed(session);
            case STATE -> onState(session, frame);
            case CONNECTED -> onConnected(session, frame);
            case TEMPLATE_CONFIG -> onTemplateConfig(session, frame);
            case TEMPLATE_PROGRESS -> onTemplateProgress(session, frame);
            case TEMPLATE_COMPLETE -> onTemplateComplete(session, frame);
            case RESTRICTIONS_UPDATED -> onRestrictionsUpdated(session, frame);
            case HEARTBEAT, PONG -> false;
        };
    }

    /**
     * Applies the end of a connection.
     */
    void applyClose(Session session, CloseOutcome outcome) {
        MessageAccumulator accumulator = session.accumulator();
        switch (outcome) {
            case CLEAN -> {
                if (session.isExchangeOpen() || accumulator.hasActiveMessage()) {
                    accumulator.finishExchange();
                }
                session.setExchangeOpen(false);
            }
            case RECONNECTING -> log.debug("Session {} reconnecting", session.getId());
            case GAVE_UP -> {
                if (accumulator.hasActiveMessage()) {
                    accumulator.fail(CONNECTION_LOST_PLACEHOLDER, true);
                }
                session.coordinator().reset("connection lost");
                session.setExchangeOpen(false);
                session.markFailed();
                listener.onSessionError(session.getId(), ErrorKind.TRANSPORT, "Connection lost");
            }
            case AUTH_FAILED -> {
                if (accumulator.hasActiveMessage()) {
                    accumulator.fail(MessageAccumulator.SESSION_EXPIRED_PLACEHOLDER, true);
                }
                session.coordinator().reset("session expired");
                session.setExchangeOpen(false);
                session.markFailed();
                listener.onSessionError(session.getId(), ErrorKind.AUTH, "Session expired");
            }
            case RATE_LIMITED -> {
                accumulator.discard();
                session.coordinator().reset("rate limited");
                session.setExchangeOpen(false);
                listener.onSessionError(session.getId(), ErrorKind.RATE_LIMITED, "Rate limit exceeded");
            }
        }
    }

    // ==================== exchange ====================

    private boolean onStreamStarted(Session session, ProtocolFrame frame) {
        StreamStartedPayload payload = Payloads.read(frame, StreamStartedPayload.class);
        if (payload.getRequestId() != null) {
            session.setRequestId(payload.getRequestId());
        }
        captureConversation(session, payload.getConversationId());
        session.setExchangeOpen(true);
        session.accumulator().begin();
        return true;
    }

    private boolean onThinking(Session session) {
        session.accumulator().begin();
        return true;
    }

    private boolean onProactiveStart(Session session) {
        session.setExchangeOpen(true);
        session.accumulator().begin();
        return true;
    }

    private boolean onStreamComplete(Session session) {
        MessageAccumulator accumulator = session.accumulator();
        if (!session.isExchangeOpen() && !accumulator.hasActiveMessage() && !accumulator.hasCarriedToolData()) {
            log.debug("Session {} has no open exchange, ignoring stream_complete", session.getId());
            return false;
        }
        accumulator.finishExchange();
        session.setExchangeOpen(false);
        return true;
    }

    private boolean onSessionCompleted(Session session) {
        session.accumulator().finishExchange();
        session.setExchangeOpen(false);
        session.coordinator().terminate("session completed");
        session.markCompleted();
        return true;
    }

    private boolean onCancelled(Session session) {
        MessageAccumulator accumulator = session.accumulator();
        boolean changed = accumulator.cancel();
        if (accumulator.hasCarriedToolData()) {
            accumulator.finishExchange();
            changed = true;
        }
        session.coordinator().reset("exchange cancelled");
        session.setExchangeOpen(false);
        return changed;
    }

    private boolean onError(Session session, ProtocolFrame frame) {
        ErrorPayload error = Payloads.read(frame, ErrorPayload.class);
        MessageAccumulator accumulator = session.accumulator();
        session.coordinator().reset("server error");
        session.setExchangeOpen(false);
        String message = error.messageOr("An unknown error occurred");
        if (error.isAuthFailure()) {
            accumulator.fail(MessageAccumulator.SESSION_EXPIRED_PLACEHOLDER, true);
            session.markFailed();
            listener.onSessionError(session.getId(), ErrorKind.AUTH, message);
        } else if (error.isRateLimited()) {
            accumulator.discard();
            listener.onSessionError(session.getId(), ErrorKind.RATE_LIMITED, message);
        } else {
            accumulator.fail("_Error: " + message + "_", false);
            listener.onSessionError(session.getId(), ErrorKind.SERVER, message);
        }
        return true;
    }

    // ==================== content and tools ====================

    private boolean onContent(Session session, ProtocolFrame frame) {
        String content = frame.text("content");
        if (content == null) {
            return false;
        }
        session.accumulator().appendChunk(content);
        return true;
    }

    private boolean onToolCallsDetected(Session session, ProtocolFrame frame) {
        ToolCallsDetectedPayload payload = Payloads.read(frame, ToolCallsDetectedPayload.class);
        if (payload.getToolCalls() == null || payload.getToolCalls().isEmpty()) {
            return false;
        }
        session.accumulator().toolCallsDetected(payload.getToolCalls());
        return true;
    }

    private boolean onToolCall(Session session, ProtocolFrame frame) {
        ToolCallPayload call = Payloads.read(frame, ToolCallPayload.class);
        session.accumulator().toolCall(call.getCallId(), call.getToolName(), call.getStatus());
        return true;
    }

    private boolean onToolExecuting(Session session, ProtocolFrame frame) {
        String name = frame.text("tool_name");
        session.accumulator().toolExecuting(name != null ? name : frame.text("name"));
        return true;
    }

    private boolean onToolResult(Session session, ProtocolFrame frame) {
        session.accumulator().toolResult(Payloads.read(frame, ToolResultPayload.class));
        return true;
    }

    private boolean onMessageComplete(Session session, ProtocolFrame frame) {
        session.accumulator().complete(frame.text("content"));
        return true;
    }

    private boolean onMessageAdded(Session session, ProtocolFrame frame) {
        JsonNode nested = frame.payload().get("message");
        listener.onMessageAdded(session.getId(), nested != null && nested.isObject() ? nested : frame.payload());
        return true;
    }

    // ==================== suspend / resume ====================

    private boolean onClientAction(Session session, ProtocolFrame frame) {
        Optional<WidgetRequest> request = WidgetRequest.fromClientAction(frame.payload());
        if (request.isEmpty()) {
            log.warn("Session {} received {} without a widget, ignoring", session.getId(), frame.wireName());
            return false;
        }
        if (session.getTransportKind() == TransportKind.DUPLEX_SOCKET && session.accumulator().hasActiveMessage()) {
            session.accumulator().complete(null);
        }
        return session.coordinator().onClientAction(request.get());
    }

    private boolean onRunSuspended(Session session, ProtocolFrame frame) {
        session.coordinator().onRunSuspended(frame.payload());
        return true;
    }

    private boolean onRunResumed(Session session) {
        session.coordinator().onRunResumed();
        return true;
    }

    private boolean onState(Session session, ProtocolFrame frame) {
        captureConversation(session, frame.text("conversation_id"));
        session.coordinator().onState(frame.payload());
        return true;
    }

    private boolean onConnected(Session session, ProtocolFrame frame) {
        captureConversation(session, frame.text("conversation_id"));
        session.clearFailure();
        return true;
    }

    // ==================== template and restrictions ====================

    private boolean onTemplateConfig(Session session, ProtocolFrame frame) {
        session.getTemplateState().setConfig(Payloads.read(frame, TemplateConfigPayload.class));
        listener.onTemplateChanged(session.getId(), session.getTemplateState());
        return true;
    }

    private boolean onTemplateProgress(Session session, ProtocolFrame frame) {
        session.getTemplateState().setProgress(Payloads.read(frame, TemplateProgressPayload.class));
        listener.onTemplateChanged(session.getId(), session.getTemplateState());
        return true;
    }

    private boolean onTemplateComplete(Session session, ProtocolFrame frame) {
        session.getTemplateState().setCompletion(Payloads.read(frame, TemplateCompletePayload.class));
        listener.onTemplateChanged(session.getId(), session.getTemplateState());
        return true;
    }

    private boolean onRestrictionsUpdated(Session session, ProtocolFrame frame) {
        RestrictionSet updated = RestrictionPolicy.apply(session.getRestrictions(), frame.payload());
        if (updated.equals(session.getRestrictions())) {
            return false;
        }
        session.setRestrictions(updated);
        listener.onRestrictionsChanged(session.getId(), updated);
        return true;
    }

    private void captureConversation(Session session, String conversationId) {
        if (conversationId != null && !conversationId.equals(session.getConversationId())) {
            session.setConversationId(conversationId);
            listener.onConversationStarted(session.getId(), conversationId);
        }
    }
}
