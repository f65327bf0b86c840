package com.agenthost.client.session;

import com.agenthost.client.action.PendingAction;
import com.agenthost.client.error.ErrorKind;
import com.agenthost.client.message.MessageSnapshot;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Rendering side of the multiplexer. Message and widget callbacks are only
 * made for the session in front; a background session's events are replayed
 * when it is switched to.
 * <p>
 * Called on the multiplexer's dispatch thread, or on the thread of the API
 * call that caused the change, with the multiplexer lock held.
 */
public interface SessionListener {

    default void onMessageUpdated(String sessionId, MessageSnapshot message) {
    }

    default void onMessageFinalized(String sessionId, MessageSnapshot message) {
    }

    default void onMessageDropped(String sessionId, String messageId) {
    }

    /**
     * A message the server persisted, e.g. the echo of a widget answer.
     */
    default void onMessageAdded(String sessionId, JsonNode message) {
    }

    default void onWidgetRequested(String sessionId, PendingAction action) {
    }

    default void onWidgetCleared(String sessionId, PendingAction action) {
    }

    /**
     * The user's widget answer, as text to show in a bubble.
     */
    default void onUserResponse(String sessionId, String displayText) {
    }

    default void onStatusChanged(String sessionId, SessionStatus status) {
    }

    default void onSessionError(String sessionId, ErrorKind kind, String message) {
    }

    default void onTemplateChanged(String sessionId, TemplateState state) {
    }

    default void onRestrictionsChanged(String sessionId, RestrictionSet restrictions) {
    }

    default void onConversationStarted(String sessionId, String conversationId) {
    }

    default void onSessionRemoved(String sessionId) {
    }
}
