package com.agenthost.client.support;

import com.agenthost.client.action.PendingAction;
import com.agenthost.client.error.ErrorKind;
import com.agenthost.client.message.MessageSnapshot;
import com.agenthost.client.session.RestrictionSet;
import com.agenthost.client.session.SessionListener;
import com.agenthost.client.session.SessionStatus;
import com.agenthost.client.session.TemplateState;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps every callback as a line, plus typed lists for the common checks.
 */
public class RecordingSessionListener implements SessionListener {

    public record Finalized(String sessionId, MessageSnapshot message) {
    }

    public record SessionError(String sessionId, ErrorKind kind, String message) {
    }

    public final List<String> log = new ArrayList<>();
    public final List<Finalized> finalized = new ArrayList<>();
    public final List<SessionError> errors = new ArrayList<>();
    public final List<PendingAction> widgets = new ArrayList<>();
    public final List<String> userResponses = new ArrayList<>();
    public final List<JsonNode> added = new ArrayList<>();

    @Override
    public void onMessageUpdated(String sessionId, MessageSnapshot message) {
        log.add(sessionId + ":updated:" + message.status() + ":" + message.content());
    }

    @Override
    public void onMessageFinalized(String sessionId, MessageSnapshot message) {
        log.add(sessionId + ":finalized:" + message.status() + ":" + message.content());
        finalized.add(new Finalized(sessionId, message));
    }

    @Override
    public void onMessageDropped(String sessionId, String messageId) {
        log.add(sessionId + ":dropped:" + messageId);
    }

    @Override
    public void onMessageAdded(String sessionId, JsonNode message) {
        added.add(message);
    }

    @Override
    public void onWidgetRequested(String sessionId, PendingAction action) {
        log.add(sessionId + ":widget:" + action.getActionId());
        widgets.add(action);
    }

    @Override
    public void onWidgetCleared(String sessionId, PendingAction action) {
        log.add(sessionId + ":widget-cleared:" + action.getActionId());
    }

    @Override
    public void onUserResponse(String sessionId, String displayText) {
        userResponses.add(displayText);
    }

    @Override
    public void onStatusChanged(String sessionId, SessionStatus status) {
        log.add(sessionId + ":status:" + status);
    }

    @Override
    public void onSessionError(String sessionId, ErrorKind kind, String message) {
        errors.add(new SessionError(sessionId, kind, message));
    }

    @Override
    public void onTemplateChanged(String sessionId, TemplateState state) {
        log.add(sessionId + ":template");
    }

    @Override
    public void onRestrictionsChanged(String sessionId, RestrictionSet restrictions) {
        log.add(sessionId + ":restrictions:" + restrictions);
    }

    @Override
    public void onSessionRemoved(String sessionId) {
        log.add(sessionId + ":removed");
    }

    public List<Finalized> finalizedFor(String sessionId) {
        return finalized.stream().filter(f -> f.sessionId().equals(sessionId)).toList();
    }

    public long count(String entry) {
        return log.stream().filter(entry::equals).count();
    }
}
