package com.agenthost.client.action;

import com.agenthost.protocol.payload.WidgetRequest;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * A widget the agent is waiting on. Resolved exactly once: either answered by
 * the user or abandoned when the run moves on without an answer.
 */
public class PendingAction {

    private final String actionId;
    private final String widgetType;
    private final JsonNode props;
    private final boolean showUserResponseAsBubble;
    private final CompletableFuture<JsonNode> response = new CompletableFuture<>();

    PendingAction(WidgetRequest request) {
        this.actionId = request.actionId();
        this.widgetType = request.widgetType();
        this.props = request.props();
        this.showUserResponseAsBubble = request.showUserResponse();
    }

    public String getActionId() {
        return actionId;
    }

    public String getWidgetType() {
        return widgetType;
    }

    public JsonNode getProps() {
        return props;
    }

    public boolean isShowUserResponseAsBubble() {
        return showUserResponseAsBubble;
    }

    /**
     * Completes with the submitted value, or exceptionally with
     * {@link ActionAbandonedException}. Callers cannot complete it.
     */
    public CompletableFuture<JsonNode> response() {
        return response.copy();
    }

    public boolean isResolved() {
        return response.isDone();
    }

    boolean resolve(JsonNode value) {
        return response.complete(value);
    }

    boolean abandon(String reason) {
        return response.completeExceptionally(new ActionAbandonedException(actionId, reason));
    }

    @Override
    public String toString() {
        return "PendingAction{" + actionId + ", " + widgetType + "}";
    }
}
