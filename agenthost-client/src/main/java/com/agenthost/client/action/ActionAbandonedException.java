package com.agenthost.client.action;

/**
 * Completes a {@link PendingAction#response()} that will never be answered.
 */
public class ActionAbandonedException extends RuntimeException {

    private final String actionId;

    public ActionAbandonedException(String actionId, String reason) {
        super("Action " + actionId + " abandoned: " + reason);
        this.actionId = actionId;
    }

    public String getActionId() {
        return actionId;
    }
}
