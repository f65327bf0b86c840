package com.agenthost.client.action;

/**
 * Rendering side of the suspend/resume handshake.
 */
public interface ActionSink {

    void onWidgetRequested(PendingAction action);

    void onWidgetCleared(PendingAction action);
}
