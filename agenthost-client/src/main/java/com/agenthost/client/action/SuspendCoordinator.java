package com.agenthost.client.action;

import com.agenthost.client.error.AlreadyResolvedException;
import com.agenthost.protocol.outbound.OutboundMessage;
import com.agenthost.protocol.payload.WidgetRequest;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Suspend/resume state machine for one session:
 * {@code RUNNING -> SUSPENDED -> RUNNING}, or {@code -> TERMINATED} when the
 * session ends while suspended.
 * <p>
 * At most one {@link PendingAction} exists at a time. A {@code run_suspended}
 * without action details suspends the run with no pending action yet; the
 * {@code client_action} that follows fills it in.
 * <p>
 * Not thread-safe; the owning session serializes access.
 */
@Slf4j
public class SuspendCoordinator {

    private static final int RESOLVED_HISTORY = 64;

    private final String sessionId;
    private final ResponseSender sender;
    private final ActionSink sink;
    private final Set<String> resolvedIds = Collections.newSetFromMap(new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > RESOLVED_HISTORY;
        }
    });

    private RunState state = RunState.RUNNING;
    private PendingAction pendingAction;

    public SuspendCoordinator(String sessionId, ResponseSender sender, ActionSink sink) {
        this.sessionId = sessionId;
        this.sender = sender;
        this.sink = sink;
    }

    public RunState getState() {
        return state;
    }

    public Optional<PendingAction> pendingAction() {
        return Optional.ofNullable(pendingAction);
    }

    public boolean isSuspended() {
        return state == RunState.SUSPENDED;
    }

    // ==================== server events ====================

    /**
     * {@code client_action} / {@code widget}.
     *
     * @return false if an action is already pending (the request is ignored)
     */
    public boolean onClientAction(WidgetRequest request) {
        if (state == RunState.TERMINATED) {
            log.debug("Session {} terminated, ignoring widget request {}", sessionId, request.actionId());
            return false;
        }
        if (pendingAction != null) {
            log.warn("Session {} already waiting on {}, ignoring duplicate widget request {}",
                    sessionId, pendingAction.getActionId(), request.actionId());
            return false;
        }
        if (resolvedIds.contains(request.actionId())) {
            log.warn("Session {} received widget request {} that was already resolved", sessionId,
                    request.actionId());
            return false;
        }
        pendingAction = new PendingAction(request);
        state = RunState.SUSPENDED;
        sink.onWidgetRequested(pendingAction);
        return true;
    }

    /**
     * {@code run_suspended}. Carries an action only on some servers.
     */
    public void onRunSuspended(JsonNode payload) {
        Optional<WidgetRequest> request = WidgetRequest.fromClientAction(payload)
                .or(() -> WidgetRequest.fromPendingAction(payload.get("pending_action")));
        if (request.isPresent()) {
            onClientAction(request.get());
            return;
        }
        if (state == RunState.RUNNING) {
            state = RunState.SUSPENDED;
        }
    }

    /**
     * {@code run_resumed}: the server says the run continues. This wins over
     * local bookkeeping, so any pending action is cleared unanswered.
     */
    public void onRunResumed() {
        if (state == RunState.TERMINATED) {
            return;
        }
        clearPending("run resumed by server");
        state = RunState.RUNNING;
    }

    /**
     * {@code state} snapshot; restores a pending action after a reconnect.
     */
    public void onState(JsonNode payload) {
        JsonNode pending = payload.get("pending_action");
        if (pending == null || pending.isNull()) {
            return;
        }
        if (pendingAction != null) {
            log.debug("Session {} state repeats pending action, keeping {}", sessionId, pendingAction.getActionId());
            return;
        }
        WidgetRequest.fromPendingAction(pending).ifPresent(this::onClientAction);
    }

    // ==================== user side ====================

    /**
     * Accept the answer to the pending action and forward it to the server.
     *
     * @throws AlreadyResolvedException if {@code actionId} is not the pending
     *                                  action (answered, cleared or unknown)
     */
    public CompletableFuture<Void> resolve(String actionId, JsonNode value) throws AlreadyResolvedException {
        if (pendingAction == null || !pendingAction.getActionId().equals(actionId)) {
            String reason = resolvedIds.contains(actionId) ? "already resolved" : "not pending";
            throw new AlreadyResolvedException(sessionId, "Action " + actionId + " is " + reason);
        }
        PendingAction action = pendingAction;
        if (!action.resolve(value)) {
            throw new AlreadyResolvedException(sessionId, "Action " + actionId + " is already resolved");
        }
        resolvedIds.add(actionId);
        pendingAction = null;
        state = RunState.RUNNING;
        sink.onWidgetCleared(action);
        return sender.send(new OutboundMessage.SubmitResponse(actionId, action.getWidgetType(), value));
    }

    // ==================== session end ====================

    /**
     * Clear suspension after an error without ending the session.
     */
    public void reset(String reason) {
        if (state == RunState.TERMINATED) {
            return;
        }
        clearPending(reason);
        state = RunState.RUNNING;
    }

    /**
     * The session is ending; any pending action is abandoned.
     */
    public void terminate(String reason) {
        clearPending(reason);
        state = RunState.TERMINATED;
    }

    private void clearPending(String reason) {
        if (pendingAction == null) {
            return;
        }
        PendingAction action = pendingAction;
        pendingAction = null;
        resolvedIds.add(action.getActionId());
        action.abandon(reason);
        sink.onWidgetCleared(action);
    }
}
