package com.agenthost.client.action;

import com.agenthost.client.error.AlreadyResolvedException;
import com.agenthost.client.support.Frames;
import com.agenthost.protocol.outbound.OutboundMessage;
import com.agenthost.protocol.payload.WidgetRequest;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class SuspendCoordinatorTest {

    private final List<OutboundMessage.SubmitResponse> sent = new ArrayList<>();
    private final List<String> shown = new ArrayList<>();
    private final List<String> cleared = new ArrayList<>();

    private final SuspendCoordinator coordinator = new SuspendCoordinator("s1", response -> {
        sent.add(response);
        return CompletableFuture.completedFuture(null);
    }, new ActionSink() {
        @Override
        public void onWidgetRequested(PendingAction action) {
            shown.add(action.getActionId());
        }

        @Override
        public void onWidgetCleared(PendingAction action) {
            cleared.add(action.getActionId());
        }
    });

    @Test
    void clientAction_suspendsWithOnePendingAction() {
        assertTrue(coordinator.onClientAction(request("x1")));

        assertEquals(RunState.SUSPENDED, coordinator.getState());
        PendingAction action = coordinator.pendingAction().orElseThrow();
        assertEquals("x1", action.getActionId());
        assertEquals("multiple_choice", action.getWidgetType());
        assertTrue(action.isShowUserResponseAsBubble());
        assertEquals(List.of("x1"), shown);
    }

    @Test
    void secondClientActionWhilePending_isIgnored() {
        coordinator.onClientAction(request("x1"));

        assertFalse(coordinator.onClientAction(request("x2")));

        assertEquals("x1", coordinator.pendingAction().orElseThrow().getActionId());
        assertEquals(List.of("x1"), shown);
    }

    @Test
    void resolve_forwardsResponseAndResumes() throws Exception {
        coordinator.onClientAction(request("x1"));
        PendingAction action = coordinator.pendingAction().orElseThrow();
        JsonNode value = Frames.json("{\"selected\":\"B\"}");

        coordinator.resolve("x1", value).join();

        assertEquals(RunState.RUNNING, coordinator.getState());
        assertTrue(coordinator.pendingAction().isEmpty());
        assertEquals(List.of(new OutboundMessage.SubmitResponse("x1", "multiple_choice", value)), sent);
        assertEquals(value, action.response().join());
        assertEquals(List.of("x1"), cleared);
    }

    @Test
    void resolveTwice_failsWithAlreadyResolved() throws Exception {
        coordinator.onClientAction(request("x1"));
        coordinator.resolve("x1", Frames.json("1"));

        AlreadyResolvedException e = assertThrows(AlreadyResolvedException.class,
                () -> coordinator.resolve("x1", Frames.json("2")));

        assertTrue(e.getMessage().contains("already resolved"));
        assertEquals(1, sent.size());
    }

    @Test
    void resolveUnknownAction_fails() {
        coordinator.onClientAction(request("x1"));

        assertThrows(AlreadyResolvedException.class, () -> coordinator.resolve("nope", Frames.json("1")));
        assertEquals(RunState.SUSPENDED, coordinator.getState());
    }

    @Test
    void resolvedActionRepeatedByServer_isNotShownAgain() throws Exception {
        coordinator.onClientAction(request("x1"));
        coordinator.resolve("x1", Frames.json("1"));

        assertFalse(coordinator.onClientAction(request("x1")));
        assertEquals(RunState.RUNNING, coordinator.getState());
    }

    @Test
    void runResumed_clearsPendingActionUnanswered() {
        coordinator.onClientAction(request("x1"));
        PendingAction action = coordinator.pendingAction().orElseThrow();

        coordinator.onRunResumed();

        assertEquals(RunState.RUNNING, coordinator.getState());
        assertTrue(coordinator.pendingAction().isEmpty());
        assertTrue(sent.isEmpty());
        CompletionException e = assertThrows(CompletionException.class, () -> action.response().join());
        assertInstanceOf(ActionAbandonedException.class, e.getCause());
    }

    @Test
    void runSuspendedWithoutAction_waitsForClientAction() {
        coordinator.onRunSuspended(Frames.json("{\"reason\":\"waiting\"}"));
        assertEquals(RunState.SUSPENDED, coordinator.getState());
        assertTrue(coordinator.pendingAction().isEmpty());

        assertTrue(coordinator.onClientAction(request("x1")));
        assertEquals("x1", coordinator.pendingAction().orElseThrow().getActionId());
    }

    @Test
    void runSuspendedWithPendingAction_createsIt() {
        coordinator.onRunSuspended(Frames.json(
                "{\"pending_action\":{\"tool_call_id\":\"t7\",\"widget_type\":\"free_text\",\"props\":{}}}"));

        assertEquals("t7", coordinator.pendingAction().orElseThrow().getActionId());
    }

    @Test
    void stateSnapshot_restoresPendingActionOnce() {
        JsonNode state = Frames.json(
                "{\"pending_action\":{\"tool_call_id\":\"t7\",\"widget_type\":\"slider\",\"props\":{\"min\":0}}}");

        coordinator.onState(state);
        coordinator.onState(state);

        assertEquals("t7", coordinator.pendingAction().orElseThrow().getActionId());
        assertEquals(List.of("t7"), shown);
    }

    @Test
    void terminate_abandonsPendingActionAndRejectsNewOnes() {
        coordinator.onClientAction(request("x1"));
        PendingAction action = coordinator.pendingAction().orElseThrow();

        coordinator.terminate("session completed");

        assertEquals(RunState.TERMINATED, coordinator.getState());
        assertTrue(action.isResolved());
        assertFalse(coordinator.onClientAction(request("x2")));
        coordinator.onRunResumed();
        assertEquals(RunState.TERMINATED, coordinator.getState());
    }

    @Test
    void reset_clearsSuspensionButKeepsRunning() {
        coordinator.onClientAction(request("x1"));

        coordinator.reset("server error");

        assertEquals(RunState.RUNNING, coordinator.getState());
        assertTrue(coordinator.pendingAction().isEmpty());
        assertEquals(List.of("x1"), cleared);
    }

    @Test
    void pendingActionFuture_cannotBeCompletedByCaller() {
        coordinator.onClientAction(request("x1"));
        PendingAction action = coordinator.pendingAction().orElseThrow();

        action.response().complete(Frames.json("\"forged\""));

        assertFalse(action.isResolved());
    }

    private static WidgetRequest request(String actionId) {
        return WidgetRequest.fromClientAction(Frames.json(
                "{\"actionId\":\"" + actionId + "\",\"widgetType\":\"multiple_choice\"}")).orElseThrow();
    }
}
