package com.agenthost.protocol.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WidgetRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String raw) throws Exception {
        return MAPPER.readTree(raw);
    }

    @Test
    void legacyActionShape() throws Exception {
        WidgetRequest request = WidgetRequest.fromClientAction(json("""
                {"action": {"tool_call_id": "tc-1", "tool_name": "present_choices",
                            "props": {"prompt": "Pick one", "options": ["a", "b"]}}}
                """)).orElseThrow();

        assertEquals("tc-1", request.actionId());
        assertEquals(WidgetTypes.MULTIPLE_CHOICE, request.widgetType());
        assertEquals("Pick one", request.props().get("prompt").asText());
        assertTrue(request.showUserResponse());
    }

    @Test
    void templateShape_mapsStemToPrompt() throws Exception {
        WidgetRequest request = WidgetRequest.fromClientAction(json("""
                {"action_type": "widget", "widget_type": "free_text", "item_id": "item-3",
                 "stem": "Explain recursion", "required": true, "show_user_response": false}
                """)).orElseThrow();

        assertEquals("item-3", request.actionId());
        assertEquals("free_text", request.widgetType());
        assertEquals("Explain recursion", request.props().get("prompt").asText());
        assertTrue(request.props().get("required").asBoolean());
        assertFalse(request.showUserResponse());
    }

    @Test
    void camelCaseShape() throws Exception {
        WidgetRequest request = WidgetRequest.fromClientAction(json("{\"actionId\":\"x1\",\"widgetType\":\"multiple_choice\"}"))
                .orElseThrow();
        assertEquals("x1", request.actionId());
        assertEquals("multiple_choice", request.widgetType());
    }

    @Test
    void unknownWidgetTypePassesThrough() throws Exception {
        WidgetRequest request = WidgetRequest.fromClientAction(json("{\"widget_type\":\"drawing_canvas\"}"))
                .orElseThrow();
        assertEquals("drawing_canvas", request.widgetType());
        assertTrue(request.actionId().startsWith("action-"));
    }

    @Test
    void neitherShape_empty() throws Exception {
        assertTrue(WidgetRequest.fromClientAction(json("{\"foo\":1}")).isEmpty());
        assertTrue(WidgetRequest.fromClientAction(null).isEmpty());
    }

    @Test
    void pendingActionFromState() throws Exception {
        WidgetRequest request = WidgetRequest.fromPendingAction(json("{\"tool_call_id\":\"tc-9\",\"widget_type\":\"code_editor\"}"))
                .orElseThrow();
        assertEquals("tc-9", request.actionId());
        assertEquals(WidgetTypes.CODE_EDITOR, request.widgetType());
    }
}
