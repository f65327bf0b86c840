package com.agenthost.protocol.payload;

import com.agenthost.protocol.EventType;
import com.agenthost.protocol.ProtocolFrame;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PayloadsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static ProtocolFrame frame(EventType type, String json) throws Exception {
        return ProtocolFrame.of(type, MAPPER.readTree(json));
    }

    @Test
    void toolResult_streamShape() throws Exception {
        ToolResultPayload result = Payloads.read(frame(EventType.TOOL_RESULT, """
                {"call_id":"c1","tool_name":"search","success":false,"error":"timeout","execution_time_ms":1200}
                """), ToolResultPayload.class);
        assertEquals("c1", result.getCallId());
        assertEquals("search", result.getToolName());
        assertFalse(result.succeeded());
        assertEquals("timeout", result.getError());
        assertEquals(1200L, result.getExecutionTimeMs());
    }

    @Test
    void toolResult_socketShape() throws Exception {
        ToolResultPayload result = Payloads.read(frame(EventType.TOOL_RESULT,
                "{\"name\":\"search\",\"status\":\"done\"}"), ToolResultPayload.class);
        assertEquals("search", result.getToolName());
        assertNull(result.getCallId());
        assertTrue(result.succeeded());
    }

    @Test
    void toolCallsDetected() throws Exception {
        ToolCallsDetectedPayload detected = Payloads.read(frame(EventType.TOOL_CALLS_DETECTED,
                "{\"tool_calls\":[{\"id\":\"c1\",\"name\":\"search\"},{\"call_id\":\"c2\",\"tool_name\":\"calc\"}]}"),
                ToolCallsDetectedPayload.class);
        assertEquals(2, detected.getToolCalls().size());
        assertEquals("c1", detected.getToolCalls().get(0).getCallId());
        assertEquals("calc", detected.getToolCalls().get(1).getToolName());
    }

    @Test
    void error_authAndRateLimit() throws Exception {
        ErrorPayload auth = Payloads.read(frame(EventType.ERROR,
                "{\"error\":\"Token expired\",\"error_code\":\"session_expired\"}"), ErrorPayload.class);
        assertTrue(auth.isAuthFailure());
        assertFalse(auth.isRateLimited());

        ErrorPayload socket = Payloads.read(frame(EventType.ERROR,
                "{\"type\":\"error\",\"message\":\"Rate limit exceeded\"}"), ErrorPayload.class);
        assertEquals("Rate limit exceeded", socket.getError());
        assertTrue(socket.isRateLimited());
        assertEquals("fallback", new ErrorPayload().messageOr("fallback"));
    }

    @Test
    void wrongShape_throwsPayloadException() throws Exception {
        ProtocolFrame bad = frame(EventType.TOOL_CALLS_DETECTED, "{\"tool_calls\":\"not-a-list\"}");
        PayloadException e = assertThrows(PayloadException.class,
                () -> Payloads.read(bad, ToolCallsDetectedPayload.class));
        assertEquals("tool_calls_detected", e.getEventName());
    }
}
