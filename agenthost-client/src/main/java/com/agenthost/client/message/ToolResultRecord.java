package com.agenthost.client.message;

import com.agenthost.protocol.payload.ToolResultPayload;
import com.fasterxml.jackson.databind.JsonNode;

public record ToolResultRecord(String callId, String name, boolean success, String resultSummary,
        String errorDetail, Long elapsedMs) {

    /**
     * @param callId correlation id to record, which may differ from the
     *               payload's when it was resolved by tool name
     */
    public static ToolResultRecord fromPayload(ToolResultPayload payload, String callId) {
        JsonNode result = payload.getResult();
        String summary = result == null || result.isNull() ? null
                : result.isTextual() ? result.asText() : result.toString();
        return new ToolResultRecord(callId, payload.getToolName(), payload.succeeded(), summary,
                payload.getError(), payload.getExecutionTimeMs());
    }
}
