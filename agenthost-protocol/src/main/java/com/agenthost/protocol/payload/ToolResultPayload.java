package com.agenthost.protocol.payload;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * Outcome of a tool invocation. The socket variant carries only
 * {@code name}, {@code status} and {@code success}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolResultPayload {

    @JsonProperty("call_id")
    @JsonAlias({ "id", "tool_call_id" })
    private String callId;

    @JsonProperty("tool_name")
    @JsonAlias({ "name" })
    private String toolName;

    private Boolean success;

    private JsonNode result;

    private String error;

    private String status;

    @JsonProperty("execution_time_ms")
    private Long executionTimeMs;

    /**
     * Missing {@code success} counts as success unless an error is present.
     */
    public boolean succeeded() {
        if (success != null) {
            return success;
        }
        return error == null;
    }
}
