package com.agenthost.protocol.payload;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tool invocation announced by {@code tool_calls_detected} or the socket
 * {@code tool_call} frame.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCallPayload {

    @JsonProperty("call_id")
    @JsonAlias({ "id", "tool_call_id" })
    private String callId;

    @JsonProperty("tool_name")
    @JsonAlias({ "name" })
    private String toolName;

    private String status;

    private JsonNode arguments;
}
