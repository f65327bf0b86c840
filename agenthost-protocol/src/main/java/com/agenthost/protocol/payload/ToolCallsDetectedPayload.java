package com.agenthost.protocol.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolCallsDetectedPayload {

    @JsonProperty("tool_calls")
    private List<ToolCallPayload> toolCalls = new ArrayList<>();
}
