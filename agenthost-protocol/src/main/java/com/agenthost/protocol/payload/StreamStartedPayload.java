package com.agenthost.protocol.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Carried by {@code stream_started} and {@code connected}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StreamStartedPayload {

    @JsonProperty("request_id")
    private String requestId;

    @JsonProperty("conversation_id")
    private String conversationId;

    @JsonProperty("session_id")
    private String sessionId;
}
