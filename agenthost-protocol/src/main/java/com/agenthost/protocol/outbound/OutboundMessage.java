package com.agenthost.protocol.outbound;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Messages the client sends to the server.
 */
public sealed interface OutboundMessage
        permits OutboundMessage.StartExchange, OutboundMessage.SubmitResponse,
        OutboundMessage.CancelExchange, OutboundMessage.Ping {

    /**
     * User text plus model/definition selector. A {@code null} text asks a
     * proactive agent to open the conversation itself.
     */
    record StartExchange(String text, String conversationId, String modelId, String definitionId)
            implements OutboundMessage {

        public static StartExchange proactive(String conversationId, String definitionId) {
            return new StartExchange(null, conversationId, null, definitionId);
        }

        public boolean agentInitiated() {
            return text == null;
        }
    }

    /**
     * Answer to a pending widget, correlated by action id.
     */
    record SubmitResponse(String actionId, String widgetType, JsonNode value) implements OutboundMessage {

        public SubmitResponse {
            Objects.requireNonNull(actionId, "actionId");
        }
    }

    /**
     * Cancel the exchange identified by {@code requestId} (may be null on the
     * socket, where the current exchange is implied).
     */
    record CancelExchange(String requestId) implements OutboundMessage {
    }

    record Ping() implements OutboundMessage {
    }
}
