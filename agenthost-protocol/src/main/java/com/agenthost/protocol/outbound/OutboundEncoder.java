package com.agenthost.protocol.outbound;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * JSON encodings of {@link OutboundMessage} for both transports.
 */
public final class OutboundEncoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OutboundEncoder() {
    }

    // ==================== duplex socket ====================

    /**
     * One socket text message: {@code start}, {@code message},
     * {@code widget_response}, {@code cancel} or {@code ping}.
     */
    public static String toSocketText(OutboundMessage message) {
        ObjectNode node = MAPPER.createObjectNode();
        if (message instanceof OutboundMessage.StartExchange start) {
            if (start.agentInitiated()) {
                node.put("type", "start");
            } else {
                node.put("type", "message");
                node.put("content", start.text());
            }
            putIfPresent(node, "conversation_id", start.conversationId());
            putIfPresent(node, "model_id", start.modelId());
            putIfPresent(node, "definition_id", start.definitionId());
        } else if (message instanceof OutboundMessage.SubmitResponse response) {
            node.put("type", "widget_response");
            node.put("action_id", response.actionId());
            putIfPresent(node, "widget_type", response.widgetType());
            node.set("value", response.value());
        } else if (message instanceof OutboundMessage.CancelExchange cancel) {
            node.put("type", "cancel");
            putIfPresent(node, "request_id", cancel.requestId());
        } else if (message instanceof OutboundMessage.Ping) {
            node.put("type", "ping");
        } else {
            throw new IllegalArgumentException("Unsupported outbound message: " + message);
        }
        return write(node);
    }

    // ==================== request stream ====================

    /**
     * Body of the chat request that opens a streamed exchange.
     */
    public static String toChatRequest(OutboundMessage.StartExchange start) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("message", start.text() == null ? "" : start.text());
        putIfPresent(node, "conversation_id", start.conversationId());
        putIfPresent(node, "model_id", start.modelId());
        putIfPresent(node, "definition_id", start.definitionId());
        return write(node);
    }

    /**
     * Body of the widget response POST.
     */
    public static String toRespondRequest(OutboundMessage.SubmitResponse response, Instant timestamp) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("tool_call_id", response.actionId());
        node.set("response", response.value());
        node.put("timestamp", timestamp.toString());
        return write(node);
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode outbound message", e);
        }
    }
}
