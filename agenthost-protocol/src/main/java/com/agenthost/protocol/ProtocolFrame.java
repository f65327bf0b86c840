package com.agenthost.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * One decoded server event.
 *
 * @param type     event type
 * @param wireName name as it appeared on the wire, kept for logging
 * @param payload  JSON payload, an empty object when the frame carried none
 */
public record ProtocolFrame(EventType type, String wireName, JsonNode payload) {

    public ProtocolFrame {
        Objects.requireNonNull(type, "type");
        if (payload == null || payload.isMissingNode() || payload.isNull()) {
            payload = JsonNodeFactory.instance.objectNode();
        }
        if (wireName == null) {
            wireName = type.streamName() != null ? type.streamName() : type.socketName();
        }
    }

    public static ProtocolFrame of(EventType type, JsonNode payload) {
        return new ProtocolFrame(type, null, payload);
    }

    /**
     * Text field of the payload, or {@code null} when absent or not textual.
     */
    public String text(String field) {
        JsonNode node = payload.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    @Override
    public String toString() {
        return "ProtocolFrame{" + wireName + "}";
    }
}
