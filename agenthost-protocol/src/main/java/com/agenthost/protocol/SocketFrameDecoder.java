package com.agenthost.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Decoder for the duplex socket: every text message is one
 * {@code {"type": ..., "data": {...}}} object. Frames without a {@code data}
 * member (the socket {@code error} frame carries {@code message} at the top
 * level) use the whole object as payload.
 */
@Slf4j
public class SocketFrameDecoder implements FrameDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private long dropped;

    /**
     * Decode one text message. The event name lives inside the message, so
     * {@code eventName} is not consulted.
     */
    @Override
    public Optional<ProtocolFrame> decode(String eventName, String text) {
        return decode(text);
    }

    public Optional<ProtocolFrame> decode(String text) {
        if (text == null || text.isBlank()) {
            return drop("empty message", null);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            return drop("malformed JSON", e.getOriginalMessage());
        }
        if (root == null || !root.isObject() || !root.path("type").isTextual()) {
            return drop("missing type", null);
        }
        String name = root.get("type").asText();
        Optional<EventType> type = EventType.fromSocketName(name);
        if (type.isEmpty()) {
            return drop("unknown event type", name);
        }
        JsonNode payload = root.has("data") ? root.get("data") : root;
        return Optional.of(new ProtocolFrame(type.get(), name, payload));
    }

    @Override
    public long droppedFrames() {
        return dropped;
    }

    private Optional<ProtocolFrame> drop(String reason, String detail) {
        dropped++;
        log.warn("Dropping socket frame ({}): {}", reason, detail);
        return Optional.empty();
    }
}
