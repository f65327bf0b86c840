package com.agenthost.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Decoder for events read off the request stream by an SSE event source.
 * <p>
 * The event source has already split the body into events and joined their
 * {@code data:} lines; this step names the frame (an event without
 * {@code event:} is {@code message}) and parses the data as JSON.
 */
@Slf4j
public class SseFrameDecoder implements FrameDecoder {

    static final String DEFAULT_EVENT = "message";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private long dropped;

    @Override
    public Optional<ProtocolFrame> decode(String eventName, String data) {
        String name = eventName == null || eventName.isBlank() ? DEFAULT_EVENT : eventName.trim();
        Optional<EventType> type = EventType.fromStreamName(name);
        if (type.isEmpty()) {
            dropped++;
            log.warn("Dropping SSE frame with unknown event type: {}", name);
            return Optional.empty();
        }
        try {
            JsonNode payload = data == null || data.isBlank() ? null : MAPPER.readTree(data);
            return Optional.of(new ProtocolFrame(type.get(), name, payload));
        } catch (JsonProcessingException e) {
            dropped++;
            log.warn("Dropping malformed SSE frame '{}': {}", name, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public long droppedFrames() {
        return dropped;
    }
}
