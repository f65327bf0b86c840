package com.agenthost.protocol.payload;

import com.agenthost.protocol.ProtocolFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Binds frame payloads to the typed views in this package.
 */
public final class Payloads {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Payloads() {
    }

    /**
     * @throws PayloadException if the payload cannot be bound to {@code type}
     */
    public static <T> T read(ProtocolFrame frame, Class<T> type) {
        try {
            return MAPPER.treeToValue(frame.payload(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PayloadException(frame.wireName(), "cannot bind " + type.getSimpleName(), e);
        }
    }
}
