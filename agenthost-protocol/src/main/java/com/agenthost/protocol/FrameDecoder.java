package com.agenthost.protocol;

import java.util.Optional;

/**
 * Turns one raw transport event into a typed frame.
 * <p>
 * Implementations are single-reader and never throw on malformed input: the
 * offending frame is logged, counted and skipped.
 */
public interface FrameDecoder {

    /**
     * Decode one event as delivered by the transport.
     *
     * @param eventName name the transport carries next to the payload (the SSE
     *                  {@code event:} field), or null when the payload names itself
     * @param data      raw event text
     * @return the frame, or empty when it was dropped
     */
    Optional<ProtocolFrame> decode(String eventName, String data);

    /**
     * Frames skipped because they were malformed or named an unknown event.
     */
    long droppedFrames();
}
