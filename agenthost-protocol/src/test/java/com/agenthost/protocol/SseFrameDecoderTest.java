package com.agenthost.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SseFrameDecoderTest {

    private final SseFrameDecoder decoder = new SseFrameDecoder();

    @Test
    void namedEvent_decodedWithPayload() {
        ProtocolFrame frame = decoder.decode("stream_started", "{\"request_id\":\"r1\",\"conversation_id\":\"c1\"}")
                .orElseThrow();

        assertEquals(EventType.STREAM_STARTED, frame.type());
        assertEquals("stream_started", frame.wireName());
        assertEquals("r1", frame.text("request_id"));
        assertEquals("c1", frame.text("conversation_id"));
    }

    @Test
    void multiLineData_parsedAsOneDocument() {
        ProtocolFrame frame = decoder.decode("message_complete", "{\"content\":\n\"done\"}").orElseThrow();
        assertEquals("done", frame.text("content"));
    }

    @Test
    void malformedJson_droppedAndDecodingContinues() {
        assertTrue(decoder.decode("content_chunk", "{not json").isEmpty());

        ProtocolFrame next = decoder.decode("stream_complete", "{}").orElseThrow();
        assertEquals(EventType.STREAM_COMPLETE, next.type());
        assertEquals(1, decoder.droppedFrames());
    }

    @Test
    void missingEventName_defaultsToMessageWhichIsNotAKnownEvent() {
        assertTrue(decoder.decode(null, "{\"content\":\"x\"}").isEmpty());
        assertTrue(decoder.decode("", "{\"content\":\"x\"}").isEmpty());
        assertEquals(2, decoder.droppedFrames());
    }

    @Test
    void unknownEvent_dropped() {
        assertTrue(decoder.decode("telemetry", "{}").isEmpty());
        assertEquals(1, decoder.droppedFrames());
    }

    @Test
    void socketSpelling_notAcceptedOnTheStream() {
        assertTrue(decoder.decode("content", "{\"content\":\"x\"}").isEmpty());
    }

    @Test
    void heartbeat_decoded() {
        assertEquals(EventType.HEARTBEAT, decoder.decode("heartbeat", "{}").orElseThrow().type());
        assertEquals(0, decoder.droppedFrames());
    }

    @Test
    void emptyData_yieldsEmptyObjectPayload() {
        ProtocolFrame frame = decoder.decode("cancelled", "").orElseThrow();
        assertTrue(frame.payload().isObject());
        assertEquals(0, frame.payload().size());
    }
}
