package com.agenthost.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventTypeTest {

    @Test
    void terminalEvents() {
        assertTrue(EventType.STREAM_COMPLETE.isTerminal());
        assertTrue(EventType.SESSION_COMPLETED.isTerminal());
        assertTrue(EventType.CANCELLED.isTerminal());
        assertFalse(EventType.MESSAGE_COMPLETE.isTerminal());
        assertFalse(EventType.ERROR.isTerminal());
    }

    @Test
    void namesAreTransportSpecific() {
        assertEquals(EventType.CONTENT_CHUNK, EventType.fromStreamName("content_chunk").orElseThrow());
        assertTrue(EventType.fromStreamName("content").isEmpty());
        assertTrue(EventType.fromSocketName("content_chunk").isEmpty());
        assertTrue(EventType.fromStreamName("pong").isEmpty());
        assertTrue(EventType.fromSocketName(null).isEmpty());
    }

    @Test
    void everyConstantReachableFromSomeTransport() {
        for (EventType type : EventType.values()) {
            assertTrue(type.streamName() != null || type.socketName() != null, type.name());
        }
    }

    @Test
    void transportKind_fromConfig() {
        assertEquals(TransportKind.REQUEST_STREAM, TransportKind.fromConfig(null));
        assertEquals(TransportKind.REQUEST_STREAM, TransportKind.fromConfig("sse"));
        assertEquals(TransportKind.DUPLEX_SOCKET, TransportKind.fromConfig("WebSocket"));
        assertInstanceOf(SocketFrameDecoder.class, TransportKind.DUPLEX_SOCKET.newDecoder());
        assertThrows(IllegalArgumentException.class, () -> TransportKind.fromConfig("carrier-pigeon"));
    }
}
