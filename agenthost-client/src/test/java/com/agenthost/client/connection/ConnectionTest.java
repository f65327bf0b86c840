package com.agenthost.client.connection;

import com.agenthost.client.error.ConnectionBusyException;
import com.agenthost.client.error.TransportException;
import com.agenthost.client.support.FakeTransport;
import com.agenthost.client.support.FakeTransportFactory;
import com.agenthost.client.support.Frames;
import com.agenthost.client.support.ManualScheduler;
import com.agenthost.client.transport.CloseCodes;
import com.agenthost.client.transport.ConnectionTarget;
import com.agenthost.common.infra.Backoff;
import com.agenthost.protocol.EventType;
import com.agenthost.protocol.ProtocolFrame;
import com.agenthost.protocol.outbound.OutboundMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionTest {

    private static final ConnectionTarget STREAM =
            ConnectionTarget.agentStream("http://localhost/agents/a1/stream", "a1");
    private static final ConnectionTarget SOCKET = ConnectionTarget.socket("http://localhost/chat/ws");

    private FakeTransportFactory transports;
    private ManualScheduler scheduler;
    private Recorder recorder;
    private Connection connection;

    @BeforeEach
    void setUp() {
        transports = new FakeTransportFactory();
        scheduler = new ManualScheduler();
        recorder = new Recorder();
        connection = new Connection("s1", transports, scheduler, Backoff.Policy.RECONNECT, 30_000, recorder);
    }

    @Test
    void connect_opensTransportAndReportsOpen() {
        connection.connect(STREAM);
        assertEquals(ConnectionState.CONNECTING, connection.getState());
        assertEquals(STREAM, transports.last().target());

        transports.last().fireOpen();

        assertEquals(ConnectionState.OPEN, connection.getState());
        assertEquals(1, recorder.opens);
    }

    @Test
    void connect_sameTargetWhileOpen_isNoop() {
        connection.connect(STREAM);
        transports.last().fireOpen();

        connection.connect(STREAM);

        assertEquals(1, transports.created().size());
    }

    @Test
    void connect_otherTargetWhileOpen_failsFast() {
        connection.connect(STREAM);

        assertThrows(ConnectionBusyException.class, () -> connection.connect(SOCKET));
        assertEquals(STREAM, connection.getTarget());
    }

    @Test
    void connect_openThrows_leavesDisconnected() {
        transports.failNextOpens(1);

        assertThrows(TransportException.class, () -> connection.connect(STREAM));
        assertEquals(ConnectionState.DISCONNECTED, connection.getState());
        assertTrue(scheduler.delays().isEmpty());
    }

    @Test
    void frames_areForwardedInOrder() {
        connection.connect(STREAM);
        FakeTransport transport = transports.last();
        transport.fireOpen();
        transport.fireFrame(Frames.chunk("a"));
        transport.fireFrame(Frames.chunk("b"));

        assertEquals(List.of("a", "b"), recorder.frames.stream().map(f -> f.text("content")).toList());
    }

    // ==================== reconnect ====================

    @Nested
    class Reconnect {

        @Test
        void dirtyCloses_backOffExponentiallyThenGiveUp() {
            connection.connect(STREAM);
            transports.last().fireOpen();

            for (int i = 0; i < 5; i++) {
                transports.last().fireDrop();
                assertEquals(CloseOutcome.RECONNECTING, recorder.lastOutcome());
                assertEquals(1, scheduler.runPending());
            }
            transports.last().fireDrop();

            assertEquals(List.of(1000L, 2000L, 4000L, 8000L, 16000L), scheduler.delays());
            assertEquals(CloseOutcome.GAVE_UP, recorder.lastOutcome());
            assertTrue(connection.hasGivenUp());
            assertEquals(ConnectionState.DISCONNECTED, connection.getState());
            assertEquals(0, scheduler.pendingCount());
            assertEquals(6, transports.created().size());
        }

        @Test
        void successfulOpen_resetsAttemptCounter() {
            connection.connect(STREAM);
            transports.last().fireOpen();

            transports.last().fireDrop();
            assertEquals(1, connection.getReconnectAttempt());
            scheduler.runPending();
            transports.last().fireDrop();
            assertEquals(2, connection.getReconnectAttempt());
            scheduler.runPending();
            transports.last().fireOpen();

            assertEquals(0, connection.getReconnectAttempt());
            assertEquals(ConnectionState.OPEN, connection.getState());

            transports.last().fireDrop();
            assertEquals(List.of(1000L, 2000L, 1000L), scheduler.delays());
        }

        @Test
        void reconnect_reusesTarget() {
            connection.connect(STREAM.withBody("{\"message\":\"hi\"}"));
            transports.last().fireDrop();
            scheduler.runPending();

            assertEquals(transports.created().get(0).target(), transports.last().target());
        }

        @Test
        void reconnectOpenThrowing_countsAsDrop() {
            connection.connect(STREAM);
            transports.last().fireDrop();
            transports.failNextOpens(1);

            scheduler.runPending();

            assertEquals(List.of(1000L, 2000L), scheduler.delays());
            assertEquals(2, connection.getReconnectAttempt());
        }

        @Test
        void close_cancelsPendingReconnect() {
            connection.connect(STREAM);
            transports.last().fireDrop();
            assertTrue(connection.isReconnecting());

            connection.close();

            assertEquals(0, scheduler.pendingCount());
            assertEquals(0, scheduler.runPending());
            assertEquals(1, transports.created().size());
        }

        @Test
        void unauthorized_isNotRetried() {
            connection.connect(STREAM);
            transports.last().fireHttpFailure(401);

            assertEquals(CloseOutcome.AUTH_FAILED, recorder.lastOutcome());
            assertTrue(scheduler.delays().isEmpty());
        }

        @Test
        void rateLimited_isNotRetried() {
            connection.connect(STREAM);
            transports.last().fireHttpFailure(429);

            assertEquals(CloseOutcome.RATE_LIMITED, recorder.lastOutcome());
            assertTrue(scheduler.delays().isEmpty());
        }
    }

    // ==================== close classification ====================

    @Nested
    class CleanClose {

        @Test
        void terminalFrameBeforeDrop_isClean() {
            connection.connect(STREAM);
            FakeTransport transport = transports.last();
            transport.fireOpen();
            transport.fireFrame(Frames.frame(EventType.STREAM_COMPLETE));
            transport.fireClosed(CloseCodes.ABNORMAL);

            assertEquals(CloseOutcome.CLEAN, recorder.lastOutcome());
            assertTrue(scheduler.delays().isEmpty());
        }

        @Test
        void nonTerminalFrameBeforeDrop_isDirty() {
            connection.connect(STREAM);
            FakeTransport transport = transports.last();
            transport.fireOpen();
            transport.fireFrame(Frames.frame(EventType.STREAM_COMPLETE));
            transport.fireFrame(Frames.chunk("more"));
            transport.fireDrop();

            assertEquals(CloseOutcome.RECONNECTING, recorder.lastOutcome());
        }

        @Test
        void normalCloseCode_isClean() {
            connection.connect(SOCKET);
            transports.last().fireOpen();
            transports.last().fireClosed(CloseCodes.NORMAL);

            assertEquals(CloseOutcome.CLEAN, recorder.lastOutcome());
        }

        @Test
        void clientClose_isClean() {
            connection.connect(SOCKET);
            FakeTransport transport = transports.last();
            transport.fireOpen();

            connection.close();
            assertEquals(ConnectionState.CLOSING, connection.getState());
            assertEquals(CloseCodes.NORMAL, transport.closeCode());

            transport.fireDrop();
            assertEquals(CloseOutcome.CLEAN, recorder.lastOutcome());
            assertEquals(ConnectionState.DISCONNECTED, connection.getState());
        }

        @Test
        void framesAfterClientClose_dropped() {
            connection.connect(STREAM);
            FakeTransport transport = transports.last();
            transport.fireOpen();
            transport.fireFrame(Frames.chunk("kept"));

            connection.close();
            transport.fireFrame(Frames.chunk("late"));
            transport.fireClosed(CloseCodes.NORMAL);

            assertEquals(1, recorder.frames.size());
            assertEquals("kept", recorder.frames.get(0).text("content"));
            assertEquals(CloseOutcome.CLEAN, recorder.lastOutcome());
        }

        @Test
        void cancelExchange_onStream_postsCancelAndClosesCleanly() {
            connection.connect(STREAM);
            FakeTransport transport = transports.last();
            transport.fireOpen();

            connection.cancelExchange("req-1");
            transport.fireClosed(CloseCodes.NORMAL);

            assertEquals(List.of(new OutboundMessage.CancelExchange("req-1")), transport.sent());
            assertEquals(CloseOutcome.CLEAN, recorder.lastOutcome());
            assertTrue(scheduler.delays().isEmpty());
        }
    }

    // ==================== keepalive ====================

    @Test
    void keepalive_pingsOpenSocket() {
        connection.connect(SOCKET);
        FakeTransport transport = transports.last();
        transport.fireOpen();

        assertEquals(List.of(30_000L), scheduler.livePeriods());
        scheduler.tickPeriodic();
        assertEquals(List.of(new OutboundMessage.Ping()), transport.sent());
    }

    @Test
    void keepalive_stopsWhenSocketDrops() {
        connection.connect(SOCKET);
        transports.last().fireOpen();
        assertTrue(connection.isKeepaliveRunning());

        transports.last().fireDrop();

        assertFalse(connection.isKeepaliveRunning());
        assertTrue(scheduler.livePeriods().isEmpty());
    }

    @Test
    void keepalive_notUsedForRequestStreams() {
        connection.connect(STREAM);
        transports.last().fireOpen();

        assertTrue(scheduler.livePeriods().isEmpty());
    }

    // ==================== superseded transports ====================

    @Test
    void restart_ignoresCallbacksOfOldTransport() {
        connection.connect(STREAM);
        FakeTransport old = transports.last();
        old.fireOpen();

        connection.restart(STREAM.withBody("{}"));
        old.fireFrame(Frames.chunk("late"));
        old.fireClosed(CloseCodes.NORMAL);

        assertTrue(old.isClosed());
        assertTrue(recorder.frames.isEmpty());
        assertTrue(recorder.outcomes.isEmpty());
        assertEquals(ConnectionState.CONNECTING, connection.getState());
    }

    @Test
    void send_afterStreamEnded_usesLastRequestStream() {
        connection.connect(STREAM);
        FakeTransport transport = transports.last();
        transport.fireOpen();
        transport.fireFrame(Frames.frame(EventType.STREAM_COMPLETE));
        transport.fireClosed(CloseCodes.ABNORMAL);

        connection.send(new OutboundMessage.SubmitResponse("x1", "free_text", Frames.json("\"ok\""))).join();

        assertEquals(1, transport.sent().size());
    }

    @Test
    void send_socketNotConnected_fails() {
        connection.connect(SOCKET);
        transports.last().fireOpen();
        transports.last().fireClosed(CloseCodes.NORMAL);

        assertTrue(connection.send(new OutboundMessage.Ping()).isCompletedExceptionally());
    }

    private static final class Recorder implements ConnectionListener {
        int opens;
        final List<ProtocolFrame> frames = new ArrayList<>();
        final List<CloseOutcome> outcomes = new ArrayList<>();

        @Override
        public void onOpen(Connection connection) {
            opens++;
        }

        @Override
        public void onFrame(Connection connection, ProtocolFrame frame) {
            frames.add(frame);
        }

        @Override
        public void onClosed(Connection connection, CloseOutcome outcome) {
            outcomes.add(outcome);
        }

        CloseOutcome lastOutcome() {
            return outcomes.isEmpty() ? null : outcomes.get(outcomes.size() - 1);
        }
    }
}
