package com.agenthost.client.session;

import com.agenthost.client.connection.CloseOutcome;
import com.agenthost.protocol.ProtocolFrame;

/**
 * Something that happened to a background session, held for replay.
 * Exactly one of {@code frame} and {@code outcome} is set.
 *
 * @param sequence        per-session receipt order
 * @param frame           a received frame
 * @param outcome         a connection close
 * @param receivedAtNanos monotonic receipt time
 */
public record BufferedEvent(long sequence, ProtocolFrame frame, CloseOutcome outcome, long receivedAtNanos) {

    public static BufferedEvent frame(long sequence, ProtocolFrame frame) {
        return new BufferedEvent(sequence, frame, null, System.nanoTime());
    }

    public static BufferedEvent closed(long sequence, CloseOutcome outcome) {
        return new BufferedEvent(sequence, null, outcome, System.nanoTime());
    }

    public boolean isFrame() {
        return frame != null;
    }
}
