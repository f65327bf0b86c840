package com.agenthost.client.connection;

/**
 * How a connection ended, as reported to its owner.
 */
public enum CloseOutcome {
    /** Requested by the client or preceded by a terminal event. */
    CLEAN,
    /** Dropped; a reconnect is scheduled. */
    RECONNECTING,
    /** Dropped and the reconnect budget is spent. */
    GAVE_UP,
    /** Rejected with 401/403; not retried. */
    AUTH_FAILED,
    /** Rejected with 429; not retried. */
    RATE_LIMITED
}
