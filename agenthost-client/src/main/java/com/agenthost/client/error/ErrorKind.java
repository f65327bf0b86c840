package com.agenthost.client.error;

/**
 * Failure categories reported asynchronously to the session listener.
 */
public enum ErrorKind {
    /** Malformed frame; dropped. */
    DECODE,
    /** Connection lost and the reconnect budget is spent. */
    TRANSPORT,
    /** 401 or an in-band unauthorized/session_expired error. */
    AUTH,
    /** Rejected operation or inconsistent server event. */
    PROTOCOL_VIOLATION,
    /** Server asked the client to slow down. */
    RATE_LIMITED,
    /** In-band error event reported by the agent. */
    SERVER
}
