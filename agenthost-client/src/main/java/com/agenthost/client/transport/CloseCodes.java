package com.agenthost.client.transport;

/**
 * WebSocket close codes, reused for request streams.
 */
public final class CloseCodes {

    /** Normal closure; never retried. */
    public static final int NORMAL = 1000;

    /** Connection ended without a close handshake (request stream body ended). */
    public static final int ABNORMAL = 1006;

    private CloseCodes() {
    }

    public static boolean isNormal(int code) {
        return code == NORMAL;
    }
}
