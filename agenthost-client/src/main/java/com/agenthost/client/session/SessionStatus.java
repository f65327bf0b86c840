package com.agenthost.client.session;

public enum SessionStatus {
    IDLE,
    CONNECTING,
    ACTIVE_STREAMING,
    SUSPENDED,
    BACKGROUND,
    TERMINATED,
    ERROR
}
