package com.agenthost.client.connection;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    OPEN,
    CLOSING
}
