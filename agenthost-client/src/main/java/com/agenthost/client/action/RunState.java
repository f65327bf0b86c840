package com.agenthost.client.action;

public enum RunState {
    RUNNING,
    SUSPENDED,
    TERMINATED
}
