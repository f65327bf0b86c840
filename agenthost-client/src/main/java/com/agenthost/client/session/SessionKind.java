package com.agenthost.client.session;

/**
 * Who drives the conversation.
 */
public enum SessionKind {
    /** User-initiated chat: the agent answers. */
    REACTIVE,
    /** Agent-initiated or templated run: the agent leads and asks through widgets. */
    PROACTIVE
}
