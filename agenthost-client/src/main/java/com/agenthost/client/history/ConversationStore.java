package com.agenthost.client.history;

import java.util.concurrent.CompletableFuture;

/**
 * Source of conversation history. History is owned by the server; nothing is
 * cached on this side.
 */
public interface ConversationStore {

    CompletableFuture<Conversation> getConversation(String conversationId);
}
