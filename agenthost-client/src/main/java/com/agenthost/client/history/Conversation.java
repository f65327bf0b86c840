package com.agenthost.client.history;

import com.agenthost.client.message.MessageSnapshot;

import java.util.List;

/**
 * A stored conversation, with tool data already merged into the messages
 * that carry text.
 */
public record Conversation(String id, String title, String definitionId, List<MessageSnapshot> messages) {

    public Conversation {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
