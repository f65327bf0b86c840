package com.agenthost.client.message;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the empty-message tool-data rule to a stored conversation: assistant
 * messages with no text but with tool data are folded into the next assistant
 * message that has text.
 */
public final class ToolDataMerger {

    private ToolDataMerger() {
    }

    /**
     * User and system messages pass through untouched and do not flush carried
     * tool data. Data still carried at the end becomes a synthetic trailing
     * assistant message.
     */
    public static List<MessageSnapshot> merge(List<MessageSnapshot> messages) {
        List<MessageSnapshot> merged = new ArrayList<>(messages.size());
        List<ToolCallRecord> pendingCalls = new ArrayList<>();
        List<ToolResultRecord> pendingResults = new ArrayList<>();
        String lastAbsorbedId = null;

        for (MessageSnapshot message : messages) {
            if (!message.isAssistant()) {
                merged.add(message);
                continue;
            }
            if (!message.hasContent()) {
                if (message.hasToolData()) {
                    pendingCalls.addAll(message.toolCalls());
                    pendingResults.addAll(message.toolResults());
                    lastAbsorbedId = message.id();
                }
                continue;
            }
            if (pendingCalls.isEmpty() && pendingResults.isEmpty()) {
                merged.add(message);
                continue;
            }
            List<ToolCallRecord> calls = new ArrayList<>(pendingCalls);
            calls.addAll(message.toolCalls());
            List<ToolResultRecord> results = new ArrayList<>(pendingResults);
            results.addAll(message.toolResults());
            merged.add(new MessageSnapshot(message.id(), message.role(), message.content(), calls, results,
                    message.status()));
            pendingCalls.clear();
            pendingResults.clear();
        }

        if (!pendingCalls.isEmpty() || !pendingResults.isEmpty()) {
            merged.add(new MessageSnapshot(lastAbsorbedId, MessageSnapshot.ROLE_ASSISTANT, "", pendingCalls,
                    pendingResults, MessageStatus.COMPLETE));
        }
        return merged;
    }
}
