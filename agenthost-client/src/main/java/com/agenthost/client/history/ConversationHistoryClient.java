package com.agenthost.client.history;

import com.agenthost.client.error.TransportException;
import com.agenthost.client.message.MessageSnapshot;
import com.agenthost.client.message.MessageStatus;
import com.agenthost.client.message.ToolCallRecord;
import com.agenthost.client.message.ToolDataMerger;
import com.agenthost.client.message.ToolResultRecord;
import com.agenthost.client.transport.Endpoints;
import com.agenthost.protocol.payload.ToolCallPayload;
import com.agenthost.protocol.payload.ToolResultPayload;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Loads conversations over HTTP ({@code GET} on the conversation path).
 */
@Slf4j
public class ConversationHistoryClient implements ConversationStore {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final OkHttpClient httpClient;
    private final Endpoints endpoints;
    private final String accessToken;

    public ConversationHistoryClient(OkHttpClient httpClient, Endpoints endpoints, String accessToken) {
        this.httpClient = httpClient;
        this.endpoints = endpoints;
        this.accessToken = accessToken;
    }

    @Override
    public CompletableFuture<Conversation> getConversation(String conversationId) {
        Request.Builder builder = new Request.Builder().url(endpoints.conversation(conversationId)).get();
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }

        CompletableFuture<Conversation> future = new CompletableFuture<>();
        httpClient.newCall(builder.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(new TransportException(
                        "Loading conversation " + conversationId + " failed: " + e.getMessage(), 0, e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (ResponseBody body = response.body()) {
                    if (!response.isSuccessful() || body == null) {
                        future.completeExceptionally(new TransportException("Loading conversation "
                                + conversationId + " failed with HTTP " + response.code(), response.code(), null));
                        return;
                    }
                    StoredConversation stored = MAPPER.readValue(body.string(), StoredConversation.class);
                    future.complete(toConversation(stored, conversationId));
                } catch (Exception e) {
                    log.warn("Cannot read conversation {}: {}", conversationId, e.getMessage());
                    future.completeExceptionally(new TransportException(
                            "Cannot read conversation " + conversationId, response.code(), e));
                }
            }
        });
        return future;
    }

    static Conversation toConversation(StoredConversation stored, String requestedId) {
        List<MessageSnapshot> messages = new ArrayList<>();
        for (StoredMessage message : orEmpty(stored.getMessages())) {
            messages.add(toSnapshot(message));
        }
        String id = stored.getId() != null ? stored.getId() : requestedId;
        return new Conversation(id, stored.getTitle(), stored.getDefinitionId(), ToolDataMerger.merge(messages));
    }

    private static MessageSnapshot toSnapshot(StoredMessage message) {
        List<ToolCallRecord> calls = new ArrayList<>();
        for (ToolCallPayload call : orEmpty(message.getToolCalls())) {
            calls.add(new ToolCallRecord(call.getCallId(), call.getToolName(),
                    call.getStatus() != null ? call.getStatus() : ToolCallRecord.COMPLETED));
        }
        List<ToolResultRecord> results = new ArrayList<>();
        for (ToolResultPayload result : orEmpty(message.getToolResults())) {
            results.add(ToolResultRecord.fromPayload(result, result.getCallId()));
        }
        return new MessageSnapshot(message.getId(), message.getRole(), message.getContent(), calls, results,
                MessageStatus.COMPLETE);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    // ==================== wire shapes ====================

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoredConversation {
        private String id;
        private String title;
        @JsonProperty("definition_id")
        private String definitionId;
        private List<StoredMessage> messages = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoredMessage {
        private String id;
        private String role;
        private String content;
        @JsonProperty("tool_calls")
        private List<ToolCallPayload> toolCalls = new ArrayList<>();
        @JsonProperty("tool_results")
        private List<ToolResultPayload> toolResults = new ArrayList<>();
    }
}
