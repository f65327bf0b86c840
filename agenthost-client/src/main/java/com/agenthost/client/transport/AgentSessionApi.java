package com.agenthost.client.transport;

import com.agenthost.client.error.TransportException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response calls on server-side agent sessions.
 */
@Slf4j
public class AgentSessionApi {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final Endpoints endpoints;
    private final String accessToken;

    public AgentSessionApi(OkHttpClient httpClient, Endpoints endpoints, String accessToken) {
        this.httpClient = httpClient;
        this.endpoints = endpoints;
        this.accessToken = accessToken;
    }

    /**
     * End the agent's current server session ({@code DELETE} with a
     * {@code reason} body).
     */
    public CompletableFuture<Void> endSession(String agentId, String reason) {
        ObjectNode body = MAPPER.createObjectNode().put("reason", reason);
        Request.Builder builder = new Request.Builder()
                .url(endpoints.agentSession(agentId))
                .delete(RequestBody.create(body.toString(), JSON));
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        httpClient.newCall(builder.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                future.completeExceptionally(new TransportException("End session failed: " + e.getMessage(), 0, e));
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    // 404: the server already dropped it
                    if (response.isSuccessful() || response.code() == 404) {
                        future.complete(null);
                    } else {
                        future.completeExceptionally(new TransportException(
                                "End session failed with HTTP " + response.code(), response.code(), null));
                    }
                }
            }
        });
        return future;
    }
}
