package com.agenthost.client.session;

import java.util.concurrent.CompletableFuture;

/**
 * Ends an agent's session on the server when the user terminates it.
 */
@FunctionalInterface
public interface RemoteSessionEnder {

    RemoteSessionEnder NONE = (agentId, reason) -> CompletableFuture.completedFuture(null);

    CompletableFuture<Void> endSession(String agentId, String reason);
}
