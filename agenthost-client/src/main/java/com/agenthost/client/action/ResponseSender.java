package com.agenthost.client.action;

import com.agenthost.protocol.outbound.OutboundMessage;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface ResponseSender {

    CompletableFuture<Void> send(OutboundMessage.SubmitResponse response);
}
