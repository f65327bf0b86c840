package com.agenthost.client.transport;

import com.agenthost.client.error.TransportException;
import com.agenthost.common.logging.LogRedact;
import com.agenthost.protocol.SocketFrameDecoder;
import com.agenthost.protocol.TransportKind;
import com.agenthost.protocol.outbound.OutboundEncoder;
import com.agenthost.protocol.outbound.OutboundMessage;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.util.concurrent.CompletableFuture;

/**
 * Duplex transport over an OkHttp {@link WebSocket}. Every text message is one
 * frame; outbound messages are JSON text messages on the same socket.
 */
@Slf4j
public class OkHttpSocketTransport implements Transport {

    private final OkHttpClient httpClient;
    private final String accessToken;
    private final SocketFrameDecoder decoder = new SocketFrameDecoder();

    private volatile WebSocket webSocket;
    private volatile boolean open;

    public OkHttpSocketTransport(OkHttpClient httpClient, String accessToken) {
        this.httpClient = httpClient;
        this.accessToken = accessToken;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.DUPLEX_SOCKET;
    }

    @Override
    public void open(ConnectionTarget target, TransportListener listener) {
        if (webSocket != null) {
            throw new IllegalStateException("Transport already opened");
        }
        Request request;
        try {
            Request.Builder builder = new Request.Builder().url(target.url());
            if (accessToken != null && !accessToken.isBlank()) {
                builder.header("Authorization", "Bearer " + accessToken);
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid socket target: " + LogRedact.redact(target.url()), 0, e);
        }

        log.debug("Opening socket {}", LogRedact.redact(target.url()));
        webSocket = httpClient.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket ws, Response response) {
                open = true;
                listener.onOpen();
            }

            @Override
            public void onMessage(WebSocket ws, String text) {
                decoder.decode(text).ifPresent(listener::onFrame);
            }

            @Override
            public void onClosing(WebSocket ws, int code, String reason) {
                ws.close(CloseCodes.NORMAL, null);
            }

            @Override
            public void onClosed(WebSocket ws, int code, String reason) {
                open = false;
                listener.onClosed(code, reason);
            }

            @Override
            public void onFailure(WebSocket ws, Throwable t, Response response) {
                open = false;
                int status = response != null ? response.code() : 0;
                if (response != null) {
                    response.close();
                }
                listener.onFailure(t, status);
            }
        });
    }

    @Override
    public CompletableFuture<Void> send(OutboundMessage message) {
        WebSocket ws = webSocket;
        if (ws == null || !open) {
            return CompletableFuture.failedFuture(new TransportException("Socket is not open"));
        }
        if (!ws.send(OutboundEncoder.toSocketText(message))) {
            return CompletableFuture.failedFuture(new TransportException("Socket rejected message (closing or full)"));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close(int code, String reason) {
        WebSocket ws = webSocket;
        if (ws != null) {
            ws.close(code, reason);
        }
    }
}
