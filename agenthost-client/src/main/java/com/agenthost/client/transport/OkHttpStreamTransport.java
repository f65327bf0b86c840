package com.agenthost.client.transport;

import com.agenthost.client.error.TransportException;
import com.agenthost.common.logging.LogRedact;
import com.agenthost.protocol.FrameDecoder;
import com.agenthost.protocol.ProtocolFrame;
import com.agenthost.protocol.TransportKind;
import com.agenthost.protocol.outbound.OutboundEncoder;
import com.agenthost.protocol.outbound.OutboundMessage;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Request-stream transport: one HTTP call whose response body is a stream of
 * server-sent events, read through an OkHttp {@link EventSource}. Outbound
 * messages travel as separate HTTP calls.
 * <p>
 * Events arrive on the OkHttp callback thread. The end of the body is
 * reported as {@link CloseCodes#ABNORMAL}; a close requested through
 * {@link #close} as {@link CloseCodes#NORMAL}.
 */
@Slf4j
public class OkHttpStreamTransport implements Transport {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final Endpoints endpoints;
    private final String accessToken;
    private final Clock clock;
    private final FrameDecoder decoder = TransportKind.REQUEST_STREAM.newDecoder();

    private volatile EventSource eventSource;
    private volatile ConnectionTarget target;
    private volatile boolean closeRequested;
    private volatile String lastRequestId;

    public OkHttpStreamTransport(OkHttpClient httpClient, Endpoints endpoints, String accessToken, Clock clock) {
        this.httpClient = httpClient;
        this.endpoints = endpoints;
        this.accessToken = accessToken;
        this.clock = clock;
    }

    @Override
    public TransportKind kind() {
        return TransportKind.REQUEST_STREAM;
    }

    @Override
    public synchronized void open(ConnectionTarget target, TransportListener listener) {
        if (eventSource != null) {
            throw new IllegalStateException("Transport already opened");
        }
        this.target = target;
        Request request;
        try {
            Request.Builder builder = authorized(new Request.Builder().url(target.url()))
                    .header("Accept", "text/event-stream");
            if (target.body() != null) {
                builder.post(RequestBody.create(target.body(), JSON));
            } else {
                builder.method(target.method(), "GET".equals(target.method()) ? null
                        : RequestBody.create("", JSON));
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid stream target: " + LogRedact.redact(target.url()), 0, e);
        }

        log.debug("Opening stream {} {}", target.method(), LogRedact.redact(target.url()));
        EventSource.Factory factory = EventSources.createFactory(httpClient);
        eventSource = factory.newEventSource(request, new EventSourceListener() {
            @Override
            public void onOpen(EventSource source, Response response) {
                listener.onOpen();
            }

            @Override
            public void onEvent(EventSource source, String id, String type, String data) {
                if (closeRequested) {
                    return;
                }
                decoder.decode(type, data).ifPresent(frame -> deliver(frame, listener));
            }

            @Override
            public void onClosed(EventSource source) {
                if (closeRequested) {
                    listener.onClosed(CloseCodes.NORMAL, "closed by client");
                } else {
                    listener.onClosed(CloseCodes.ABNORMAL, "stream ended");
                }
            }

            @Override
            public void onFailure(EventSource source, Throwable t, Response response) {
                if (closeRequested) {
                    listener.onClosed(CloseCodes.NORMAL, "cancelled");
                    return;
                }
                int status = response != null && !response.isSuccessful() ? response.code() : 0;
                Throwable error = t;
                if (error == null) {
                    error = new TransportException("Stream request failed with HTTP " + status, status, null);
                }
                listener.onFailure(error, status);
            }
        });
    }

    private void deliver(ProtocolFrame frame, TransportListener listener) {
        String requestId = frame.text("request_id");
        if (requestId != null) {
            lastRequestId = requestId;
        }
        listener.onFrame(frame);
    }

    @Override
    public CompletableFuture<Void> send(OutboundMessage message) {
        if (message instanceof OutboundMessage.SubmitResponse response) {
            ConnectionTarget current = target;
            if (current == null || current.agentId() == null) {
                return CompletableFuture.failedFuture(
                        new TransportException("Widget responses need an agent session stream"));
            }
            return post(endpoints.respond(current.agentId()),
                    OutboundEncoder.toRespondRequest(response, clock.instant()));
        }
        if (message instanceof OutboundMessage.CancelExchange cancel) {
            String requestId = cancel.requestId() != null ? cancel.requestId() : lastRequestId;
            if (requestId == null) {
                log.debug("No request id seen yet, cancel is local only");
                return CompletableFuture.completedFuture(null);
            }
            return post(endpoints.cancel(requestId), "{}");
        }
        // pings have no meaning here and exchanges start by reopening the stream
        log.debug("Request stream ignores outbound {}", message.getClass().getSimpleName());
        return CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<Void> post(String url, String json) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        Request request = authorized(new Request.Builder().url(url))
                .post(RequestBody.create(json, JSON))
                .build();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call c, IOException e) {
                future.completeExceptionally(new TransportException("POST failed: " + e.getMessage(), 0, e));
            }

            @Override
            public void onResponse(Call c, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        future.complete(null);
                    } else {
                        future.completeExceptionally(new TransportException(
                                "POST " + LogRedact.redact(url) + " failed with HTTP " + response.code(),
                                response.code(), null));
                    }
                }
            }
        });
        return future;
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (accessToken != null && !accessToken.isBlank()) {
            builder.header("Authorization", "Bearer " + accessToken);
        }
        return builder;
    }

    @Override
    public void close(int code, String reason) {
        closeRequested = true;
        EventSource current = eventSource;
        if (current != null) {
            current.cancel();
        }
    }
}
