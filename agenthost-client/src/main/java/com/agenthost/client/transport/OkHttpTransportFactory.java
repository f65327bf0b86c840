package com.agenthost.client.transport;

import com.agenthost.protocol.TransportKind;
import okhttp3.OkHttpClient;

import java.time.Clock;

/**
 * Creates OkHttp-backed transports sharing one client (and its connection
 * pool and dispatcher).
 */
public class OkHttpTransportFactory implements TransportFactory {

    private final OkHttpClient httpClient;
    private final Endpoints endpoints;
    private final String accessToken;
    private final Clock clock;

    public OkHttpTransportFactory(OkHttpClient httpClient, Endpoints endpoints, String accessToken) {
        this(httpClient, endpoints, accessToken, Clock.systemUTC());
    }

    public OkHttpTransportFactory(OkHttpClient httpClient, Endpoints endpoints, String accessToken, Clock clock) {
        this.httpClient = httpClient;
        this.endpoints = endpoints;
        this.accessToken = accessToken;
        this.clock = clock;
    }

    @Override
    public Transport create(TransportKind kind) {
        return switch (kind) {
            case REQUEST_STREAM -> new OkHttpStreamTransport(httpClient, endpoints, accessToken, clock);
            case DUPLEX_SOCKET -> new OkHttpSocketTransport(httpClient, accessToken);
        };
    }
}
