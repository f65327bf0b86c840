package com.agenthost.client.transport;

import com.agenthost.protocol.TransportKind;

import java.util.Objects;

/**
 * Where and how a connection is opened. Two targets are the same target iff
 * they are equal.
 *
 * @param kind    transport to use
 * @param url     stream or socket URL
 * @param method  HTTP method for request streams, {@code GET} for sockets
 * @param body    JSON request body for a POSTed stream, else {@code null}
 * @param agentId server-side agent the session belongs to, if any
 */
public record ConnectionTarget(TransportKind kind, String url, String method, String body, String agentId) {

    public ConnectionTarget {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(url, "url");
        method = method == null ? "GET" : method;
    }

    public static ConnectionTarget socket(String url) {
        return new ConnectionTarget(TransportKind.DUPLEX_SOCKET, url, "GET", null, null);
    }

    /**
     * Long-lived event stream of a server-side agent session.
     */
    public static ConnectionTarget agentStream(String url, String agentId) {
        return new ConnectionTarget(TransportKind.REQUEST_STREAM, url, "GET", null, agentId);
    }

    /**
     * Chat endpoint that streams the reply to a POSTed message. The body is
     * filled in per exchange.
     */
    public static ConnectionTarget chatExchange(String url, String agentId) {
        return new ConnectionTarget(TransportKind.REQUEST_STREAM, url, "POST", null, agentId);
    }

    public ConnectionTarget withBody(String newBody) {
        return new ConnectionTarget(kind, url, "POST", newBody, agentId);
    }
}
