package com.agenthost.client.session;

/**
 * Told when the server rejects the client's credentials. Refreshing or
 * re-login is up to the implementation.
 */
@FunctionalInterface
public interface AuthNotifier {

    AuthNotifier NONE = () -> {
    };

    void notifyTokenExpired();
}
