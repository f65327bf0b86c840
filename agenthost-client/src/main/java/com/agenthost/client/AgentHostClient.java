package com.agenthost.client;

import com.agenthost.client.connection.Connection;
import com.agenthost.client.error.AlreadyResolvedException;
import com.agenthost.client.error.FreeTextDeniedException;
import com.agenthost.client.error.HistoryDeniedException;
import com.agenthost.client.error.NoSuchSessionException;
import com.agenthost.client.error.SwitchDeniedException;
import com.agenthost.client.error.TerminationDeniedException;
import com.agenthost.client.history.Conversation;
import com.agenthost.client.history.ConversationHistoryClient;
import com.agenthost.client.session.AuthNotifier;
import com.agenthost.client.session.Session;
import com.agenthost.client.session.SessionKind;
import com.agenthost.client.session.SessionListener;
import com.agenthost.client.session.SessionMultiplexer;
import com.agenthost.client.transport.AgentSessionApi;
import com.agenthost.client.transport.ConnectionTarget;
import com.agenthost.client.transport.Endpoints;
import com.agenthost.client.transport.OkHttpTransportFactory;
import com.agenthost.common.config.AgentHostConfig;
import com.agenthost.common.config.ConfigService;
import com.agenthost.common.infra.Backoff;
import com.agenthost.common.infra.ExecutorTaskScheduler;
import com.agenthost.common.logging.LogLevel;
import com.agenthost.common.logging.LogRedact;
import com.agenthost.common.logging.SubsystemLogger;
import com.agenthost.protocol.TransportKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Entry point: wires configuration, OkHttp transports, the reconnect
 * scheduler and the dispatch thread around a {@link SessionMultiplexer}.
 */
@Slf4j
public class AgentHostClient implements AutoCloseable {

    private final AgentHostConfig config;
    private final OkHttpClient httpClient;
    private final Endpoints endpoints;
    private final ExecutorTaskScheduler scheduler;
    private final ExecutorService dispatcher;
    private final SessionMultiplexer multiplexer;
    private final ConversationHistoryClient history;
    private final TransportKind defaultTransport;

    public AgentHostClient(AgentHostConfig config, SessionListener listener, AuthNotifier authNotifier) {
        this.config = ConfigService.applyDefaults(config);
        SubsystemLogger.setMinLevel(LogLevel.normalize(this.config.getLogging().getLevel()));
        AgentHostConfig.ServerConfig server = this.config.getServer();
        AgentHostConfig.TransportConfig transport = this.config.getTransport();
        this.defaultTransport = TransportKind.fromConfig(transport.getKind());
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(transport.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(transport.getReadTimeoutMs()))
                .build();
        this.endpoints = new Endpoints(server);
        this.scheduler = new ExecutorTaskScheduler("agenthost-reconnect");
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agenthost-dispatch");
            t.setDaemon(true);
            return t;
        });

        OkHttpTransportFactory transports = new OkHttpTransportFactory(httpClient, endpoints, server.getAccessToken());
        Backoff.Policy reconnectPolicy = reconnectPolicy(this.config.getReconnect());
        long keepaliveMs = this.config.getKeepalive().getIntervalMs();
        AgentSessionApi agentSessions = new AgentSessionApi(httpClient, endpoints, server.getAccessToken());

        this.multiplexer = new SessionMultiplexer(
                (sessionId, connectionListener) -> new Connection(sessionId, transports, scheduler,
                        reconnectPolicy, keepaliveMs, connectionListener),
                listener, authNotifier, dispatcher, agentSessions::endSession);
        this.history = new ConversationHistoryClient(httpClient, endpoints, server.getAccessToken());
        log.info("Agent host client ready: {} ({})", LogRedact.redact(server.getBaseUrl()), defaultTransport);
    }

    public static AgentHostClient fromConfigFile(Path configPath, SessionListener listener,
            AuthNotifier authNotifier) {
        return new AgentHostClient(new ConfigService(configPath).loadConfig(), listener, authNotifier);
    }

    static Backoff.Policy reconnectPolicy(AgentHostConfig.ReconnectConfig reconnect) {
        return new Backoff.Policy(reconnect.getInitialDelayMs(),
                Math.max(reconnect.getInitialDelayMs(), reconnect.getMaxDelayMs()),
                reconnect.getFactor(), 0.0, reconnect.getMaxAttempts());
    }

    public SessionMultiplexer multiplexer() {
        return multiplexer;
    }

    public AgentHostConfig getConfig() {
        return config;
    }

    // ==================== sessions ====================

    /**
     * A user-driven chat session over the configured transport. A socket
     * session connects at once; a request-stream session connects with its
     * first exchange.
     */
    public Session startChatSession(String definitionId, JsonNode serverConfig) throws NoSuchSessionException {
        ConnectionTarget target = defaultTransport == TransportKind.DUPLEX_SOCKET
                ? ConnectionTarget.socket(endpoints.socket(definitionId, null))
                : ConnectionTarget.chatExchange(endpoints.chatSend(), null);
        Session session = multiplexer.createSession(null, SessionKind.REACTIVE, target, definitionId, serverConfig);
        if (target.kind() == TransportKind.DUPLEX_SOCKET) {
            multiplexer.connect(session.getId());
        }
        return session;
    }

    /**
     * A templated session over a socket. The agent speaks first once
     * {@link #startExchange} is called with no text.
     */
    public Session startTemplatedSession(String definitionId, String conversationId, JsonNode serverConfig)
            throws NoSuchSessionException {
        ConnectionTarget target = ConnectionTarget.socket(endpoints.socket(definitionId, conversationId));
        Session session = multiplexer.createSession(null, SessionKind.PROACTIVE, target, definitionId, serverConfig);
        multiplexer.connect(session.getId());
        return session;
    }

    /**
     * Attach to the event stream of a server-side agent.
     */
    public Session startAgentSession(String agentId, SessionKind kind, JsonNode serverConfig)
            throws NoSuchSessionException {
        ConnectionTarget target = ConnectionTarget.agentStream(endpoints.agentStream(agentId), agentId);
        Session session = multiplexer.createSession("agent-" + agentId, kind, target, null, serverConfig);
        multiplexer.connect(session.getId());
        return session;
    }

    public CompletableFuture<Void> startExchange(String sessionId, String text, String modelId)
            throws FreeTextDeniedException, NoSuchSessionException {
        return multiplexer.startExchange(sessionId, text, modelId);
    }

    public CompletableFuture<Void> submitResponse(String sessionId, String actionId, JsonNode value)
            throws AlreadyResolvedException, NoSuchSessionException {
        return multiplexer.submitResponse(sessionId, actionId, value);
    }

    public CompletableFuture<Void> cancelActive() {
        return multiplexer.cancelActive();
    }

    public void switchTo(String sessionId) throws SwitchDeniedException, NoSuchSessionException {
        multiplexer.switchTo(sessionId);
    }

    public void deactivate() {
        multiplexer.deactivate();
    }

    public void terminateSession(String sessionId, String reason)
            throws TerminationDeniedException, NoSuchSessionException {
        multiplexer.terminateSession(sessionId, reason);
    }

    public void logout() {
        multiplexer.logout();
    }

    // ==================== history ====================

    /**
     * @throws HistoryDeniedException if the session in front forbids browsing
     *                                history
     */
    public CompletableFuture<Conversation> getConversation(String conversationId) throws HistoryDeniedException {
        if (!multiplexer.canAccessHistory()) {
            throw new HistoryDeniedException(multiplexer.activeSessionId().orElse(null),
                    "History is not available in this session");
        }
        return history.getConversation(conversationId);
    }

    @Override
    public void close() {
        multiplexer.logout();
        scheduler.close();
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            dispatcher.shutdownNow();
        }
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        log.info("Agent host client closed");
    }
}
