package com.agenthost.client.transport;

import com.agenthost.common.config.AgentHostConfig;
import okhttp3.HttpUrl;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Resolves the configured path templates against the server base URL.
 */
public class Endpoints {

    private final String baseUrl;
    private final AgentHostConfig.PathsConfig paths;

    public Endpoints(AgentHostConfig.ServerConfig server) {
        String base = server.getBaseUrl();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.paths = server.getPaths();
    }

    public String chatSend() {
        return resolve(paths.getChatSend(), Map.of());
    }

    public String cancel(String requestId) {
        return resolve(paths.getCancel(), Map.of("requestId", requestId));
    }

    public String respond(String agentId) {
        return resolve(paths.getRespond(), Map.of("agentId", agentId));
    }

    public String agentStream(String agentId) {
        return resolve(paths.getStream(), Map.of("agentId", agentId));
    }

    public String agentSession(String agentId) {
        return resolve(paths.getSession(), Map.of("agentId", agentId));
    }

    public String conversation(String conversationId) {
        return resolve(paths.getConversation(), Map.of("conversationId", conversationId));
    }

    /**
     * Socket URL with the optional {@code definition_id} and
     * {@code conversation_id} query parameters.
     */
    public String socket(String definitionId, String conversationId) {
        HttpUrl url = HttpUrl.get(resolve(paths.getSocket(), Map.of()));
        HttpUrl.Builder builder = url.newBuilder();
        if (definitionId != null) {
            builder.addQueryParameter("definition_id", definitionId);
        }
        if (conversationId != null) {
            builder.addQueryParameter("conversation_id", conversationId);
        }
        return builder.build().toString();
    }

    String resolve(String template, Map<String, String> values) {
        String path = template;
        for (var entry : values.entrySet()) {
            String encoded = URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8).replace("+", "%20");
            path = path.replace("{" + entry.getKey() + "}", encoded);
        }
        return baseUrl + (path.startsWith("/") ? path : "/" + path);
    }
}
