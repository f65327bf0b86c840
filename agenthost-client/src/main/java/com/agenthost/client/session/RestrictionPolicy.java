package com.agenthost.client.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Derives a session's {@link RestrictionSet} from its kind and the server's
 * session configuration.
 * <p>
 * Proactive sessions start from {@link RestrictionSet#STRICT}, reactive ones
 * from {@link RestrictionSet#PERMISSIVE}. Flags present in the configuration
 * override the default; keys are accepted in snake or camel case, under a
 * {@code restrictions} object or at the top level.
 */
public final class RestrictionPolicy {

    private static final List<String> SWITCH_KEYS = List.of(
            "can_switch_sessions", "canSwitchSessions", "can_switch_agents", "canSwitchAgents");
    private static final List<String> HISTORY_KEYS = List.of(
            "can_access_history", "canAccessHistory", "can_access_conversations", "canAccessConversations");
    private static final List<String> FREE_TEXT_KEYS = List.of(
            "can_free_type_text", "canFreeTypeText", "can_type_free_text", "canTypeFreeText");
    private static final List<String> END_EARLY_KEYS = List.of("can_end_early", "canEndEarly");

    private RestrictionPolicy() {
    }

    public static RestrictionSet defaults(SessionKind kind) {
        return kind == SessionKind.PROACTIVE ? RestrictionSet.STRICT : RestrictionSet.PERMISSIVE;
    }

    public static RestrictionSet derive(SessionKind kind, JsonNode serverConfig) {
        return apply(defaults(kind), serverConfig);
    }

    /**
     * Overlay the flags present in {@code update} on {@code current}; absent
     * flags keep their value.
     */
    public static RestrictionSet apply(RestrictionSet current, JsonNode update) {
        if (update == null || !update.isObject()) {
            return current;
        }
        JsonNode nested = update.get("restrictions");
        JsonNode source = nested != null && nested.isObject() ? nested : update;
        RestrictionSet result = current;
        Boolean value = flag(source, SWITCH_KEYS);
        if (value != null) {
            result = result.withCanSwitchSessions(value);
        }
        value = flag(source, HISTORY_KEYS);
        if (value != null) {
            result = result.withCanAccessHistory(value);
        }
        value = flag(source, FREE_TEXT_KEYS);
        if (value != null) {
            result = result.withCanFreeTypeText(value);
        }
        value = flag(source, END_EARLY_KEYS);
        if (value != null) {
            result = result.withCanEndEarly(value);
        }
        return result;
    }

    private static Boolean flag(JsonNode source, List<String> keys) {
        for (String key : keys) {
            JsonNode node = source.get(key);
            if (node != null && node.isBoolean()) {
                return node.booleanValue();
            }
        }
        return null;
    }
}
