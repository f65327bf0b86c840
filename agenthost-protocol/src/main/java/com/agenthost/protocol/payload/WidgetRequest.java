package com.agenthost.protocol.payload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;
import java.util.UUID;

/**
 * A server request for structured input, normalized from the three shapes the
 * server uses:
 * <ul>
 * <li>{@code client_action} wrapping an {@code action} object keyed by
 * {@code tool_call_id};</li>
 * <li>{@code client_action} with {@code action_type: "widget"} and the item
 * fields inline;</li>
 * <li>the socket {@code widget} frame, which uses the inline shape.</li>
 * </ul>
 *
 * @param actionId         correlation id echoed back with the response
 * @param widgetType       widget kind, see {@link WidgetTypes}
 * @param props            widget properties, passed through uninterpreted
 * @param showUserResponse whether the answer is echoed as a user bubble
 */
public record WidgetRequest(String actionId, String widgetType, JsonNode props, boolean showUserResponse) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Parse a {@code client_action} / {@code widget} payload.
     *
     * @return empty if the payload carries neither shape
     */
    public static Optional<WidgetRequest> fromClientAction(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        boolean showUserResponse = !payload.path("show_user_response").isBoolean()
                || payload.get("show_user_response").asBoolean();
        if (payload.path("action").isObject()) {
            return Optional.of(fromAction(payload.get("action"), showUserResponse));
        }
        if ("widget".equals(text(payload, "action_type"))
                || text(payload, "widget_type", "widgetType") != null) {
            return Optional.of(fromInline(payload, showUserResponse));
        }
        return Optional.empty();
    }

    /**
     * Parse the {@code pending_action} object of a {@code state} event.
     */
    public static Optional<WidgetRequest> fromPendingAction(JsonNode action) {
        if (action == null || !action.isObject()) {
            return Optional.empty();
        }
        return Optional.of(fromAction(action, true));
    }

    private static WidgetRequest fromAction(JsonNode action, boolean showUserResponse) {
        String id = text(action, "tool_call_id", "action_id", "actionId", "id");
        String type = text(action, "widget_type", "widgetType");
        if (type == null) {
            type = WidgetTypes.guess(text(action, "tool_name", "name"));
        }
        JsonNode props = action.path("props").isObject() ? action.get("props") : action;
        return new WidgetRequest(idOrGenerated(id), type, props, showUserResponse);
    }

    private static WidgetRequest fromInline(JsonNode payload, boolean showUserResponse) {
        String id = text(payload, "action_id", "actionId", "item_id", "widget_id", "content_id", "tool_call_id");
        String type = text(payload, "widget_type", "widgetType");
        ObjectNode props = MAPPER.createObjectNode();
        copy(payload, "stem", props, "prompt");
        copy(payload, "options", props, "options");
        copy(payload, "required", props, "required");
        copy(payload, "skippable", props, "skippable");
        copy(payload, "initial_value", props, "initial_value");
        copy(payload, "widget_config", props, "widget_config");
        copy(payload, "item_id", props, "item_id");
        copy(payload, "content_id", props, "content_id");
        if (payload.path("props").isObject()) {
            props.setAll((ObjectNode) payload.get("props"));
        }
        return new WidgetRequest(idOrGenerated(id), type, props, showUserResponse);
    }

    private static void copy(JsonNode from, String field, ObjectNode to, String as) {
        JsonNode value = from.get(field);
        if (value != null && !value.isNull()) {
            to.set(as, value);
        }
    }

    private static String idOrGenerated(String id) {
        return id != null ? id : "action-" + UUID.randomUUID();
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        return null;
    }
}
