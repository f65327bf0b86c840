package com.agenthost.protocol.payload;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for widget answers.
 */
public final class WidgetResponses {

    private WidgetResponses() {
    }

    /**
     * Text shown in the user bubble for an answer: {@code selected} (arrays
     * joined by ", "), then {@code text}, {@code code}, {@code value}, falling
     * back to the raw JSON.
     */
    public static String displayText(JsonNode response) {
        if (response == null || response.isNull() || response.isMissingNode()) {
            return "";
        }
        if (response.isValueNode()) {
            return response.asText();
        }
        JsonNode selected = response.get("selected");
        if (selected != null && !selected.isNull()) {
            if (selected.isArray()) {
                List<String> parts = new ArrayList<>();
                selected.forEach(node -> parts.add(node.asText()));
                return String.join(", ", parts);
            }
            return selected.asText();
        }
        for (String field : new String[] { "text", "code" }) {
            JsonNode value = response.get(field);
            if (value != null && value.isTextual() && !value.asText().isEmpty()) {
                return value.asText();
            }
        }
        JsonNode value = response.get("value");
        if (value != null && !value.isNull()) {
            return value.isValueNode() ? value.asText() : value.toString();
        }
        return response.toString();
    }
}
