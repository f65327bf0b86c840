package com.agenthost.protocol.payload;

/**
 * Known widget kinds. The set is open: unknown names pass through unchanged.
 */
public final class WidgetTypes {

    public static final String MULTIPLE_CHOICE = "multiple_choice";
    public static final String FREE_TEXT = "free_text";
    public static final String CODE_EDITOR = "code_editor";
    public static final String SLIDER = "slider";
    public static final String CHART = "chart";
    public static final String MESSAGE = "message";
    public static final String UNKNOWN = "unknown";

    private WidgetTypes() {
    }

    /**
     * Widget kind implied by a legacy client tool name.
     */
    public static String guess(String toolName) {
        if (toolName == null) {
            return UNKNOWN;
        }
        return switch (toolName) {
            case "present_choices" -> MULTIPLE_CHOICE;
            case "request_free_text" -> FREE_TEXT;
            case "present_code_editor" -> CODE_EDITOR;
            default -> UNKNOWN;
        };
    }
}
