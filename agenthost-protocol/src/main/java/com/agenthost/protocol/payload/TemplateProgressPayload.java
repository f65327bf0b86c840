package com.agenthost.protocol.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateProgressPayload {

    /** 0-based index of the item being presented. */
    @JsonProperty("current_item")
    private int currentItem;

    @JsonProperty("total_items")
    private int totalItems;

    @JsonProperty("item_id")
    private String itemId;

    @JsonProperty("item_title")
    private String itemTitle;

    /** {@code false} closes the chat input for this item. */
    @JsonProperty("enable_chat_input")
    private Boolean enableChatInput;

    /** ISO-8601 deadline for the item, if timed. */
    private String deadline;

    @JsonProperty("display_progress_indicator")
    private Boolean displayProgressIndicator;

    @JsonProperty("allow_backward_navigation")
    private Boolean allowBackwardNavigation;
}
