package com.agenthost.protocol.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateConfigPayload {

    @JsonProperty("template_id")
    private String templateId;

    private String name;

    @JsonProperty("allow_navigation")
    private Boolean allowNavigation;

    @JsonProperty("allow_backward_navigation")
    private Boolean allowBackwardNavigation;

    @JsonProperty("display_progress_indicator")
    private Boolean displayProgressIndicator;

    @JsonProperty("display_final_score_report")
    private Boolean displayFinalScoreReport;

    @JsonProperty("total_items")
    private Integer totalItems;
}
