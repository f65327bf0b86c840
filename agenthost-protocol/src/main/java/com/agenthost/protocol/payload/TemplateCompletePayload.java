package com.agenthost.protocol.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateCompletePayload {

    @JsonProperty("total_items")
    private Integer totalItems;

    @JsonProperty("total_score")
    private Double totalScore;

    @JsonProperty("max_possible_score")
    private Double maxPossibleScore;

    @JsonProperty("display_final_score_report")
    private Boolean displayFinalScoreReport;

    /** {@code false} ends free-text chat once the template is done. */
    @JsonProperty("continue_after_completion")
    private Boolean continueAfterCompletion;
}
