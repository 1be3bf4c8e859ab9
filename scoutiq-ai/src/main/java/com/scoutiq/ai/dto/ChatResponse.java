package com.scoutiq.ai.dto;

import com.scoutiq.ai.model.Citation;
import com.scoutiq.ai.model.PipelineResult;
import com.scoutiq.ai.model.StepSummary;
import com.scoutiq.common.enums.IntentType;
import com.scoutiq.common.enums.SearchStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * Response DTO for the chat endpoint.
 * Carries the answer text and citations along with the ranked results and the stage trail.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String query;

    private IntentType intent;

    private Set<String> safetyFlags;

    /**
     * Null when the router ended the run before planning.
     */
    private SearchStrategy strategy;

    /**
     * Answer text with [n] citation markers.
     */
    private String answer;

    private List<Citation> citations;

    private List<ResultItem> results;

    /**
     * One entry per executed stage, in order.
     */
    private List<StepSummary> steps;

    private String error;

    private Long processingTimeMs;

    public static ChatResponse from(PipelineResult result) {
        return ChatResponse.builder()
                .query(result.getQuery())
                .intent(result.getIntent() != null ? result.getIntent().getType() : null)
                .safetyFlags(result.getIntent() != null ? result.getIntent().getSafetyFlags() : Set.of())
                .strategy(result.getStrategy())
                .answer(result.getAnswer())
                .citations(result.getCitations())
                .results(result.getError() != null
                        ? List.of()
                        : result.getResults().stream().map(ResultItem::from).toList())
                .steps(result.getSteps())
                .error(result.getError())
                .processingTimeMs(result.getProcessingTimeMs())
                .build();
    }
}
