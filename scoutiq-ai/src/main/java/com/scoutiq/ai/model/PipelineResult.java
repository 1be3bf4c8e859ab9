package com.scoutiq.ai.model;

import com.scoutiq.common.enums.SearchStrategy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Snapshot of a finished pipeline run, handed to the caller once no stage can touch the state any more.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineResult {

    private String query;
    private Intent intent;
    private Constraints constraints;
    private SearchStrategy strategy;
    private String answer;
    private List<Citation> citations;
    private List<ReconciledResult> results;
    private List<StepSummary> steps;
    private List<String> log;

    /** Null on success; set on a terminal stage failure or when every source failed */
    private String error;

    private long processingTimeMs;

    public static PipelineResult from(ConversationState state, long processingTimeMs) {
        return PipelineResult.builder()
                .query(state.getQuery())
                .intent(state.getIntent())
                .constraints(state.getConstraints())
                .strategy(state.getStrategy())
                .answer(state.getFinalAnswer())
                .citations(List.copyOf(state.getCitations()))
                .results(List.copyOf(state.getReconciledResults()))
                .steps(List.copyOf(state.getSteps()))
                .log(List.copyOf(state.getLog()))
                .error(state.getError())
                .processingTimeMs(processingTimeMs)
                .build();
    }
}
