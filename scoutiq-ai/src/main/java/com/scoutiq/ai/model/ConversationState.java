package com.scoutiq.ai.model;

import com.scoutiq.common.enums.SearchStrategy;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state threaded through Router, Planner, Retriever and Answerer.
 * Created per query and owned by a single pipeline invocation.
 */
@Data
public class ConversationState {

    private final String query;

    /** Caller-requested result count, null to use the configured default */
    private Integer topN;

    private Intent intent;
    private Constraints constraints;
    private SearchStrategy strategy;

    private List<RawResult> rawCatalogResults = new ArrayList<>();
    private List<RawResult> rawWebResults = new ArrayList<>();
    private List<ReconciledResult> reconciledResults = new ArrayList<>();

    private String finalAnswer;
    private List<Citation> citations = new ArrayList<>();

    /** Sources that timed out or failed during retrieval */
    private List<String> unavailableSources = new ArrayList<>();
    /** Every dispatched source failed */
    private boolean retrievalFailed;

    private String error;

    private final List<String> log = new ArrayList<>();
    private final List<StepSummary> steps = new ArrayList<>();

    public ConversationState(String query) {
        this.query = query == null ? "" : query.trim();
    }

    public void log(String message) {
        log.add(message);
    }

    public void step(String node, String summary) {
        steps.add(new StepSummary(node, summary));
        log.add(node + ": " + summary);
    }
}
