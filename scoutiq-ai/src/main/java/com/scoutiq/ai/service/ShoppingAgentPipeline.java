package com.scoutiq.ai.service;

import com.scoutiq.ai.config.AgentConfig;
import com.scoutiq.ai.exception.PipelineCancelledException;
import com.scoutiq.ai.exception.TerminalPipelineException;
import com.scoutiq.ai.model.Citation;
import com.scoutiq.ai.model.ConversationState;
import com.scoutiq.ai.model.PipelineResult;
import com.scoutiq.ai.retrieval.RetrieverService;
import com.scoutiq.common.exception.ScoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Runs Router, Planner, Retriever and Answerer over one {@link ConversationState}.
 *
 * Flow:
 * 1. Router classifies the query; out_of_scope ends the run with a declination
 * 2. Planner derives constraints and strategy
 * 3. Retriever fetches and reconciles results
 * 4. Answerer writes the answer and citations, unless the caller only wants results
 *
 * A failure in any stage becomes an apologetic answer with the error field set; it never propagates
 * to the caller. Cancellation is the exception and surfaces as {@link PipelineCancelledException}.
 */
@Slf4j
@Service
public class ShoppingAgentPipeline {

    public static final String ALL_SOURCES_UNAVAILABLE = "all_sources_unavailable";

    static final String OUT_OF_SCOPE_ANSWER = "I can only help with shopping and product searches. "
            + "Try asking me to find a product, for example \"stainless steel cleaner under $15\".";

    static final String APOLOGY = "Sorry, something went wrong while working on your search. Please try again.";

    private final RouterService routerService;
    private final PlannerService plannerService;
    private final RetrieverService retrieverService;
    private final AnswererService answererService;
    private final AgentConfig agentConfig;
    private final ExecutorService pipelineExecutor;

    public ShoppingAgentPipeline(
            RouterService routerService,
            PlannerService plannerService,
            RetrieverService retrieverService,
            AnswererService answererService,
            AgentConfig agentConfig,
            @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor) {
        this.routerService = routerService;
        this.plannerService = plannerService;
        this.retrieverService = retrieverService;
        this.answererService = answererService;
        this.agentConfig = agentConfig;
        this.pipelineExecutor = pipelineExecutor;
    }

    public PipelineResult run(String query) {
        return run(query, null);
    }

    /**
     * @param topN Result cap for this query, null for the configured default
     * @throws ScoutException when the query is too long
     * @throws PipelineCancelledException when the calling thread was interrupted mid-run
     */
    public PipelineResult run(String query, Integer topN) {
        return execute(query, topN, true);
    }

    /**
     * Same as {@link #run(String, Integer)} without the Answerer: no answer text and no language
     * model call. Citations still mirror the ranked results.
     */
    public PipelineResult search(String query, Integer topN) {
        return execute(query, topN, false);
    }

    private PipelineResult execute(String query, Integer topN, boolean withAnswer) {
        if (query != null && query.length() > agentConfig.getMaxQueryLength()) {
            throw ScoutException.queryTooLong(agentConfig.getMaxQueryLength());
        }

        long startTime = System.currentTimeMillis();
        ConversationState state = new ConversationState(query);
        state.setTopN(topN);

        try {
            runStage(RouterService.NODE, routerService::route, state);
            if (state.getIntent() != null && state.getIntent().isOutOfScope()) {
                state.setFinalAnswer(OUT_OF_SCOPE_ANSWER);
                log.info("Query out of scope, skipping search: '{}'", state.getQuery());
                return PipelineResult.from(state, System.currentTimeMillis() - startTime);
            }

            runStage(PlannerService.NODE, plannerService::plan, state);
            runStage(RetrieverService.NODE, retrieverService::retrieve, state);
            if (Thread.currentThread().isInterrupted()) {
                throw new PipelineCancelledException(state.getQuery());
            }
            if (state.isRetrievalFailed()) {
                state.setError(ALL_SOURCES_UNAVAILABLE);
            }

            if (withAnswer) {
                runStage(AnswererService.NODE, answererService::answer, state);
            } else {
                state.setCitations(state.getReconciledResults().stream().map(Citation::from).toList());
            }

        } catch (TerminalPipelineException e) {
            log.error("Pipeline failed for query='{}' at {}: {}", state.getQuery(), e.getStage(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
            state.setReconciledResults(new ArrayList<>());
            state.setCitations(new ArrayList<>());
            state.setFinalAnswer(APOLOGY);
            state.setError(e.getMessage());
        }

        return PipelineResult.from(state, System.currentTimeMillis() - startTime);
    }

    /**
     * Run on the pipeline pool. Cancelling the returned future with interruption cancels any
     * in-flight source queries and price lookups.
     */
    public Future<PipelineResult> submit(String query) {
        return pipelineExecutor.submit(() -> run(query));
    }

    private static void runStage(String stage, Consumer<ConversationState> action, ConversationState state) {
        try {
            action.accept(state);
        } catch (PipelineCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TerminalPipelineException(stage, e);
        }
    }
}
