package com.scoutiq.ai.retrieval;

import com.scoutiq.ai.model.RawResult;

import java.util.List;

/**
 * What one source contributed to a retrieval: hits, or the reason it contributed nothing.
 */
public class SourceOutcome {
    private final String source;
    private final List<RawResult> results;
    private final boolean error;
    private final boolean timedOut;
    private final boolean skipped;
    private final long tookMs;
    private final String errorMessage;

    private SourceOutcome(
        String source,
        List<RawResult> results,
        boolean error,
        boolean timedOut,
        boolean skipped,
        long tookMs,
        String errorMessage
    ) {
        this.source = source;
        this.results = results == null ? List.of() : results;
        this.error = error;
        this.timedOut = timedOut;
        this.skipped = skipped;
        this.tookMs = tookMs;
        this.errorMessage = errorMessage;
    }

    public static SourceOutcome success(String source, List<RawResult> results, long tookMs) {
        return new SourceOutcome(source, results, false, false, false, tookMs, null);
    }

    public static SourceOutcome error(String source, String message, long tookMs) {
        return new SourceOutcome(source, List.of(), true, false, false, tookMs, message);
    }

    public static SourceOutcome timedOut(String source, long tookMs) {
        return new SourceOutcome(source, List.of(), true, true, false, tookMs, "timeout");
    }

    public static SourceOutcome skipped(String source) {
        return new SourceOutcome(source, List.of(), false, false, true, 0L, "not in strategy");
    }

    public String getSource() {
        return source;
    }

    public List<RawResult> getResults() {
        return results;
    }

    public boolean isError() {
        return error;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String describe() {
        if (skipped) {
            return source + " skipped";
        }
        if (timedOut) {
            return source + " timed out after " + tookMs + "ms";
        }
        if (error) {
            return source + " unavailable: " + errorMessage;
        }
        return source + " returned " + results.size() + " hits in " + tookMs + "ms";
    }
}
