package com.scoutiq.ai.exception;

import com.scoutiq.common.exception.ScoutException;
import org.springframework.http.HttpStatus;

/**
 * A Router, Planner or Answerer failure. Never leaves the pipeline: it is turned into an
 * apologetic answer with the error field set.
 */
public class TerminalPipelineException extends ScoutException {

    private final String stage;

    public TerminalPipelineException(String stage, Throwable cause) {
        super("Search pipeline failed at " + stage + " stage", HttpStatus.INTERNAL_SERVER_ERROR, "PIPELINE_FAILURE", cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
