package com.scoutiq.ai.exception;

import com.scoutiq.common.exception.ScoutException;
import org.springframework.http.HttpStatus;

public class PipelineCancelledException extends ScoutException {

    public PipelineCancelledException(String query) {
        super("Search was cancelled: " + query, HttpStatus.SERVICE_UNAVAILABLE, "SEARCH_CANCELLED");
    }
}
