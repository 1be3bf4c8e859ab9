package com.scoutiq.common.exception;

import org.springframework.http.HttpStatus;

/**
 * A search backend timed out or failed. The retriever degrades to the remaining sources.
 */
public class SourceUnavailableException extends ScoutException {

    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message) {
        super(message, HttpStatus.BAD_GATEWAY, "SOURCE_UNAVAILABLE");
        this.sourceName = sourceName;
    }

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super(message, HttpStatus.BAD_GATEWAY, "SOURCE_UNAVAILABLE", cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
