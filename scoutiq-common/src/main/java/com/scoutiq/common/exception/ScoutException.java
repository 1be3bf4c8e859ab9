package com.scoutiq.common.exception;

import org.springframework.http.HttpStatus;

public class ScoutException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ScoutException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public ScoutException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public static ScoutException queryTooLong(int maxLength) {
        return new ScoutException(
                String.format("Query cannot exceed %d characters", maxLength),
                HttpStatus.BAD_REQUEST,
                "QUERY_TOO_LONG"
        );
    }
}
