package com.yuzhi.spl.common.service.exception;

/**
 * Base type for failures that end one target's search job.
 */
public class SearchJobException extends RuntimeException {

    public SearchJobException(String message) {
        super(message);
    }

    public SearchJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
