package com.yuzhi.spl.common.transport;

/**
 * Failure of an underlying call to the search engine: network error, non-2xx status or an
 * unreadable payload.
 */
public class SearchTransportException extends RuntimeException {

    private final Integer statusCode;

    public SearchTransportException(String message) {
        this(message, null, null);
    }

    public SearchTransportException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public SearchTransportException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, when one was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
