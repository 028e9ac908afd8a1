package com.yuzhi.spl.common.service.exception;

/**
 * The caller abandoned the batch, either explicitly or because its deadline passed.
 */
public class QueryCancelledException extends SearchJobException {

    public static final String DEFAULT_MESSAGE = "Query cancelled";

    public QueryCancelledException() {
        super(DEFAULT_MESSAGE);
    }

    public QueryCancelledException(String message) {
        super(message);
    }
}
