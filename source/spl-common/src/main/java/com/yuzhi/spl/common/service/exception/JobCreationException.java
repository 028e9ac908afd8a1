package com.yuzhi.spl.common.service.exception;

/**
 * The engine accepted the create request but returned no job handle.
 */
public class JobCreationException extends SearchJobException {

    public static final String DEFAULT_MESSAGE = "Failed to create Splunk search job";

    public JobCreationException() {
        super(DEFAULT_MESSAGE);
    }
}
