package com.yuzhi.spl.common.service.exception;

/**
 * The job did not become readable within the configured number of status checks.
 */
public class PollTimeoutException extends SearchJobException {

    public static final String DEFAULT_MESSAGE = "Splunk job did not complete within polling limits";

    private final String sid;
    private final int polls;

    public PollTimeoutException(String sid, int polls) {
        super(DEFAULT_MESSAGE);
        this.sid = sid;
        this.polls = polls;
    }

    public String getSid() {
        return sid;
    }

    public int getPolls() {
        return polls;
    }
}
