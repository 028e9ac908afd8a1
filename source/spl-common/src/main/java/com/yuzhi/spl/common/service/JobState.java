package com.yuzhi.spl.common.service;

/**
 * Lifecycle of one search job as tracked by {@link SearchJobController}.
 */
public enum JobState {
    NEW,
    CREATED,
    POLLING,
    DONE,
    TIMED_OUT,
    CREATION_FAILED,
    FAILED,
}
