package com.yuzhi.spl.common.domain;

import java.util.Locale;
import java.util.Set;

/**
 * Status snapshot of a remote search job.
 *
 * @param done completion flag reported by the engine, null when absent
 * @param dispatchState dispatch state token, null when absent
 */
public record JobStatus(Boolean done, String dispatchState) {

    /** Dispatch states after which results may be read. */
    private static final Set<String> READABLE_STATES = Set.of("DONE", "PAUSED", "FINALIZING");

    public boolean isReadable() {
        if (Boolean.TRUE.equals(done)) {
            return true;
        }
        return dispatchState != null && READABLE_STATES.contains(dispatchState.trim().toUpperCase(Locale.ROOT));
    }

    public static JobStatus pending(String dispatchState) {
        return new JobStatus(Boolean.FALSE, dispatchState);
    }
}
