package com.yuzhi.spl.common.domain;

/**
 * Outcome of one target within a batch. The table is always present: log rows on success, a
 * single diagnostic row otherwise.
 */
public record TargetResult(String refId, Outcome outcome, OutputTable table, String reason) {

    public enum Outcome {
        SUCCESS,
        BLOCKED,
        FAILED,
    }

    public static TargetResult success(String refId, OutputTable table) {
        return new TargetResult(refId, Outcome.SUCCESS, table, null);
    }

    public static TargetResult blocked(String refId, OutputTable table, String reason) {
        return new TargetResult(refId, Outcome.BLOCKED, table, reason);
    }

    public static TargetResult failed(String refId, OutputTable table, String reason) {
        return new TargetResult(refId, Outcome.FAILED, table, reason);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
