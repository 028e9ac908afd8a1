package com.yuzhi.spl.common.service.guard;

/**
 * Classification of a finalized query.
 *
 * @param status verdict
 * @param reason human-readable block reason, null when allowed
 * @param matchedCommand denied command found in the query, for {@link Status#BANNED} only
 */
public record GuardrailVerdict(Status status, String reason, String matchedCommand) {

    public enum Status {
        ALLOWED,
        EMPTY,
        BANNED,
    }

    private static final GuardrailVerdict ALLOWED_VERDICT = new GuardrailVerdict(Status.ALLOWED, null, null);

    public static GuardrailVerdict allowed() {
        return ALLOWED_VERDICT;
    }

    public static GuardrailVerdict empty(String reason) {
        return new GuardrailVerdict(Status.EMPTY, reason, null);
    }

    public static GuardrailVerdict banned(String reason, String matchedCommand) {
        return new GuardrailVerdict(Status.BANNED, reason, matchedCommand);
    }

    public boolean isAllowed() {
        return status == Status.ALLOWED;
    }
}
