package com.yuzhi.spl.common.service;

import com.yuzhi.spl.common.config.GuardrailConfig;
import java.util.Map;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Bounded status polling: at most {@code maxAttempts} checks with a fixed interval between them.
 * Only {@link JobPendingException} triggers another attempt; any other failure ends the loop at
 * once.
 */
public class PollPolicy {

    private final int maxAttempts;
    private final long intervalMs;
    private final Sleeper sleeper;

    public PollPolicy(int maxAttempts, long intervalMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.intervalMs = Math.max(1, intervalMs);
        this.sleeper = sleeper;
    }

    /**
     * Policy from guardrail settings. A null sleeper waits on the batch's cancellation signal.
     */
    public static PollPolicy from(GuardrailConfig config, Sleeper sleeper) {
        return new PollPolicy(config.maxPolls(), config.pollIntervalMs(), sleeper);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long intervalMs() {
        return intervalMs;
    }

    <T> T execute(RetryCallback<T, JobPendingException> callback, QueryCancellation cancellation) {
        return template(cancellation).execute(callback);
    }

    private RetryTemplate template(QueryCancellation cancellation) {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(
            new SimpleRetryPolicy(maxAttempts, Map.<Class<? extends Throwable>, Boolean>of(JobPendingException.class, Boolean.TRUE))
        );
        FixedBackOffPolicy backOff = new FixedBackOffPolicy();
        backOff.setBackOffPeriod(intervalMs);
        backOff.setSleeper(sleeper != null ? sleeper : cancellation::pause);
        template.setBackOffPolicy(backOff);
        template.setThrowLastExceptionOnExhausted(true);
        return template;
    }

    /**
     * Raised by a poll attempt whose job is not readable yet.
     */
    static class JobPendingException extends RuntimeException {

        JobPendingException(String sid, String dispatchState) {
            super("job " + sid + " pending, dispatchState=" + dispatchState, null, false, false);
        }
    }
}
