package com.yuzhi.spl.common.service;

import com.yuzhi.spl.common.service.exception.QueryCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal for one batch. Checked at every suspension point: after job creation,
 * before each status poll, while waiting between polls and before each page fetch.
 */
public final class QueryCancellation {

    private final Clock clock;
    private final Instant deadline;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    private QueryCancellation(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    /**
     * A signal that only fires on an explicit {@link #cancel()}.
     */
    public static QueryCancellation create() {
        return new QueryCancellation(null, Clock.systemUTC());
    }

    public static QueryCancellation withTimeout(Duration timeout) {
        return withDeadline(Instant.now().plus(timeout), Clock.systemUTC());
    }

    public static QueryCancellation withDeadline(Instant deadline, Clock clock) {
        return new QueryCancellation(deadline, clock);
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0 || isExpired();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new QueryCancelledException();
        }
    }

    /**
     * Waits up to {@code millis}, returning early when the signal fires or the deadline passes.
     */
    public void pause(long millis) throws InterruptedException {
        long wait = millis;
        if (deadline != null) {
            long remaining = Duration.between(clock.instant(), deadline).toMillis();
            wait = Math.max(0, Math.min(wait, remaining));
        }
        if (wait > 0) {
            cancelled.await(wait, TimeUnit.MILLISECONDS);
        }
        throwIfCancelled();
    }

    private boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
