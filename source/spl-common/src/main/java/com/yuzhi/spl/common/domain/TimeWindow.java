package com.yuzhi.spl.common.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Inclusive search window. Each bound is either an absolute instant or an engine-relative token
 * such as {@code now} or {@code -15m}; when a bound has an instant its token is ignored.
 */
public record TimeWindow(Instant from, Instant to, String earliestToken, String latestToken) {

    public TimeWindow {
        if (from != null) {
            earliestToken = null;
        }
        if (to != null) {
            latestToken = null;
        }
    }

    public static TimeWindow between(Instant from, Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("time window bounds must not be null");
        }
        return new TimeWindow(from, to, null, null);
    }

    public static TimeWindow relative(String earliest, String latest) {
        return new TimeWindow(null, null, earliest, latest);
    }

    /**
     * Window with independently typed bounds. A null instant falls back to the token.
     */
    public static TimeWindow of(Instant from, String earliestToken, Instant to, String latestToken) {
        return new TimeWindow(from, to, earliestToken, latestToken);
    }

    public boolean isAbsolute() {
        return from != null && to != null;
    }

    /**
     * Span in whole seconds, rounded up. Empty unless both bounds are instants.
     */
    public Optional<Long> spanSeconds() {
        if (!isAbsolute()) {
            return Optional.empty();
        }
        long millis = Duration.between(from, to).toMillis();
        return Optional.of((long) Math.ceil(millis / 1000.0d));
    }
}
