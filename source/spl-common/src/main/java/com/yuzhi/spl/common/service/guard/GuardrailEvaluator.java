package com.yuzhi.spl.common.service.guard;

import com.yuzhi.spl.common.config.DenyList;
import com.yuzhi.spl.common.config.GuardrailConfig;
import com.yuzhi.spl.common.domain.TimeWindow;
import com.yuzhi.spl.common.service.util.SplunkTimes;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Gates queries before they reach the search engine.
 */
public class GuardrailEvaluator {

    public static final String EMPTY_QUERY = "Query is empty.";
    public static final String RISKY_COMMAND = "Query includes a risky Splunk command (%s) and is blocked by guardrails.";

    public static final String RANGE_EXCEEDED = "Time range (%ds) exceeds the configured cap (%ds).";
    public static final String RANGE_UNRESOLVED = "Time range (%s to %s) cannot be checked against the configured cap (%ds).";

    private final GuardrailConfig config;
    private final Clock clock;

    public GuardrailEvaluator(GuardrailConfig config) {
        this(config, Clock.systemUTC());
    }

    public GuardrailEvaluator(GuardrailConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Empty or whitespace-only text is always blocked. Otherwise the deny-list applies unless
     * dangerous commands are allowed.
     */
    public GuardrailVerdict evaluate(String query) {
        String text = query == null ? "" : query.trim();
        if (text.isEmpty()) {
            return GuardrailVerdict.empty(EMPTY_QUERY);
        }
        if (config.allowDangerousCommands()) {
            return GuardrailVerdict.allowed();
        }
        DenyList denyList = config.denyList();
        return denyList
            .firstMatch(text)
            .map(command -> GuardrailVerdict.banned(String.format(RISKY_COMMAND, command.toLowerCase(Locale.ROOT)), command))
            .orElseGet(GuardrailVerdict::allowed);
    }

    /**
     * Checks the window span against the safe-mode cap. Relative bounds are resolved against the
     * clock first; a missing latest bound means now. A window whose bounds cannot be resolved is
     * rejected.
     *
     * @return the violation message, empty when the window is acceptable
     */
    public Optional<String> checkTimeRange(TimeWindow window) {
        if (!config.safeMode() || window == null) {
            return Optional.empty();
        }
        long maxRange = config.maxRangeSeconds();
        Instant now = clock.instant();
        Optional<Instant> from = window.from() != null ? Optional.of(window.from()) : SplunkTimes.resolve(window.earliestToken(), now);
        Optional<Instant> to = window.to() != null
            ? Optional.of(window.to())
            : StringUtils.isBlank(window.latestToken()) ? Optional.of(now) : SplunkTimes.resolve(window.latestToken(), now);
        if (from.isEmpty() || to.isEmpty()) {
            return Optional.of(String.format(RANGE_UNRESOLVED, describe(window.from(), window.earliestToken()), describe(window.to(), window.latestToken()), maxRange));
        }
        return TimeWindow
            .between(from.get(), to.get())
            .spanSeconds()
            .filter(span -> span > maxRange)
            .map(span -> String.format(RANGE_EXCEEDED, span, maxRange));
    }

    private static String describe(Instant instant, String token) {
        if (instant != null) {
            return SplunkTimes.format(instant);
        }
        return StringUtils.isBlank(token) ? "unset" : token.trim();
    }

    public GuardrailConfig config() {
        return config;
    }
}
