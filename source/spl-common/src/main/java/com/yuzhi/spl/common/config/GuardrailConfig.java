package com.yuzhi.spl.common.config;

/**
 * Guardrail and paging limits of one datasource. Values are clamped on construction, so every
 * instance is safe to use as-is.
 *
 * @param safeMode enforce {@code maxRangeSeconds} before any query runs
 * @param maxRangeSeconds largest allowed time window span
 * @param maxRows stop issuing result pages once this many rows were read, 0 for unlimited
 * @param pageSize records requested per result page, within [1, 5000]
 * @param pollIntervalMs delay between job status checks, at least 100 ms
 * @param maxPolls status checks before giving up on a job, at least 1
 * @param denyList compiled banned command patterns
 * @param allowDangerousCommands skip the deny-list check entirely
 */
public record GuardrailConfig(
    boolean safeMode,
    long maxRangeSeconds,
    int maxRows,
    int pageSize,
    long pollIntervalMs,
    int maxPolls,
    DenyList denyList,
    boolean allowDangerousCommands
) {
    public static final long DEFAULT_MAX_RANGE_SECONDS = 24L * 60 * 60;
    public static final int DEFAULT_MAX_ROWS = 2000;
    public static final int DEFAULT_PAGE_SIZE = 200;
    public static final int MAX_PAGE_SIZE = 5000;
    public static final long DEFAULT_POLL_INTERVAL_MS = 1000;
    public static final long MIN_POLL_INTERVAL_MS = 100;
    public static final int DEFAULT_MAX_POLLS = 30;

    public GuardrailConfig {
        maxRangeSeconds = Math.max(0, maxRangeSeconds);
        maxRows = Math.max(0, maxRows);
        pageSize = Math.max(1, Math.min(pageSize, MAX_PAGE_SIZE));
        pollIntervalMs = Math.max(MIN_POLL_INTERVAL_MS, pollIntervalMs);
        maxPolls = Math.max(1, maxPolls);
        if (denyList == null) {
            denyList = DenyList.none();
        }
    }

    public static GuardrailConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .safeMode(safeMode)
            .maxRangeSeconds(maxRangeSeconds)
            .maxRows(maxRows)
            .pageSize(pageSize)
            .pollIntervalMs(pollIntervalMs)
            .maxPolls(maxPolls)
            .denyList(denyList)
            .allowDangerousCommands(allowDangerousCommands);
    }

    public static final class Builder {

        private boolean safeMode = true;
        private long maxRangeSeconds = DEFAULT_MAX_RANGE_SECONDS;
        private int maxRows = DEFAULT_MAX_ROWS;
        private int pageSize = DEFAULT_PAGE_SIZE;
        private long pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;
        private int maxPolls = DEFAULT_MAX_POLLS;
        private DenyList denyList = DenyList.defaults();
        private boolean allowDangerousCommands = false;

        private Builder() {}

        public Builder safeMode(boolean safeMode) {
            this.safeMode = safeMode;
            return this;
        }

        public Builder maxRangeSeconds(long maxRangeSeconds) {
            this.maxRangeSeconds = maxRangeSeconds;
            return this;
        }

        public Builder maxRows(int maxRows) {
            this.maxRows = maxRows;
            return this;
        }

        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public Builder maxPolls(int maxPolls) {
            this.maxPolls = maxPolls;
            return this;
        }

        public Builder denyList(DenyList denyList) {
            this.denyList = denyList;
            return this;
        }

        /**
         * Selects the deny-list source: the built-in defaults, or the operator's newline-separated
         * fragments when {@code override} is set.
         */
        public Builder bannedCommands(boolean override, String bannedCommands) {
            this.denyList = override ? DenyList.parse(bannedCommands) : DenyList.defaults();
            return this;
        }

        public Builder allowDangerousCommands(boolean allowDangerousCommands) {
            this.allowDangerousCommands = allowDangerousCommands;
            return this;
        }

        public GuardrailConfig build() {
            return new GuardrailConfig(
                safeMode,
                maxRangeSeconds,
                maxRows,
                pageSize,
                pollIntervalMs,
                maxPolls,
                denyList,
                allowDangerousCommands
            );
        }
    }
}
