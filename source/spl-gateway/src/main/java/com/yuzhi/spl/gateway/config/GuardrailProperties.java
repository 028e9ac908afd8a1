package com.yuzhi.spl.gateway.config;

import com.yuzhi.spl.common.config.DenyList;
import com.yuzhi.spl.common.config.GuardrailConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spl.guardrails")
public class GuardrailProperties {

    /** Reject batches whose time range exceeds {@code maxRangeSeconds}. */
    private boolean safeMode = true;

    private long maxRangeSeconds = GuardrailConfig.DEFAULT_MAX_RANGE_SECONDS;

    /** Stop paging once this many rows were read; 0 disables the cap. */
    private int maxRows = GuardrailConfig.DEFAULT_MAX_ROWS;

    private int pageSize = GuardrailConfig.DEFAULT_PAGE_SIZE;

    private long pollIntervalMs = GuardrailConfig.DEFAULT_POLL_INTERVAL_MS;

    private int maxPolls = GuardrailConfig.DEFAULT_MAX_POLLS;

    /** Use {@code bannedCommands} instead of the built-in deny-list. */
    private boolean overrideBannedCommands = false;

    /** Newline-separated regex fragments, one banned command per line. */
    private String bannedCommands = String.join("\n", DenyList.DEFAULT_FRAGMENTS);

    /** Disable the deny-list check. Empty queries are still rejected. */
    private boolean allowDangerousCommands = false;

    /**
     * Builds the effective, clamped configuration.
     *
     * @throws IllegalArgumentException if a banned command fragment is not a valid pattern
     */
    public GuardrailConfig toGuardrailConfig() {
        return GuardrailConfig.builder()
            .safeMode(safeMode)
            .maxRangeSeconds(maxRangeSeconds)
            .maxRows(maxRows)
            .pageSize(pageSize)
            .pollIntervalMs(pollIntervalMs)
            .maxPolls(maxPolls)
            .bannedCommands(overrideBannedCommands, bannedCommands)
            .allowDangerousCommands(allowDangerousCommands)
            .build();
    }

    public boolean isSafeMode() {
        return safeMode;
    }

    public void setSafeMode(boolean safeMode) {
        this.safeMode = safeMode;
    }

    public long getMaxRangeSeconds() {
        return maxRangeSeconds;
    }

    public void setMaxRangeSeconds(long maxRangeSeconds) {
        this.maxRangeSeconds = maxRangeSeconds;
    }

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getMaxPolls() {
        return maxPolls;
    }

    public void setMaxPolls(int maxPolls) {
        this.maxPolls = maxPolls;
    }

    public boolean isOverrideBannedCommands() {
        return overrideBannedCommands;
    }

    public void setOverrideBannedCommands(boolean overrideBannedCommands) {
        this.overrideBannedCommands = overrideBannedCommands;
    }

    public String getBannedCommands() {
        return bannedCommands;
    }

    public void setBannedCommands(String bannedCommands) {
        this.bannedCommands = bannedCommands;
    }

    public boolean isAllowDangerousCommands() {
        return allowDangerousCommands;
    }

    public void setAllowDangerousCommands(boolean allowDangerousCommands) {
        this.allowDangerousCommands = allowDangerousCommands;
    }
}
