package com.yuzhi.spl.common.domain;

import java.time.Instant;

/**
 * Normalized output row. {@code time} is never null.
 */
public record LogRow(Instant time, String host, String message) {}
