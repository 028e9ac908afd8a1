package com.yuzhi.spl.common.domain;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result of one batch query pass: either a batch-level range violation or one
 * {@link TargetResult} per visible target, in input order.
 */
public record BatchResult(OutputTable rangeViolation, List<TargetResult> targets) {

    public BatchResult {
        targets = targets == null ? Collections.emptyList() : List.copyOf(targets);
    }

    public static BatchResult rejected(OutputTable rangeViolation) {
        return new BatchResult(rangeViolation, List.of());
    }

    public static BatchResult of(List<TargetResult> targets) {
        return new BatchResult(null, targets);
    }

    public Optional<OutputTable> violation() {
        return Optional.ofNullable(rangeViolation);
    }

    public List<OutputTable> tables() {
        if (rangeViolation != null) {
            return List.of(rangeViolation);
        }
        return targets.stream().map(TargetResult::table).toList();
    }
}
