package com.perpconnector.domain.model;

import com.perpconnector.domain.enums.ApplyOutcome;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-outcome counts for one batch of canonical updates pushed through the
 * reconciliation engine.
 */
public class BatchResult {

    private final EnumMap<ApplyOutcome, Integer> counts = new EnumMap<>(ApplyOutcome.class);

    public static BatchResult empty() {
        return new BatchResult();
    }

    public void record(ApplyOutcome outcome) {
        counts.merge(outcome, 1, Integer::sum);
    }

    /** Adds every count of {@code other} to this result. */
    public void merge(BatchResult other) {
        other.counts.forEach((outcome, count) -> counts.merge(outcome, count, Integer::sum));
    }

    public int count(ApplyOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<ApplyOutcome, Integer> asMap() {
        return Map.copyOf(counts);
    }

    @Override
    public String toString() {
        return "BatchResult" + counts;
    }
}
