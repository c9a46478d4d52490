package com.regulatory.conflict.analytics;

import java.time.Instant;
import java.util.Objects;

/**
 * Success and failure counts of one strategy signature.
 */
public record StrategyOutcomeStat(StatKey key, long successCount, long failureCount, Instant lastUpdated) {

    public StrategyOutcomeStat {
        Objects.requireNonNull(key, "key is required");
        if (successCount < 0 || failureCount < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
    }

    public static StrategyOutcomeStat empty(StatKey key) {
        return new StrategyOutcomeStat(key, 0, 0, null);
    }

    public long total() {
        return successCount + failureCount;
    }

    /**
     * Add-one smoothed success rate, {@code (s + 1) / (s + f + 2)}. Equals 0.5 with no history.
     */
    public double successRate() {
        return (successCount + 1.0) / (successCount + failureCount + 2.0);
    }

    public StrategyOutcomeStat plus(boolean success, Instant at) {
        return new StrategyOutcomeStat(key,
                success ? successCount + 1 : successCount,
                success ? failureCount : failureCount + 1,
                at);
    }
}
