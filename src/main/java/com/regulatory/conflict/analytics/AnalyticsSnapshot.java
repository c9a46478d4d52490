package com.regulatory.conflict.analytics;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of all strategy statistics at one point in time. Readers keep using the
 * snapshot they took even while newer outcomes are being merged.
 *
 * @param version number of outcomes merged into this snapshot
 */
public record AnalyticsSnapshot(Map<StatKey, StrategyOutcomeStat> stats, long version, Instant takenAt) {

    private static final double NEUTRAL_PRIOR = 0.5;

    public AnalyticsSnapshot {
        stats = stats != null ? Map.copyOf(stats) : Map.of();
    }

    public static AnalyticsSnapshot empty() {
        return new AnalyticsSnapshot(Map.of(), 0, null);
    }

    public Optional<StrategyOutcomeStat> stat(StatKey key) {
        return Optional.ofNullable(stats.get(key));
    }

    public double successRate(StatKey key) {
        return stat(key).map(StrategyOutcomeStat::successRate).orElse(NEUTRAL_PRIOR);
    }

    public int size() {
        return stats.size();
    }
}
