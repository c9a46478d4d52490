package com.regulatory.conflict.strategy;

import com.regulatory.conflict.analytics.StrategyOutcomeStat;

/**
 * Blends a raw strategy confidence with the signature's history.
 *
 * <p>The prior's weight grows with evidence as {@code maxPriorWeight * n / (n + priorStrength)},
 * so with no history the raw confidence stands alone and the neutral prior of 0.5 has no pull.</p>
 */
public class ConfidenceBlender {

    private final double priorStrength;
    private final double maxPriorWeight;

    public ConfidenceBlender(double priorStrength, double maxPriorWeight) {
        if (priorStrength <= 0) {
            throw new IllegalArgumentException("priorStrength must be positive");
        }
        if (maxPriorWeight < 0.0 || maxPriorWeight > 1.0) {
            throw new IllegalArgumentException("maxPriorWeight must be between 0.0 and 1.0");
        }
        this.priorStrength = priorStrength;
        this.maxPriorWeight = maxPriorWeight;
    }

    /**
     * @param stat history of the signature, null when there is none
     */
    public BlendedConfidence blend(double raw, StrategyOutcomeStat stat) {
        long n = stat != null ? stat.total() : 0;
        double prior = stat != null ? stat.successRate() : 0.5;
        double weight = maxPriorWeight * n / (n + priorStrength);
        double combined = (1.0 - weight) * raw + weight * prior;
        return new BlendedConfidence(raw, prior, weight, Math.max(0.0, Math.min(1.0, combined)));
    }
}
