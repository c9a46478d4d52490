package com.regulatory.conflict.config;

/**
 * Coefficients of the severity formula:
 * {@code severity = authorityGap * gap + reach * reach + urgency * urgency}.
 */
public record SeverityWeights(double authorityGap, double reach, double urgency) {

    public SeverityWeights {
        if (authorityGap < 0 || reach < 0 || urgency < 0) {
            throw new InvalidConfigurationException("Severity weights must be non-negative");
        }
        double sum = authorityGap + reach + urgency;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new InvalidConfigurationException("Severity weights must sum to 1.0, got " + sum);
        }
    }

    public static SeverityWeights defaultWeights() {
        return new SeverityWeights(0.4, 0.3, 0.3);
    }

    /**
     * Weights that rank conflicts mostly by how soon they bite.
     */
    public static SeverityWeights urgencyFocused() {
        return new SeverityWeights(0.2, 0.2, 0.6);
    }
}
