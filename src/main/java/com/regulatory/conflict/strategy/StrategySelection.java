package com.regulatory.conflict.strategy;

import java.util.Objects;

/**
 * Result of walking the selection tree: a strategy with its raw confidence, or an explicit
 * statement that no branch applies.
 */
public sealed interface StrategySelection permits StrategySelection.Selected, StrategySelection.Inapplicable {

    record Selected(ResolutionStrategy strategy, double rawConfidence, String branch) implements StrategySelection {
        public Selected {
            Objects.requireNonNull(strategy, "strategy is required");
            if (rawConfidence < 0.0 || rawConfidence > 1.0) {
                throw new IllegalArgumentException("rawConfidence must be between 0.0 and 1.0, got " + rawConfidence);
            }
        }
    }

    record Inapplicable(String reason) implements StrategySelection {
    }
}
