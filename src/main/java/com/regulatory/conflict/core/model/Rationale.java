package com.regulatory.conflict.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured explanation of a resolution: the rule that decided it and the facts it used.
 *
 * @param strategy the strategy that produced the outcome
 * @param rule     short machine-readable rule identifier (e.g. {@code higher-authority-wins})
 * @param factors  ordered facts the rule relied on
 */
public record Rationale(StrategyKind strategy, String rule, Map<String, String> factors) {

    public Rationale {
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(rule, "rule is required");
        factors = factors != null ? Map.copyOf(factors) : Map.of();
    }

    public static Builder of(StrategyKind strategy, String rule) {
        return new Builder(strategy, rule);
    }

    public static class Builder {
        private final StrategyKind strategy;
        private final String rule;
        private final Map<String, String> factors = new LinkedHashMap<>();

        private Builder(StrategyKind strategy, String rule) {
            this.strategy = strategy;
            this.rule = rule;
        }

        public Builder factor(String key, Object value) {
            factors.put(key, String.valueOf(value));
            return this;
        }

        public Rationale build() {
            return new Rationale(strategy, rule, factors);
        }
    }
}
