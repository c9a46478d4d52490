package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.StrategyKind;

/**
 * Thrown by {@link ResolutionStrategy#apply} when a selected strategy cannot produce an
 * outcome for the given context.
 */
public class StrategyApplicationException extends RuntimeException {

    private final StrategyKind strategy;

    public StrategyApplicationException(StrategyKind strategy, String message) {
        super(message);
        this.strategy = strategy;
    }

    public StrategyKind getStrategy() {
        return strategy;
    }
}
