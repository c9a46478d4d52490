package com.regulatory.conflict.analytics;

import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.StrategyKind;

import java.util.Objects;

/**
 * Signature under which strategy outcomes are aggregated.
 */
public record StatKey(ConflictType conflictType, String jurisdictionBucket, StrategyKind strategy) {

    public StatKey {
        Objects.requireNonNull(conflictType, "conflictType is required");
        Objects.requireNonNull(jurisdictionBucket, "jurisdictionBucket is required");
        Objects.requireNonNull(strategy, "strategy is required");
    }

    @Override
    public String toString() {
        return conflictType + "/" + jurisdictionBucket + "/" + strategy;
    }
}
