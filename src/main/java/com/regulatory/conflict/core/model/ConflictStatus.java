package com.regulatory.conflict.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a {@link Conflict}.
 *
 * <pre>
 * DETECTED -> STRATEGY_SELECTED -> APPLIED -> RESOLVED | ESCALATED | FAILED
 * </pre>
 *
 * <p>{@code ESCALATED} and {@code FAILED} may return to {@code DETECTED} when a later
 * detection pass observes changed provisions. {@code RESOLVED} returns to {@code DETECTED}
 * only through an explicit revert.</p>
 */
public enum ConflictStatus {
    DETECTED,
    STRATEGY_SELECTED,
    APPLIED,
    RESOLVED,
    ESCALATED,
    FAILED;

    public boolean isTerminal() {
        return this == RESOLVED || this == ESCALATED || this == FAILED;
    }

    /**
     * Returns whether the conflict is still counted as the active conflict of its pair.
     */
    public boolean isActive() {
        return this != RESOLVED;
    }

    public boolean canTransitionTo(ConflictStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<ConflictStatus> allowedTargets() {
        return switch (this) {
            case DETECTED -> EnumSet.of(STRATEGY_SELECTED, FAILED, ESCALATED);
            case STRATEGY_SELECTED -> EnumSet.of(APPLIED, ESCALATED, FAILED);
            case APPLIED -> EnumSet.of(RESOLVED, ESCALATED, FAILED);
            case RESOLVED -> EnumSet.of(DETECTED);
            case ESCALATED, FAILED -> EnumSet.of(DETECTED);
        };
    }
}
