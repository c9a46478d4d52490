package com.regulatory.conflict.core.model;

/**
 * Deontic polarity of a normative provision.
 */
public enum ObligationPolarity {
    REQUIRES,
    PROHIBITS,
    PERMITS;

    /**
     * Returns whether two polarities cannot both be honoured over the same subject.
     * A prohibition contradicts both a requirement and a permission; a requirement
     * and a permission can coexist.
     */
    public boolean isIncompatibleWith(ObligationPolarity other) {
        if (this == other) {
            return false;
        }
        return this == PROHIBITS || other == PROHIBITS;
    }
}
