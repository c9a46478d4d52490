package com.regulatory.conflict.config;

/**
 * How Harmonization merges two quantitatively different obligations.
 */
public enum HarmonizationPolicy {
    /** Adopt the stricter threshold, satisfying both provisions at once. */
    MOST_RESTRICTIVE,

    /** Adopt the looser threshold; only acceptable where the stricter one is advisory. */
    LEAST_RESTRICTIVE
}
