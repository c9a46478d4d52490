package com.regulatory.conflict.core.model;

/**
 * Outcome recorded on a {@link ResolutionRecord}.
 */
public enum ResolutionOutcome {
    APPLIED,
    REVERTED,
    FAILED
}
