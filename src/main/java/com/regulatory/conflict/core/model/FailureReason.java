package com.regulatory.conflict.core.model;

/**
 * Why a conflict left the automated path.
 */
public enum FailureReason {
    /** No branch of the selection tree matched the conflict. */
    STRATEGY_INAPPLICABLE,

    /** A strategy matched but could not produce a resolution (e.g. no matching context). */
    STRATEGY_APPLICATION_FAILED,

    /** Combined confidence was below the configured threshold. */
    LOW_CONFIDENCE,

    /** Concurrent writers exhausted the bounded retry budget. */
    CONCURRENT_MODIFICATION
}
