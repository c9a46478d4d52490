package com.regulatory.conflict.core.model;

/**
 * The eight legal resolution strategies.
 */
public enum StrategyKind {
    LEX_SUPERIOR,
    LEX_POSTERIOR,
    LEX_SPECIALIS,
    HARMONIZATION,
    CONTEXTUALIZATION,
    DELEGATION,
    TEMPORAL_RESOLUTION,
    JURISDICTIONAL_ARBITRATION
}
