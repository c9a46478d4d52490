package com.regulatory.conflict.core.model;

/**
 * Cause of a detected contradiction between two provisions.
 */
public enum ConflictType {
    /** Overlapping validity windows with diverging content. */
    TEMPORAL,

    /** Intersecting scope, equal authority, incompatible polarity. */
    JURISDICTIONAL,

    /** Different authority rank, incompatible polarity. */
    HIERARCHICAL,

    /** High textual similarity reported by the scorer with differing polarity. */
    SEMANTIC
}
