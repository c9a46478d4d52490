package com.regulatory.conflict.core.model;

import java.util.Objects;

/**
 * Identity of a conflict for deduplication: the unordered pair plus the conflict type.
 */
public record ConflictKey(PairKey pairKey, ConflictType type) {

    public ConflictKey {
        Objects.requireNonNull(pairKey, "pairKey is required");
        Objects.requireNonNull(type, "type is required");
    }

    @Override
    public String toString() {
        return pairKey + ":" + type;
    }
}
