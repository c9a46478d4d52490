package com.regulatory.conflict.core.model;

import java.util.Objects;

/**
 * Normalized unordered pair of provision ids. {@code PairKey.of(a, b)} and
 * {@code PairKey.of(b, a)} are equal; the lexicographically smaller id is always first.
 */
public record PairKey(String first, String second) {

    public PairKey {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.equals(second)) {
            throw new IllegalArgumentException("A provision cannot conflict with itself: " + first);
        }
        if (first.compareTo(second) > 0) {
            String tmp = first;
            first = second;
            second = tmp;
        }
    }

    public static PairKey of(String a, String b) {
        return new PairKey(a, b);
    }

    public boolean contains(String provisionId) {
        return first.equals(provisionId) || second.equals(provisionId);
    }

    public String other(String provisionId) {
        if (first.equals(provisionId)) {
            return second;
        }
        if (second.equals(provisionId)) {
            return first;
        }
        throw new IllegalArgumentException("Provision " + provisionId + " is not part of " + this);
    }

    @Override
    public String toString() {
        return first + "<>" + second;
    }
}
