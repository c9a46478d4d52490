package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.NormativeProvision;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * Inputs a strategy needs besides the conflict itself.
 *
 * @param first              the provision whose id sorts first in the pair
 * @param second             the other provision
 * @param activeContextFlags situational flags in effect for this resolution run
 * @param asOf               day the resolution is made
 */
public record ResolutionContext(
        NormativeProvision first,
        NormativeProvision second,
        Set<String> activeContextFlags,
        LocalDate asOf
) {
    public ResolutionContext {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        Objects.requireNonNull(asOf, "asOf is required");
        activeContextFlags = activeContextFlags != null ? Set.copyOf(activeContextFlags) : Set.of();
    }

    public NormativeProvision provision(String provisionId) {
        if (first.getId().equals(provisionId)) {
            return first;
        }
        if (second.getId().equals(provisionId)) {
            return second;
        }
        throw new IllegalArgumentException("Provision " + provisionId + " is not part of this conflict");
    }
}
