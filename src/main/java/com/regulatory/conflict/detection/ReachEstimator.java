package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.NormativeProvision;

import java.util.Set;

/**
 * External estimate of how many people or entities a conflict affects, normalized to
 * [0, 1]. Typically backed by population or registry counts per jurisdiction.
 */
@FunctionalInterface
public interface ReachEstimator {

    double estimate(NormativeProvision a, NormativeProvision b, Set<String> jurisdictionIntersection);

    static ReachEstimator none() {
        return (a, b, intersection) -> 0.0;
    }
}
