package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.ConflictEvidence;
import com.regulatory.conflict.core.model.ConflictType;

/**
 * One independent conflict test run on every candidate pair.
 * Checks are stateless and may be called concurrently from several bucket scans.
 */
public interface ConflictCheck {

    ConflictType type();

    CheckResult evaluate(PairFacts facts);

    /**
     * Evidence pre-filled with the facts every conflict type reports.
     */
    default ConflictEvidence.Builder baseEvidence(PairFacts facts) {
        return ConflictEvidence.builder()
                .sharedTopics(facts.sharedTopics())
                .jurisdictionIntersection(facts.jurisdictionIntersection())
                .overlap(facts.overlapStart(), facts.overlapEnd())
                .authorityGap(facts.authorityGap());
    }
}
