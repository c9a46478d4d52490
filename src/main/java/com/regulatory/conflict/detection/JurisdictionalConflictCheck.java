package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.ConflictType;

/**
 * Fires when overlapping scopes impose incompatible obligations on the same topic and
 * the issuers rank equally (or a rank is unknown). Rank differences belong to
 * {@link HierarchicalConflictCheck}.
 */
public class JurisdictionalConflictCheck implements ConflictCheck {

    @Override
    public ConflictType type() {
        return ConflictType.JURISDICTIONAL;
    }

    @Override
    public CheckResult evaluate(PairFacts facts) {
        if (facts.sharedTopics().isEmpty() || !facts.polarityIncompatible()) {
            return CheckResult.clear();
        }
        if (!facts.bothHaveJurisdiction()) {
            return CheckResult.missingData("jurisdiction missing");
        }
        if (facts.jurisdictionIntersection().isEmpty()) {
            return CheckResult.clear();
        }
        if (facts.authorityGap() != null && facts.authorityGap() > 0) {
            return CheckResult.clear();
        }
        return CheckResult.fired(baseEvidence(facts).build());
    }
}
