package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.ConflictType;

/**
 * Fires when issuers of different rank impose incompatible obligations on the same topic
 * within overlapping scopes.
 */
public class HierarchicalConflictCheck implements ConflictCheck {

    @Override
    public ConflictType type() {
        return ConflictType.HIERARCHICAL;
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
        if (facts.authorityGap() == null) {
            return CheckResult.missingData("authority level missing");
        }
        if (facts.authorityGap() == 0) {
            return CheckResult.clear();
        }
        return CheckResult.fired(baseEvidence(facts).build());
    }
}
