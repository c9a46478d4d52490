package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.Quantity;

import java.util.Optional;

/**
 * Fires when two provisions on the same topic and jurisdiction are in force at the same
 * time, neither supersedes the other, and they state the same kind of obligation with
 * different content. Contradictory polarities are left to the jurisdictional and
 * hierarchical checks.
 */
public class TemporalConflictCheck implements ConflictCheck {

    @Override
    public ConflictType type() {
        return ConflictType.TEMPORAL;
    }

    @Override
    public CheckResult evaluate(PairFacts facts) {
        if (facts.sharedTopics().isEmpty() || facts.polarityDiffers()) {
            return CheckResult.clear();
        }
        if (!contentDiverges(facts.first(), facts.second())) {
            return CheckResult.clear();
        }
        if (!facts.bothHaveJurisdiction()) {
            return CheckResult.missingData("jurisdiction missing");
        }
        if (facts.jurisdictionIntersection().isEmpty()) {
            return CheckResult.clear();
        }
        if (facts.windowsOverlap() == null) {
            return CheckResult.missingData("effective date missing");
        }
        if (!facts.windowsOverlap() || facts.eitherSupersedes()) {
            return CheckResult.clear();
        }
        return CheckResult.fired(baseEvidence(facts).build());
    }

    static boolean contentDiverges(NormativeProvision a, NormativeProvision b) {
        Optional<Quantity> qa = a.getQuantity();
        Optional<Quantity> qb = b.getQuantity();
        if (qa.isPresent() && qb.isPresent() && qa.get().isComparableTo(qb.get())) {
            return Double.compare(qa.get().value(), qb.get().value()) != 0;
        }
        if (a.getObligation() != null && b.getObligation() != null) {
            return !a.getObligation().trim().equalsIgnoreCase(b.getObligation().trim());
        }
        return false;
    }
}
