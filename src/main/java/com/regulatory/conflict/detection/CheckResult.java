package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.ConflictEvidence;

import java.util.Objects;

/**
 * Outcome of one conflict check on one pair.
 *
 * @param outcome  what the check concluded
 * @param evidence facts backing a {@code FIRED} result, null otherwise
 * @param reason   why a check was skipped, null otherwise
 */
public record CheckResult(Outcome outcome, ConflictEvidence evidence, String reason) {

    public enum Outcome {
        /** The pair conflicts in the sense of this check. */
        FIRED,
        /** The pair does not conflict in the sense of this check. */
        CLEAR,
        /** A provision lacks data this check needs. */
        SKIPPED_DATA_QUALITY,
        /** A dependency was unavailable; the pair must be checked again next cycle. */
        SKIPPED_PENDING
    }

    private static final CheckResult CLEAR = new CheckResult(Outcome.CLEAR, null, null);

    public CheckResult {
        Objects.requireNonNull(outcome, "outcome is required");
        if (outcome == Outcome.FIRED && evidence == null) {
            throw new IllegalArgumentException("A fired check must carry evidence");
        }
    }

    public static CheckResult fired(ConflictEvidence evidence) {
        return new CheckResult(Outcome.FIRED, evidence, null);
    }

    public static CheckResult clear() {
        return CLEAR;
    }

    public static CheckResult missingData(String reason) {
        return new CheckResult(Outcome.SKIPPED_DATA_QUALITY, null, reason);
    }

    public static CheckResult pending(String reason) {
        return new CheckResult(Outcome.SKIPPED_PENDING, null, reason);
    }

    public boolean fired() {
        return outcome == Outcome.FIRED;
    }
}
