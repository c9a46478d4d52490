package com.regulatory.conflict.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A check that fired for a pair during a detection pass, before it is written to the store.
 *
 * @param key          pair and conflict type
 * @param severity     computed severity in [0, 1]
 * @param evidence     facts the check relied on
 * @param frameworkIds frameworks of both provisions
 * @param jurisdictions union of both provisions' jurisdiction tags
 */
public record ConflictCandidate(
        ConflictKey key,
        double severity,
        ConflictEvidence evidence,
        Set<String> frameworkIds,
        Set<String> jurisdictions
) {
    private static final double SEVERITY_EPSILON = 1e-9;

    public ConflictCandidate {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(evidence, "evidence is required");
        frameworkIds = frameworkIds != null ? Set.copyOf(frameworkIds) : Set.of();
        jurisdictions = jurisdictions != null ? Set.copyOf(jurisdictions) : Set.of();
    }

    /**
     * Returns whether the stored conflict already reflects these facts, severity included.
     */
    public boolean matches(Conflict conflict) {
        return sameEvidence(conflict) && Math.abs(conflict.getSeverity() - severity) < SEVERITY_EPSILON;
    }

    /**
     * Returns whether the provisions behind the stored conflict are unchanged. Severity is left
     * out: its urgency and reach terms move with the clock and external estimates, not with the
     * provisions.
     */
    public boolean sameEvidence(Conflict conflict) {
        return conflict.getEvidence().equals(evidence);
    }

    public Conflict toConflict(Instant detectedAt) {
        return Conflict.builder()
                .pairKey(key.pairKey())
                .type(key.type())
                .severity(severity)
                .evidence(evidence)
                .status(ConflictStatus.DETECTED)
                .detectedAt(detectedAt)
                .frameworkIds(frameworkIds)
                .jurisdictions(jurisdictions)
                .build();
    }
}
