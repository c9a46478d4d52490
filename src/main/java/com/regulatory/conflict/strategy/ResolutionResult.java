package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.FailureReason;
import com.regulatory.conflict.core.model.ResolutionRecord;
import com.regulatory.conflict.escalation.EscalationCase;

import java.util.Objects;
import java.util.Optional;

/**
 * What one resolution attempt did to a conflict.
 */
public record ResolutionResult(
        Conflict conflict,
        Outcome outcome,
        ResolutionRecord record,
        EscalationCase escalationCase,
        BlendedConfidence confidence,
        FailureReason failureReason
) {

    public enum Outcome {
        /** A strategy was applied and the conflict is resolved. */
        RESOLVED,
        /** The conflict was handed to a human through an escalation case. */
        ESCALATED,
        /** No strategy could be applied; an escalation case was opened as well. */
        FAILED,
        /** The conflict was not in a resolvable state or another resolver held it. */
        SKIPPED
    }

    public ResolutionResult {
        Objects.requireNonNull(conflict, "conflict is required");
        Objects.requireNonNull(outcome, "outcome is required");
    }

    public static ResolutionResult skipped(Conflict conflict) {
        return new ResolutionResult(conflict, Outcome.SKIPPED, null, null, null, null);
    }

    public Optional<ResolutionRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    public Optional<EscalationCase> getEscalationCase() {
        return Optional.ofNullable(escalationCase);
    }

    public boolean isResolved() {
        return outcome == Outcome.RESOLVED;
    }
}
