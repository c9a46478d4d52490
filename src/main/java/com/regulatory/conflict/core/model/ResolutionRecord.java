package com.regulatory.conflict.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only record of a strategy applied to one conflict instance.
 * A revert is itself a record with outcome {@link ResolutionOutcome#REVERTED} pointing at the
 * record it cancels through {@code revertsRecordId}.
 */
public record ResolutionRecord(
        String id,
        String conflictId,
        StrategyKind strategy,
        Map<String, String> parameters,
        ResolutionOutcome outcome,
        double confidence,
        Rationale rationale,
        String winningProvisionId,
        List<ScheduleEntry> schedule,
        String revertsRecordId,
        String actorId,
        Instant appliedAt
) {
    public ResolutionRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(conflictId, "conflictId is required");
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(outcome, "outcome is required");
        Objects.requireNonNull(appliedAt, "appliedAt is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
        if (outcome == ResolutionOutcome.REVERTED && revertsRecordId == null) {
            throw new IllegalArgumentException("A reverted record must reference the record it reverts");
        }
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
        schedule = schedule != null ? List.copyOf(schedule) : List.of();
    }

    public Optional<String> winner() {
        return Optional.ofNullable(winningProvisionId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String conflictId;
        private StrategyKind strategy;
        private Map<String, String> parameters;
        private ResolutionOutcome outcome;
        private double confidence;
        private Rationale rationale;
        private String winningProvisionId;
        private List<ScheduleEntry> schedule;
        private String revertsRecordId;
        private String actorId = "SYSTEM";
        private Instant appliedAt = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder conflictId(String conflictId) {
            this.conflictId = conflictId;
            return this;
        }

        public Builder strategy(StrategyKind strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder outcome(ResolutionOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder rationale(Rationale rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder winningProvisionId(String winningProvisionId) {
            this.winningProvisionId = winningProvisionId;
            return this;
        }

        public Builder schedule(List<ScheduleEntry> schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder revertsRecordId(String revertsRecordId) {
            this.revertsRecordId = revertsRecordId;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder appliedAt(Instant appliedAt) {
            this.appliedAt = appliedAt;
            return this;
        }

        public ResolutionRecord build() {
            return new ResolutionRecord(id, conflictId, strategy, parameters, outcome, confidence, rationale,
                    winningProvisionId, schedule, revertsRecordId, actorId, appliedAt);
        }
    }
}
