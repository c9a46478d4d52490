package com.regulatory.conflict.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A detected contradiction between two provisions.
 *
 * <p>Instances are immutable; every state change produces a copy with an incremented
 * {@code version}. Stores use the version for compare-and-set, so a writer holding a
 * stale copy cannot overwrite a newer one.</p>
 */
public final class Conflict {

    private final String id;
    private final PairKey pairKey;
    private final ConflictType type;
    private final double severity;
    private final ConflictEvidence evidence;
    private final ConflictStatus status;
    private final Instant detectedAt;
    private final Instant lastUpdatedAt;
    private final long version;
    private final Set<String> frameworkIds;
    private final Set<String> jurisdictions;
    private final StrategyKind selectedStrategy;
    private final FailureReason failureReason;

    private Conflict(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.pairKey = Objects.requireNonNull(builder.pairKey, "pairKey is required");
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.evidence = Objects.requireNonNull(builder.evidence, "evidence is required");
        this.status = builder.status != null ? builder.status : ConflictStatus.DETECTED;
        this.detectedAt = builder.detectedAt != null ? builder.detectedAt : Instant.now();
        this.lastUpdatedAt = builder.lastUpdatedAt != null ? builder.lastUpdatedAt : this.detectedAt;
        this.version = builder.version;
        this.frameworkIds = builder.frameworkIds != null ? Set.copyOf(builder.frameworkIds) : Set.of();
        this.jurisdictions = builder.jurisdictions != null ? Set.copyOf(builder.jurisdictions) : Set.of();
        this.selectedStrategy = builder.selectedStrategy;
        this.failureReason = builder.failureReason;
        if (builder.severity < 0.0 || builder.severity > 1.0) {
            throw new IllegalArgumentException("severity must be between 0.0 and 1.0, got " + builder.severity);
        }
        this.severity = builder.severity;
    }

    public String getId() {
        return id;
    }

    public PairKey getPairKey() {
        return pairKey;
    }

    public ConflictKey getKey() {
        return new ConflictKey(pairKey, type);
    }

    public ConflictType getType() {
        return type;
    }

    public double getSeverity() {
        return severity;
    }

    public ConflictEvidence getEvidence() {
        return evidence;
    }

    public ConflictStatus getStatus() {
        return status;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    public long getVersion() {
        return version;
    }

    public Set<String> getFrameworkIds() {
        return frameworkIds;
    }

    public Set<String> getJurisdictions() {
        return jurisdictions;
    }

    public Optional<StrategyKind> getSelectedStrategy() {
        return Optional.ofNullable(selectedStrategy);
    }

    public Optional<FailureReason> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    public boolean involves(String provisionId) {
        return pairKey.contains(provisionId);
    }

    /**
     * Returns a copy moved to {@code target}. Enforces the lifecycle transitions of
     * {@link ConflictStatus}.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Conflict transitionTo(ConflictStatus target, Instant at) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Conflict " + id + " cannot move from " + status + " to " + target);
        }
        Builder next = toBuilder().status(target).lastUpdatedAt(at).version(version + 1);
        if (target == ConflictStatus.DETECTED || target == ConflictStatus.RESOLVED) {
            next.failureReason(null);
        }
        if (target == ConflictStatus.DETECTED) {
            next.selectedStrategy(null);
        }
        return next.build();
    }

    public Conflict withSelectedStrategy(StrategyKind strategy, Instant at) {
        return transitionTo(ConflictStatus.STRATEGY_SELECTED, at).toBuilder()
                .selectedStrategy(strategy)
                .build();
    }

    public Conflict withFailure(ConflictStatus target, FailureReason reason, Instant at) {
        return transitionTo(target, at).toBuilder()
                .failureReason(reason)
                .build();
    }

    /**
     * Returns a copy carrying refreshed detection facts, keeping identity and status.
     */
    public Conflict withDetection(double severity, ConflictEvidence evidence, Instant at) {
        return toBuilder()
                .severity(severity)
                .evidence(evidence)
                .lastUpdatedAt(at)
                .version(version + 1)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Conflict that = (Conflict) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Conflict{" +
                "id='" + id + '\'' +
                ", pair=" + pairKey +
                ", type=" + type +
                ", severity=" + severity +
                ", status=" + status +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .pairKey(pairKey)
                .type(type)
                .severity(severity)
                .evidence(evidence)
                .status(status)
                .detectedAt(detectedAt)
                .lastUpdatedAt(lastUpdatedAt)
                .version(version)
                .frameworkIds(frameworkIds)
                .jurisdictions(jurisdictions)
                .selectedStrategy(selectedStrategy)
                .failureReason(failureReason);
    }

    public static class Builder {
        private String id;
        private PairKey pairKey;
        private ConflictType type;
        private double severity;
        private ConflictEvidence evidence;
        private ConflictStatus status;
        private Instant detectedAt;
        private Instant lastUpdatedAt;
        private long version;
        private Set<String> frameworkIds;
        private Set<String> jurisdictions;
        private StrategyKind selectedStrategy;
        private FailureReason failureReason;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder pairKey(PairKey pairKey) {
            this.pairKey = pairKey;
            return this;
        }

        public Builder type(ConflictType type) {
            this.type = type;
            return this;
        }

        public Builder severity(double severity) {
            this.severity = severity;
            return this;
        }

        public Builder evidence(ConflictEvidence evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder status(ConflictStatus status) {
            this.status = status;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder lastUpdatedAt(Instant lastUpdatedAt) {
            this.lastUpdatedAt = lastUpdatedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder frameworkIds(Set<String> frameworkIds) {
            this.frameworkIds = frameworkIds;
            return this;
        }

        public Builder jurisdictions(Set<String> jurisdictions) {
            this.jurisdictions = jurisdictions;
            return this;
        }

        public Builder selectedStrategy(StrategyKind selectedStrategy) {
            this.selectedStrategy = selectedStrategy;
            return this;
        }

        public Builder failureReason(FailureReason failureReason) {
            this.failureReason = failureReason;
            return this;
        }

        public Conflict build() {
            return new Conflict(this);
        }
    }
}
