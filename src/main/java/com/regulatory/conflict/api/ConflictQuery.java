package com.regulatory.conflict.api;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictStatus;
import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.Jurisdictions;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Filter over conflicts. Unset criteria match everything.
 *
 * <p>The jurisdiction criterion is hierarchical: {@code US} matches conflicts scoped to
 * {@code US/CA}. The time range applies to the detection time of conflicts, the application
 * time of resolution records and the opening time of escalation cases, bounds inclusive.</p>
 */
public final class ConflictQuery {

    private static final ConflictQuery ALL = builder().build();

    private final Set<ConflictStatus> statuses;
    private final Set<ConflictType> types;
    private final double minSeverity;
    private final double maxSeverity;
    private final String jurisdiction;
    private final String frameworkId;
    private final Instant from;
    private final Instant to;

    private ConflictQuery(Builder builder) {
        this.statuses = builder.statuses.isEmpty() ? Set.of() : EnumSet.copyOf(builder.statuses);
        this.types = builder.types.isEmpty() ? Set.of() : EnumSet.copyOf(builder.types);
        this.minSeverity = builder.minSeverity;
        this.maxSeverity = builder.maxSeverity;
        this.jurisdiction = builder.jurisdiction;
        this.frameworkId = builder.frameworkId;
        this.from = builder.from;
        this.to = builder.to;
    }

    public static ConflictQuery all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(Conflict conflict) {
        if (!statuses.isEmpty() && !statuses.contains(conflict.getStatus())) {
            return false;
        }
        if (!types.isEmpty() && !types.contains(conflict.getType())) {
            return false;
        }
        if (conflict.getSeverity() < minSeverity || conflict.getSeverity() > maxSeverity) {
            return false;
        }
        if (frameworkId != null && !conflict.getFrameworkIds().contains(frameworkId)) {
            return false;
        }
        if (jurisdiction != null && conflict.getJurisdictions().stream()
                .noneMatch(tag -> Jurisdictions.covers(jurisdiction, tag))) {
            return false;
        }
        return inRange(conflict.getDetectedAt());
    }

    boolean inRange(Instant at) {
        if (from != null && at.isBefore(from)) {
            return false;
        }
        return to == null || !at.isAfter(to);
    }

    public Set<ConflictStatus> getStatuses() {
        return statuses;
    }

    public Set<ConflictType> getTypes() {
        return types;
    }

    public double getMinSeverity() {
        return minSeverity;
    }

    public double getMaxSeverity() {
        return maxSeverity;
    }

    public String getJurisdiction() {
        return jurisdiction;
    }

    public String getFrameworkId() {
        return frameworkId;
    }

    @Override
    public String toString() {
        return "ConflictQuery{statuses=" + statuses + ", types=" + types
                + ", severity=[" + minSeverity + ", " + maxSeverity + "]"
                + ", jurisdiction=" + jurisdiction + ", frameworkId=" + frameworkId
                + ", from=" + from + ", to=" + to + '}';
    }

    public static class Builder {
        private final Set<ConflictStatus> statuses = EnumSet.noneOf(ConflictStatus.class);
        private final Set<ConflictType> types = EnumSet.noneOf(ConflictType.class);
        private double minSeverity = 0.0;
        private double maxSeverity = 1.0;
        private String jurisdiction;
        private String frameworkId;
        private Instant from;
        private Instant to;

        public Builder status(ConflictStatus... statuses) {
            this.statuses.addAll(Set.of(statuses));
            return this;
        }

        public Builder type(ConflictType... types) {
            this.types.addAll(Set.of(types));
            return this;
        }

        public Builder severityBetween(double min, double max) {
            if (min < 0.0 || max > 1.0 || min > max) {
                throw new IllegalArgumentException("Invalid severity range [" + min + ", " + max + "]");
            }
            this.minSeverity = min;
            this.maxSeverity = max;
            return this;
        }

        public Builder minSeverity(double min) {
            return severityBetween(min, maxSeverity);
        }

        public Builder jurisdiction(String jurisdiction) {
            this.jurisdiction = jurisdiction;
            return this;
        }

        public Builder frameworkId(String frameworkId) {
            this.frameworkId = frameworkId;
            return this;
        }

        public Builder between(Instant from, Instant to) {
            if (from != null && to != null && from.isAfter(to)) {
                throw new IllegalArgumentException("from must not be after to");
            }
            this.from = from;
            this.to = to;
            return this;
        }

        public ConflictQuery build() {
            return new ConflictQuery(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConflictQuery that)) return false;
        return Double.compare(minSeverity, that.minSeverity) == 0
                && Double.compare(maxSeverity, that.maxSeverity) == 0
                && statuses.equals(that.statuses) && types.equals(that.types)
                && Objects.equals(jurisdiction, that.jurisdiction)
                && Objects.equals(frameworkId, that.frameworkId)
                && Objects.equals(from, that.from) && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(statuses, types, minSeverity, maxSeverity, jurisdiction, frameworkId, from, to);
    }
}
