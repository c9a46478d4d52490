package com.regulatory.conflict.escalation;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A conflict that could not be resolved automatically and awaits human handling.
 *
 * <p>The level only ever increases. Once closed a case stays closed; reopening a conflict
 * creates a new case that links back through {@code previousCaseId}.</p>
 */
public class EscalationCase {

    private final String id;
    private final String conflictId;
    private final String previousCaseId;
    private final String reason;
    private final Instant openedAt;
    private final List<Integer> levelHistory = new CopyOnWriteArrayList<>();
    private volatile int level;
    private volatile Instant slaDeadline;
    private volatile EscalationStatus status;
    private volatile Instant acknowledgedAt;
    private volatile String acknowledgedBy;
    private volatile Instant closedAt;
    private volatile String closedBy;
    private volatile String closingNote;

    private EscalationCase(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.conflictId = Objects.requireNonNull(builder.conflictId, "conflictId is required");
        this.openedAt = Objects.requireNonNull(builder.openedAt, "openedAt is required");
        this.slaDeadline = Objects.requireNonNull(builder.slaDeadline, "slaDeadline is required");
        if (builder.level < 1) {
            throw new IllegalArgumentException("level must be >= 1");
        }
        this.level = builder.level;
        this.previousCaseId = builder.previousCaseId;
        this.reason = builder.reason;
        this.status = EscalationStatus.OPEN;
        this.levelHistory.add(builder.level);
    }

    public String getId() {
        return id;
    }

    public String getConflictId() {
        return conflictId;
    }

    public String getPreviousCaseId() {
        return previousCaseId;
    }

    public String getReason() {
        return reason;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Returns every level this case has held, in order.
     */
    public List<Integer> getLevelHistory() {
        return List.copyOf(levelHistory);
    }

    public Instant getSlaDeadline() {
        return slaDeadline;
    }

    public EscalationStatus getStatus() {
        return status;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public Instant getClosedAt() {
        return closedAt;
    }

    public String getClosedBy() {
        return closedBy;
    }

    public String getClosingNote() {
        return closingNote;
    }

    public boolean isClosed() {
        return status == EscalationStatus.CLOSED;
    }

    public boolean isOpen() {
        return status == EscalationStatus.OPEN;
    }

    /**
     * Moves an open case one level up if its deadline is still {@code expectedDeadline}.
     * Returns false when the case was acknowledged, closed or already advanced meanwhile.
     */
    synchronized boolean advanceLevel(Instant expectedDeadline, Instant newDeadline) {
        if (status != EscalationStatus.OPEN || !slaDeadline.equals(expectedDeadline)) {
            return false;
        }
        this.level = level + 1;
        this.slaDeadline = newDeadline;
        this.levelHistory.add(level);
        return true;
    }

    synchronized void markAcknowledged(String actorId, Instant at) {
        requireStatus(EscalationStatus.OPEN);
        this.status = EscalationStatus.ACKNOWLEDGED;
        this.acknowledgedBy = actorId;
        this.acknowledgedAt = at;
    }

    synchronized void markInReview() {
        requireStatus(EscalationStatus.ACKNOWLEDGED);
        this.status = EscalationStatus.IN_REVIEW;
    }

    synchronized void markClosed(String actorId, String note, Instant at) {
        if (status == EscalationStatus.CLOSED) {
            throw new IllegalStateException("Escalation case is already closed: " + id);
        }
        this.status = EscalationStatus.CLOSED;
        this.closedBy = actorId;
        this.closingNote = note;
        this.closedAt = at;
    }

    private void requireStatus(EscalationStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Escalation case " + id + " is " + status + ", expected " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EscalationCase that = (EscalationCase) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "EscalationCase{" +
                "id='" + id + '\'' +
                ", conflictId='" + conflictId + '\'' +
                ", level=" + level +
                ", status=" + status +
                ", slaDeadline=" + slaDeadline +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String conflictId;
        private String previousCaseId;
        private String reason;
        private Instant openedAt;
        private Instant slaDeadline;
        private int level = 1;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder conflictId(String conflictId) {
            this.conflictId = conflictId;
            return this;
        }

        public Builder previousCaseId(String previousCaseId) {
            this.previousCaseId = previousCaseId;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder openedAt(Instant openedAt) {
            this.openedAt = openedAt;
            return this;
        }

        public Builder slaDeadline(Instant slaDeadline) {
            this.slaDeadline = slaDeadline;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public EscalationCase build() {
            return new EscalationCase(this);
        }
    }
}
