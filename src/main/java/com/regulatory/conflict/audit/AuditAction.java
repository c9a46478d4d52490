package com.regulatory.conflict.audit;

/**
 * Auditable engine operations, each tied to the kind of subject it touches.
 */
public enum AuditAction {
    CONFLICT_DETECTED(Subject.CONFLICT),
    CONFLICT_UPDATED(Subject.CONFLICT),
    CONFLICT_REOPENED(Subject.CONFLICT),
    STRATEGY_SELECTED(Subject.CONFLICT),
    RESOLUTION_APPLIED(Subject.CONFLICT),
    RESOLUTION_FAILED(Subject.CONFLICT),
    RESOLUTION_REVERTED(Subject.CONFLICT),
    ESCALATION_OPENED(Subject.ESCALATION_CASE),
    ESCALATION_ADVANCED(Subject.ESCALATION_CASE),
    ESCALATION_ACKNOWLEDGED(Subject.ESCALATION_CASE),
    ESCALATION_IN_REVIEW(Subject.ESCALATION_CASE),
    ESCALATION_CLOSED(Subject.ESCALATION_CASE);

    public enum Subject {
        CONFLICT,
        ESCALATION_CASE
    }

    private final Subject subject;

    AuditAction(Subject subject) {
        this.subject = subject;
    }

    public Subject subject() {
        return subject;
    }
}
