package com.regulatory.conflict.escalation;

/**
 * Status of an escalation case.
 */
public enum EscalationStatus {
    OPEN,
    ACKNOWLEDGED,
    IN_REVIEW,
    CLOSED
}
