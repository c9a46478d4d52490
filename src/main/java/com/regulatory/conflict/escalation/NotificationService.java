package com.regulatory.conflict.escalation;

/**
 * External collaborator that tells a stakeholder about an escalation case.
 * Implementations may block or throw; callers bound and retry each call.
 */
@FunctionalInterface
public interface NotificationService {

    void notify(String stakeholderRef, EscalationCase escalationCase);
}
