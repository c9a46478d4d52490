package com.regulatory.conflict.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One line of the audit trail.
 *
 * @param subjectId conflict id or escalation case id, depending on {@link AuditAction#subject()}
 * @param actorId   who acted; {@link AuditService#SYSTEM_ACTOR} for engine-driven changes
 * @param details   action-specific values such as severity, strategy or level
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subjectId,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(actorId, "actorId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    static AuditEntry of(AuditAction action, String subjectId, String actorId,
                         Map<String, Object> details, Instant timestamp) {
        return new AuditEntry(UUID.randomUUID().toString(), action, subjectId, actorId, details, timestamp);
    }

    public AuditAction.Subject subject() {
        return action.subject();
    }

    public boolean isSystemAction() {
        return AuditService.SYSTEM_ACTOR.equals(actorId);
    }

    public Optional<Object> detail(String key) {
        return Optional.ofNullable(details.get(key));
    }
}
