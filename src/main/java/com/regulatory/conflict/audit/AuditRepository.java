package com.regulatory.conflict.audit;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for audit entry persistence.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    /**
     * Gets audit entries for a conflict or escalation case.
     */
    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findByActorId(String actorId);

    /**
     * Gets audit entries within a time range, both ends inclusive.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();
}
