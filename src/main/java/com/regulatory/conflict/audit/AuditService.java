package com.regulatory.conflict.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records detection, resolution and escalation events in an append-only {@link AuditRepository}.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_ACTOR = "SYSTEM";

    private final AuditRepository repository;
    private final Clock clock;

    public AuditService() {
        this(new InMemoryAuditRepository(), Clock.systemUTC());
    }

    public AuditService(AuditRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.of(action, subjectId,
                actorId != null ? actorId : SYSTEM_ACTOR, details, clock.instant());
        repository.save(entry);
        log.debug("Audit entry recorded: {} for {} by {}", entry.action(), entry.subjectId(), entry.actorId());
        return entry;
    }

    /**
     * Records an action taken by the engine itself.
     */
    public AuditEntry recordSystem(AuditAction action, String subjectId, Map<String, Object> details) {
        return record(action, subjectId, SYSTEM_ACTOR, details);
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    /**
     * Entries about one kind of subject, oldest first.
     */
    public List<AuditEntry> getEntriesBySubject(AuditAction.Subject subject) {
        return repository.findAll().stream()
                .filter(e -> e.subject() == subject)
                .toList();
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public int size() {
        return repository.count();
    }
}
