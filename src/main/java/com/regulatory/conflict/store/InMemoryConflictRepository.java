package com.regulatory.conflict.store;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictCandidate;
import com.regulatory.conflict.core.model.ConflictKey;
import com.regulatory.conflict.core.model.ConflictStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link ConflictRepository}. The key index is updated with
 * {@link ConcurrentHashMap#compute}, which runs at most one writer per key at a time;
 * each row is replaced with a version check inside {@code compute} on the row map.
 *
 * <p>Only a change in evidence counts as changed provisions. A severity drift alone is
 * written in place and never reopens a terminal conflict.</p>
 */
public class InMemoryConflictRepository implements ConflictRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryConflictRepository.class);

    private final ConcurrentMap<ConflictKey, String> latestByKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Conflict> conflicts = new ConcurrentHashMap<>();

    @Override
    public UpsertResult upsert(ConflictCandidate candidate, Instant at) {
        UpsertResult[] result = new UpsertResult[1];
        latestByKey.compute(candidate.key(), (key, currentId) -> {
            if (currentId == null) {
                Conflict created = candidate.toConflict(at);
                conflicts.put(created.getId(), created);
                result[0] = new UpsertResult(created, UpsertResult.Kind.CREATED);
                return created.getId();
            }
            Conflict current = conflicts.get(currentId);
            if (candidate.matches(current)) {
                result[0] = new UpsertResult(current, UpsertResult.Kind.UNCHANGED);
                return currentId;
            }
            if (candidate.sameEvidence(current)) {
                Conflict refreshed = conflicts.compute(currentId, (id, stored) ->
                        stored.withDetection(candidate.severity(), stored.getEvidence(), at));
                result[0] = new UpsertResult(refreshed, UpsertResult.Kind.UPDATED);
                return currentId;
            }
            if (current.getStatus() == ConflictStatus.RESOLVED) {
                Conflict created = candidate.toConflict(at);
                conflicts.put(created.getId(), created);
                result[0] = new UpsertResult(created, UpsertResult.Kind.CREATED);
                log.debug("Provisions changed after resolution, new conflict {} supersedes {}",
                        created.getId(), currentId);
                return created.getId();
            }
            Conflict refreshed = conflicts.compute(currentId, (id, stored) -> {
                Conflict next = stored.withDetection(candidate.severity(), candidate.evidence(), at);
                if (stored.getStatus() == ConflictStatus.ESCALATED || stored.getStatus() == ConflictStatus.FAILED) {
                    next = next.transitionTo(ConflictStatus.DETECTED, at);
                }
                return next;
            });
            result[0] = new UpsertResult(refreshed, UpsertResult.Kind.UPDATED);
            return currentId;
        });
        return result[0];
    }

    @Override
    public boolean compareAndSet(Conflict expected, Conflict updated) {
        if (!expected.getId().equals(updated.getId())) {
            throw new IllegalArgumentException("compareAndSet must keep the conflict id");
        }
        boolean[] written = new boolean[1];
        conflicts.computeIfPresent(expected.getId(), (id, stored) -> {
            if (stored.getVersion() != expected.getVersion()) {
                return stored;
            }
            written[0] = true;
            return updated;
        });
        if (!written[0]) {
            log.debug("Stale write rejected for conflict {} (expected version {})",
                    expected.getId(), expected.getVersion());
        }
        return written[0];
    }

    @Override
    public Optional<Conflict> findById(String conflictId) {
        return Optional.ofNullable(conflicts.get(conflictId));
    }

    @Override
    public Optional<Conflict> findLatest(ConflictKey key) {
        String id = latestByKey.get(key);
        return id != null ? Optional.ofNullable(conflicts.get(id)) : Optional.empty();
    }

    @Override
    public List<Conflict> findAll() {
        return conflicts.values().stream()
                .sorted(Comparator.comparing(Conflict::getDetectedAt).thenComparing(Conflict::getId))
                .toList();
    }

    @Override
    public List<Conflict> findByStatus(ConflictStatus status) {
        return findAll().stream()
                .filter(c -> c.getStatus() == status)
                .toList();
    }

    @Override
    public List<Conflict> findByProvision(String provisionId) {
        return findAll().stream()
                .filter(c -> c.involves(provisionId))
                .toList();
    }

    @Override
    public int count() {
        return conflicts.size();
    }
}
