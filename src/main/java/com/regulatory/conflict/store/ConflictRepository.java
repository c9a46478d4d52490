package com.regulatory.conflict.store;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictCandidate;
import com.regulatory.conflict.core.model.ConflictKey;
import com.regulatory.conflict.core.model.ConflictStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Store of {@link Conflict} rows. Writes for one {@link ConflictKey} are serialized so that
 * concurrent detection passes never create two active conflicts for the same pair and type.
 */
public interface ConflictRepository {

    /**
     * Atomically writes a detection candidate:
     * <ul>
     *   <li>no conflict for the key yet: creates one in {@code DETECTED}</li>
     *   <li>stored facts equal the candidate: writes nothing</li>
     *   <li>same evidence, different severity: refreshes the severity in place whatever the
     *       status, without reopening the conflict</li>
     *   <li>active conflict with different evidence: refreshes it; an {@code ESCALATED} or
     *       {@code FAILED} conflict goes back to {@code DETECTED} to be retried</li>
     *   <li>{@code RESOLVED} conflict with different evidence: creates a new conflict instance</li>
     * </ul>
     */
    UpsertResult upsert(ConflictCandidate candidate, Instant at);

    /**
     * Replaces {@code expected} with {@code updated} only if the stored version is still
     * {@code expected.getVersion()}.
     *
     * @return true if the write happened, false if another writer got there first
     */
    boolean compareAndSet(Conflict expected, Conflict updated);

    Optional<Conflict> findById(String conflictId);

    /**
     * Returns the latest conflict for the key, whatever its status.
     */
    Optional<Conflict> findLatest(ConflictKey key);

    List<Conflict> findAll();

    List<Conflict> findByStatus(ConflictStatus status);

    List<Conflict> findByProvision(String provisionId);

    int count();
}
