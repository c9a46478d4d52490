package com.regulatory.conflict.store;

import com.regulatory.conflict.core.model.ResolutionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of {@link ResolutionRecord}s. Records are never updated or removed.
 */
public interface ResolutionRecordRepository {

    void append(ResolutionRecord record);

    Optional<ResolutionRecord> findById(String recordId);

    List<ResolutionRecord> findByConflictId(String conflictId);

    /**
     * Returns the {@code APPLIED} records of the conflict that no {@code REVERTED} record cancels.
     */
    List<ResolutionRecord> findEffective(String conflictId);

    List<ResolutionRecord> findByTimeRange(Instant from, Instant to);

    List<ResolutionRecord> findAll();

    int count();
}
