package com.regulatory.conflict.store;

import com.regulatory.conflict.core.model.ResolutionOutcome;
import com.regulatory.conflict.core.model.ResolutionRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory append-only implementation of {@link ResolutionRecordRepository}.
 */
public class InMemoryResolutionRecordRepository implements ResolutionRecordRepository {

    private final List<ResolutionRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public void append(ResolutionRecord record) {
        if (record.outcome() == ResolutionOutcome.REVERTED
                && findById(record.revertsRecordId()).isEmpty()) {
            throw new ConflictNotFoundException("Reverted record not found: " + record.revertsRecordId());
        }
        records.add(record);
    }

    @Override
    public Optional<ResolutionRecord> findById(String recordId) {
        return records.stream()
                .filter(r -> r.id().equals(recordId))
                .findFirst();
    }

    @Override
    public List<ResolutionRecord> findByConflictId(String conflictId) {
        return records.stream()
                .filter(r -> r.conflictId().equals(conflictId))
                .toList();
    }

    @Override
    public List<ResolutionRecord> findEffective(String conflictId) {
        List<ResolutionRecord> forConflict = findByConflictId(conflictId);
        Set<String> reverted = forConflict.stream()
                .filter(r -> r.outcome() == ResolutionOutcome.REVERTED)
                .map(ResolutionRecord::revertsRecordId)
                .collect(Collectors.toSet());
        return forConflict.stream()
                .filter(r -> r.outcome() == ResolutionOutcome.APPLIED)
                .filter(r -> !reverted.contains(r.id()))
                .toList();
    }

    @Override
    public List<ResolutionRecord> findByTimeRange(Instant from, Instant to) {
        return records.stream()
                .filter(r -> !r.appliedAt().isBefore(from) && r.appliedAt().isBefore(to))
                .toList();
    }

    @Override
    public List<ResolutionRecord> findAll() {
        return new ArrayList<>(records);
    }

    @Override
    public int count() {
        return records.size();
    }
}
