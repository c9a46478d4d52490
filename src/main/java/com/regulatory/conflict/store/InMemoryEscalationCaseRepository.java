package com.regulatory.conflict.store;

import com.regulatory.conflict.escalation.EscalationCase;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * In-memory {@link EscalationCaseRepository} backed by concurrent maps.
 */
public class InMemoryEscalationCaseRepository implements EscalationCaseRepository {

    private final ConcurrentMap<String, EscalationCase> cases = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> openCaseByConflict = new ConcurrentHashMap<>();

    @Override
    public OpenResult openIfAbsent(String conflictId, Supplier<EscalationCase> factory) {
        boolean[] created = new boolean[1];
        String caseId = openCaseByConflict.compute(conflictId, (id, existing) -> {
            if (existing != null && !cases.get(existing).isClosed()) {
                return existing;
            }
            EscalationCase fresh = factory.get();
            if (!fresh.getConflictId().equals(conflictId)) {
                throw new IllegalArgumentException("Case belongs to conflict " + fresh.getConflictId()
                        + ", not " + conflictId);
            }
            cases.put(fresh.getId(), fresh);
            created[0] = true;
            return fresh.getId();
        });
        return new OpenResult(cases.get(caseId), created[0]);
    }

    @Override
    public void release(EscalationCase closedCase) {
        if (!closedCase.isClosed()) {
            throw new IllegalStateException("Case " + closedCase.getId() + " is not closed");
        }
        openCaseByConflict.remove(closedCase.getConflictId(), closedCase.getId());
    }

    @Override
    public Optional<EscalationCase> findById(String caseId) {
        return Optional.ofNullable(cases.get(caseId));
    }

    @Override
    public Optional<EscalationCase> findOpenByConflictId(String conflictId) {
        String caseId = openCaseByConflict.get(conflictId);
        if (caseId == null) {
            return Optional.empty();
        }
        return findById(caseId).filter(c -> !c.isClosed());
    }

    @Override
    public List<EscalationCase> findByConflictId(String conflictId) {
        return sorted().stream()
                .filter(c -> c.getConflictId().equals(conflictId))
                .toList();
    }

    @Override
    public List<EscalationCase> findNonClosed() {
        return sorted().stream()
                .filter(c -> !c.isClosed())
                .toList();
    }

    @Override
    public List<EscalationCase> findAll() {
        return sorted();
    }

    private List<EscalationCase> sorted() {
        return cases.values().stream()
                .sorted(Comparator.comparing(EscalationCase::getOpenedAt).thenComparing(EscalationCase::getId))
                .toList();
    }
}
