package com.regulatory.conflict.store;

import com.regulatory.conflict.escalation.EscalationCase;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Store of {@link EscalationCase}s, holding at most one non-closed case per conflict.
 */
public interface EscalationCaseRepository {

    /**
     * Returns the non-closed case of the conflict, or stores and returns the case built by
     * {@code factory}. Atomic per conflict id.
     */
    OpenResult openIfAbsent(String conflictId, Supplier<EscalationCase> factory);

    /**
     * Forgets the open-case slot of a closed case so the conflict can be escalated again.
     */
    void release(EscalationCase closedCase);

    Optional<EscalationCase> findById(String caseId);

    Optional<EscalationCase> findOpenByConflictId(String conflictId);

    List<EscalationCase> findByConflictId(String conflictId);

    List<EscalationCase> findNonClosed();

    List<EscalationCase> findAll();

    /**
     * @param escalationCase the case now holding the slot
     * @param created        false if an existing open case was returned
     */
    record OpenResult(EscalationCase escalationCase, boolean created) {
    }
}
