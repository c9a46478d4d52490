package com.regulatory.conflict.store;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictCandidate;
import com.regulatory.conflict.core.model.ConflictEvidence;
import com.regulatory.conflict.core.model.ConflictKey;
import com.regulatory.conflict.core.model.ConflictStatus;
import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.FailureReason;
import com.regulatory.conflict.core.model.PairKey;
import com.regulatory.conflict.core.model.StrategyKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConflictRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);

    private InMemoryConflictRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConflictRepository();
    }

    private static ConflictCandidate candidate(String a, String b, double severity, int gap) {
        return new ConflictCandidate(
                new ConflictKey(PairKey.of(a, b), ConflictType.HIERARCHICAL),
                severity,
                ConflictEvidence.builder().sharedTopics(Set.of("data-breach")).authorityGap(gap).build(),
                Set.of("fw-" + a, "fw-" + b),
                Set.of("US"));
    }

    private Conflict resolve(Conflict conflict) {
        Conflict resolved = conflict.withSelectedStrategy(StrategyKind.LEX_SUPERIOR, T0)
                .transitionTo(ConflictStatus.APPLIED, T0)
                .transitionTo(ConflictStatus.RESOLVED, T0);
        assertTrue(repository.compareAndSet(conflict, resolved));
        return resolved;
    }

    @Nested
    @DisplayName("Upsert")
    class Upsert {

        @Test
        @DisplayName("Should create a DETECTED conflict for a new key")
        void testCreate() {
            UpsertResult result = repository.upsert(candidate("A", "B", 0.5, 1), T0);

            assertEquals(UpsertResult.Kind.CREATED, result.kind());
            assertEquals(ConflictStatus.DETECTED, result.conflict().getStatus());
            assertEquals(T0, result.conflict().getDetectedAt());
            assertEquals(1, repository.count());
        }

        @Test
        @DisplayName("Should write nothing when the facts are unchanged")
        void testUnchanged() {
            Conflict created = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
            UpsertResult again = repository.upsert(candidate("A", "B", 0.5, 1), T1);

            assertEquals(UpsertResult.Kind.UNCHANGED, again.kind());
            assertFalse(again.isChanged());
            assertEquals(created.getVersion(), again.conflict().getVersion());
        }

        @Test
        @DisplayName("Should treat (A, B) and (B, A) as the same conflict")
        void testSymmetry() {
            repository.upsert(candidate("A", "B", 0.5, 1), T0);
            UpsertResult reversed = repository.upsert(candidate("B", "A", 0.5, 1), T1);

            assertEquals(UpsertResult.Kind.UNCHANGED, reversed.kind());
            assertEquals(1, repository.count());
        }

        @Test
        @DisplayName("Should refresh an active conflict with new facts")
        void testUpdate() {
            Conflict created = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
            UpsertResult updated = repository.upsert(candidate("A", "B", 0.7, 2), T1);

            assertEquals(UpsertResult.Kind.UPDATED, updated.kind());
            assertEquals(created.getId(), updated.conflict().getId());
            assertEquals(0.7, updated.conflict().getSeverity());
            assertEquals(T0, updated.conflict().getDetectedAt());
            assertEquals(T1, updated.conflict().getLastUpdatedAt());
        }

        @Test
        @DisplayName("Should send an escalated conflict back to DETECTED when facts change")
        void testEscalatedRetried() {
            Conflict created = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
            Conflict escalated = created.withFailure(ConflictStatus.ESCALATED, FailureReason.LOW_CONFIDENCE, T0);
            assertTrue(repository.compareAndSet(created, escalated));

            UpsertResult updated = repository.upsert(candidate("A", "B", 0.9, 3), T1);
            assertEquals(ConflictStatus.DETECTED, updated.conflict().getStatus());
        }

        @Test
        @DisplayName("Should open a new instance when a resolved pair changes")
        void testNewInstanceAfterResolution() {
            Conflict created = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
            resolve(created);

            UpsertResult same = repository.upsert(candidate("A", "B", 0.5, 1), T1);
            assertEquals(UpsertResult.Kind.UNCHANGED, same.kind());

            UpsertResult changed = repository.upsert(candidate("A", "B", 0.8, 2), T1);
            assertEquals(UpsertResult.Kind.CREATED, changed.kind());
            assertNotEquals(created.getId(), changed.conflict().getId());
            assertEquals(2, repository.count());
            assertEquals(changed.conflict().getId(),
                    repository.findLatest(changed.conflict().getKey()).orElseThrow().getId());
        }

        @Test
        @DisplayName("Should refresh severity in place on a resolved conflict with the same evidence")
        void testSeverityDriftOnResolved() {
            Conflict created = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
            resolve(created);

            UpsertResult drifted = repository.upsert(candidate("A", "B", 0.55, 1), T1);

            assertEquals(UpsertResult.Kind.UPDATED, drifted.kind());
            assertEquals(created.getId(), drifted.conflict().getId());
            assertEquals(ConflictStatus.RESOLVED, drifted.conflict().getStatus());
            assertEquals(0.55, drifted.conflict().getSeverity());
            assertEquals(1, repository.count());
        }

        @Test
        @DisplayName("Should keep an escalated conflict escalated when only severity moves")
        void testSeverityDriftOnEscalated() {
            Conflict created = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
            Conflict escalated = created.withFailure(ConflictStatus.ESCALATED, FailureReason.LOW_CONFIDENCE, T0);
            assertTrue(repository.compareAndSet(created, escalated));

            UpsertResult drifted = repository.upsert(candidate("A", "B", 0.6, 1), T1);

            assertEquals(ConflictStatus.ESCALATED, drifted.conflict().getStatus());
            assertEquals(0.6, drifted.conflict().getSeverity());
        }

        @Test
        @DisplayName("Concurrent upserts of one key create a single conflict")
        void testConcurrentUpsert() throws Exception {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<UpsertResult>> futures = new ArrayList<>();
            try {
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        return repository.upsert(candidate("A", "B", 0.5, 1), T0);
                    }));
                }
                start.countDown();
                long created = 0;
                for (Future<UpsertResult> f : futures) {
                    if (f.get(5, TimeUnit.SECONDS).kind() == UpsertResult.Kind.CREATED) {
                        created++;
                    }
                }
                assertEquals(1, created);
                assertEquals(1, repository.count());
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Compare and set")
    class CompareAndSet {

        @Test
        @DisplayName("Should reject a write from a stale copy")
        void testStaleWrite() {
            Conflict created = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
            Conflict selected = created.withSelectedStrategy(StrategyKind.LEX_SUPERIOR, T1);
            assertTrue(repository.compareAndSet(created, selected));

            Conflict failed = created.withFailure(ConflictStatus.FAILED, FailureReason.STRATEGY_INAPPLICABLE, T1);
            assertFalse(repository.compareAndSet(created, failed));
            assertEquals(ConflictStatus.STRATEGY_SELECTED,
                    repository.findById(created.getId()).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("Should refuse to change the conflict id")
        void testIdMustMatch() {
            Conflict a = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
            Conflict other = a.toBuilder().id("other").build();
            assertThrows(IllegalArgumentException.class, () -> repository.compareAndSet(a, other));
        }
    }

    @Test
    @DisplayName("Should find conflicts by status and provision")
    void testFinders() {
        Conflict ab = repository.upsert(candidate("A", "B", 0.5, 1), T0).conflict();
        repository.upsert(candidate("B", "C", 0.5, 1), T1);
        resolve(ab);

        assertEquals(1, repository.findByStatus(ConflictStatus.RESOLVED).size());
        assertEquals(1, repository.findByStatus(ConflictStatus.DETECTED).size());
        assertEquals(2, repository.findByProvision("B").size());
        assertEquals(1, repository.findByProvision("C").size());
        assertTrue(repository.findById("missing").isEmpty());
    }
}
