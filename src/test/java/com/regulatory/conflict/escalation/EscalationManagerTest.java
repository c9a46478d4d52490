package com.regulatory.conflict.escalation;

import com.regulatory.conflict.audit.AuditAction;
import com.regulatory.conflict.audit.AuditService;
import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.config.SlaPolicy;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictEvidence;
import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.PairKey;
import com.regulatory.conflict.metrics.MetricsService;
import com.regulatory.conflict.store.ConflictNotFoundException;
import com.regulatory.conflict.store.InMemoryEscalationCaseRepository;
import com.regulatory.conflict.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class EscalationManagerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private ScheduledExecutorService scheduler;
    private ExecutorService notificationExecutor;
    private NotificationService notificationService;
    private MetricsService metrics;
    private AuditService auditService;
    private InMemoryEscalationCaseRepository repository;
    private EscalationManager manager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        notificationExecutor = Executors.newCachedThreadPool();
        notificationService = mock(NotificationService.class);
        metrics = mock(MetricsService.class);
        auditService = new AuditService();
        repository = new InMemoryEscalationCaseRepository();
        manager = manager(EngineConfig.builder().clock(clock).build());
    }

    @AfterEach
    void tearDown() {
        manager.close();
        scheduler.shutdownNow();
        notificationExecutor.shutdownNow();
    }

    private EscalationManager manager(EngineConfig config) {
        NotificationDispatcher dispatcher = new NotificationDispatcher(notificationService, notificationExecutor,
                3, Duration.ofMillis(10), Duration.ofSeconds(1), metrics);
        return new EscalationManager(config, repository, scheduler, dispatcher, metrics, auditService);
    }

    private static Conflict conflict(String id, double severity) {
        return Conflict.builder()
                .id(id)
                .pairKey(PairKey.of("A", "B"))
                .type(ConflictType.JURISDICTIONAL)
                .severity(severity)
                .evidence(ConflictEvidence.builder().build())
                .build();
    }

    @Nested
    @DisplayName("Opening cases")
    class Opening {

        @Test
        @DisplayName("Should open at level 1 with the level-1 SLA window")
        void testOpenLevelOne() {
            EscalationCase c = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");

            assertEquals(1, c.getLevel());
            assertEquals(EscalationStatus.OPEN, c.getStatus());
            assertEquals(T0.plus(Duration.ofHours(48)), c.getSlaDeadline());
            assertTrue(manager.hasActiveTimer(c.getId()));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.ESCALATION_OPENED).size());
            verify(notificationService, timeout(2000)).notify(eq("compliance-officer"), any());
        }

        @Test
        @DisplayName("High severity conflicts start at level 2")
        void testOpenHighSeverity() {
            EscalationCase c = manager.open(conflict("c1", 0.85), "STRATEGY_INAPPLICABLE");

            assertEquals(2, c.getLevel());
            assertEquals(T0.plus(Duration.ofHours(24)), c.getSlaDeadline());
            verify(notificationService, timeout(2000)).notify(eq("legal-counsel"), any());
        }

        @Test
        @DisplayName("A conflict has at most one open case")
        void testSingleOpenCase() {
            EscalationCase first = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");
            EscalationCase second = manager.open(conflict("c1", 0.9), "LOW_CONFIDENCE");

            assertEquals(first.getId(), second.getId());
            assertEquals(1, repository.findByConflictId("c1").size());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.ESCALATION_OPENED).size());
        }
    }

    @Nested
    @DisplayName("SLA expiry")
    class Expiry {

        @Test
        @DisplayName("Should move an unacknowledged case up one level per missed deadline")
        void testAdvance() {
            EscalationCase c = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");

            clock.advance(Duration.ofHours(47));
            assertTrue(manager.advanceOverdue().isEmpty());

            clock.advance(Duration.ofHours(1));
            assertEquals(List.of(c), manager.advanceOverdue());
            assertEquals(2, c.getLevel());
            assertEquals(clock.instant().plus(Duration.ofHours(24)), c.getSlaDeadline());

            clock.advance(Duration.ofHours(24));
            manager.advanceOverdue();
            clock.advance(Duration.ofHours(8));
            manager.advanceOverdue();

            assertEquals(List.of(1, 2, 3, 4), c.getLevelHistory());
            assertEquals(clock.instant().plus(Duration.ofHours(8)), c.getSlaDeadline());
            verify(metrics).incrementEscalationAdvanced(2);
            verify(metrics).incrementEscalationAdvanced(4);
            assertEquals(3, auditService.getEntriesByAction(AuditAction.ESCALATION_ADVANCED).size());
        }

        @Test
        @DisplayName("Acknowledging a case stops further escalation")
        void testAcknowledgeCancelsTimer() {
            EscalationCase c = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");

            manager.acknowledge(c.getId(), "officer-1");
            clock.advance(Duration.ofDays(10));

            assertTrue(manager.advanceOverdue().isEmpty());
            assertFalse(manager.hasActiveTimer(c.getId()));
            assertEquals(1, c.getLevel());
            assertEquals("officer-1", c.getAcknowledgedBy());
        }

        @Test
        @DisplayName("The scheduled timer advances the case on its own")
        void testTimerFires() throws Exception {
            SlaPolicy fast = SlaPolicy.of(Map.of(1, Duration.ofMillis(50), 2, Duration.ofHours(1)), Map.of());
            EscalationManager realTime = manager(EngineConfig.builder()
                    .clock(Clock.systemUTC())
                    .slaPolicy(fast)
                    .build());
            try {
                EscalationCase c = realTime.open(conflict("c1", 0.3), "LOW_CONFIDENCE");

                long deadline = System.currentTimeMillis() + 5_000;
                while (c.getLevel() < 2 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(20);
                }
                assertEquals(2, c.getLevel());
                assertTrue(realTime.hasActiveTimer(c.getId()));
            } finally {
                realTime.close();
            }
        }
    }

    @Nested
    @DisplayName("Closing and reopening")
    class Closing {

        @Test
        @DisplayName("Should walk OPEN, ACKNOWLEDGED, IN_REVIEW, CLOSED")
        void testLifecycle() {
            EscalationCase c = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");

            manager.acknowledge(c.getId(), "officer-1");
            manager.startReview(c.getId(), "officer-1");
            manager.close(c.getId(), "officer-1", "handled manually");

            assertTrue(c.isClosed());
            assertEquals("handled manually", c.getClosingNote());
            assertTrue(manager.findOpenCase("c1").isEmpty());
            assertThrows(IllegalStateException.class, () -> manager.close(c.getId(), "officer-1", "again"));
        }

        @Test
        @DisplayName("Review requires an acknowledged case")
        void testReviewNeedsAcknowledgement() {
            EscalationCase c = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");
            assertThrows(IllegalStateException.class, () -> manager.startReview(c.getId(), "officer-1"));
        }

        @Test
        @DisplayName("Reopening links a new case that keeps the reached level")
        void testReopen() {
            EscalationCase c = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");
            clock.advance(Duration.ofHours(48));
            manager.advanceOverdue();
            manager.close(c.getId(), "officer-1", "premature");

            EscalationCase reopened = manager.reopen(c.getId(), "officer-2", "not actually settled");

            assertNotEquals(c.getId(), reopened.getId());
            assertEquals(c.getId(), reopened.getPreviousCaseId());
            assertEquals(2, reopened.getLevel());
            assertTrue(c.isClosed());
            assertEquals(reopened, manager.findOpenCase("c1").orElseThrow());
        }

        @Test
        @DisplayName("A later escalation of the same conflict links to the closed case")
        void testOpenAfterClose() {
            EscalationCase c = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");
            manager.closeForConflict("c1", "resolved automatically");

            EscalationCase next = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");

            assertEquals(c.getId(), next.getPreviousCaseId());
            assertEquals(1, next.getLevel());
        }

        @Test
        @DisplayName("A conflict escalated again after closure starts at the level it had reached")
        void testOpenAfterCloseKeepsLevel() {
            EscalationCase first = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");
            clock.advance(Duration.ofHours(49));
            manager.advanceOverdue();
            assertEquals(2, first.getLevel());
            manager.close(first.getId(), "officer-1", "settled for now");

            EscalationCase second = manager.open(conflict("c1", 0.3), "STRATEGY_INAPPLICABLE");

            assertEquals(first.getId(), second.getPreviousCaseId());
            assertEquals(2, second.getLevel());
            assertEquals(clock.instant().plus(Duration.ofHours(24)), second.getSlaDeadline());
            verify(notificationService, timeout(2000).times(2)).notify(eq("legal-counsel"), any());
        }

        @Test
        @DisplayName("Only closed cases can be reopened")
        void testReopenOpenCase() {
            EscalationCase c = manager.open(conflict("c1", 0.3), "LOW_CONFIDENCE");
            assertThrows(IllegalStateException.class, () -> manager.reopen(c.getId(), "officer-1", "x"));
            assertThrows(ConflictNotFoundException.class, () -> manager.acknowledge("missing", "officer-1"));
        }
    }
}
