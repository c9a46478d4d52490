package com.regulatory.conflict.detection;

import com.regulatory.conflict.audit.AuditAction;
import com.regulatory.conflict.audit.AuditService;
import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.PairKey;
import com.regulatory.conflict.metrics.MetricsService;
import com.regulatory.conflict.similarity.SimilarityScore;
import com.regulatory.conflict.similarity.SimilarityScorer;
import com.regulatory.conflict.store.InMemoryConflictRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.regulatory.conflict.support.ProvisionFixtures.permits;
import static com.regulatory.conflict.support.ProvisionFixtures.prohibits;
import static com.regulatory.conflict.support.ProvisionFixtures.requires;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ConflictDetectorTest {

    private ExecutorService executor;
    private InMemoryConflictRepository repository;
    private AuditService auditService;
    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        repository = new InMemoryConflictRepository();
        auditService = new AuditService();
        metrics = mock(MetricsService.class);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ConflictDetector detector(SimilarityScorer scorer) {
        return new ConflictDetector(EngineConfig.defaults(), repository, scorer, ReachEstimator.none(),
                new DefaultBucketingStrategy(), executor, metrics, auditService);
    }

    private static NormativeProvision federal() {
        return prohibits("A").authorityLevel(2).build();
    }

    private static NormativeProvision state() {
        return requires("B").jurisdiction("US/CA").authorityLevel(1).build();
    }

    @Nested
    @DisplayName("Full pass")
    class FullPass {

        @Test
        @DisplayName("Should detect a hierarchical conflict across nested jurisdictions")
        void testHierarchical() {
            DetectionReport report = detector(SimilarityScorer.unavailable()).detect(List.of(federal(), state()));

            assertEquals(1, report.created().size());
            Conflict conflict = report.created().get(0);
            assertEquals(ConflictType.HIERARCHICAL, conflict.getType());
            assertEquals(PairKey.of("A", "B"), conflict.getPairKey());
            assertEquals(Set.of("fw-A", "fw-B"), conflict.getFrameworkIds());
            assertEquals(Set.of("US", "US/CA"), conflict.getJurisdictions());
            assertEquals(1, report.comparedPairs());
            assertTrue(report.isComplete());
            verify(metrics).incrementConflictDetected(ConflictType.HIERARCHICAL);
            assertEquals(1, auditService.getEntriesByAction(AuditAction.CONFLICT_DETECTED).size());
        }

        @Test
        @DisplayName("Should keep the semantic check pending while the scorer is unavailable")
        void testPending() {
            DetectionReport report = detector(SimilarityScorer.unavailable()).detect(List.of(federal(), state()));

            assertEquals(Set.of(PairKey.of("A", "B")), report.semanticPending());
            verify(metrics).incrementSemanticCheckPending();
        }

        @Test
        @DisplayName("Re-running on unchanged input writes nothing")
        void testIdempotent() {
            ConflictDetector detector = detector(SimilarityScorer.unavailable());
            detector.detect(List.of(federal(), state()));
            DetectionReport second = detector.detect(List.of(state(), federal()));

            assertFalse(second.hasChanges());
            assertEquals(1, second.unchanged().size());
            assertEquals(1, repository.count());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.CONFLICT_DETECTED).size());
        }

        @Test
        @DisplayName("Should report checks skipped for missing data")
        void testDataQuality() {
            NormativeProvision noScope = requires("A").jurisdiction(Set.of()).build();
            DetectionReport report = detector(SimilarityScorer.unavailable()).detect(
                    List.of(noScope, prohibits("B").authorityLevel(null).build()),
                    DetectionScope.ofTypes(ConflictType.JURISDICTIONAL, ConflictType.HIERARCHICAL));

            assertTrue(report.created().isEmpty());
            assertEquals(2, report.dataQualityIssues().size());
            assertTrue(report.dataQualityIssues().stream().allMatch(i -> i.pair().equals(PairKey.of("A", "B"))));
            verify(metrics, times(1)).incrementDataQualitySkip(ConflictType.JURISDICTIONAL);
            verify(metrics, times(1)).incrementDataQualitySkip(ConflictType.HIERARCHICAL);
        }

        @Test
        @DisplayName("A permission that is only loosely similar to a requirement is not a conflict")
        void testLowSimilarity() {
            SimilarityScorer scorer = (a, b) -> Optional.of(new SimilarityScore(0.55, 0.9));
            DetectionReport report = detector(scorer).detect(List.of(requires("A").build(), permits("B").build()));

            assertTrue(report.conflicts().isEmpty());
            assertTrue(report.semanticPending().isEmpty());
            assertEquals(0, repository.count());
        }

        @Test
        @DisplayName("Scope restricts provisions and checks")
        void testScope() {
            DetectionScope scope = new DetectionScope(Set.of(), Set.of("EU"), Set.of(), Set.of());
            ConflictDetector detector = detector(SimilarityScorer.unavailable());
            DetectionReport report = detector.detect(List.of(federal(), state()), scope);

            assertEquals(0, report.comparedPairs());
            assertEquals(0, detector.currentIndex().size());

            DetectionReport temporalOnly = detector.detect(List.of(federal(), state()),
                    DetectionScope.ofTypes(ConflictType.TEMPORAL));
            assertEquals(1, temporalOnly.comparedPairs());
            assertTrue(temporalOnly.created().isEmpty());
            assertTrue(temporalOnly.semanticPending().isEmpty());
        }

        @Test
        @DisplayName("Concurrent passes never duplicate a conflict")
        void testConcurrentPasses() throws Exception {
            ConflictDetector detector = detector(SimilarityScorer.unavailable());
            ExecutorService callers = Executors.newFixedThreadPool(4);
            try {
                List<Callable<DetectionReport>> passes = new ArrayList<>();
                for (int i = 0; i < 4; i++) {
                    passes.add(() -> detector.detect(List.of(federal(), state())));
                }
                long created = 0;
                for (Future<DetectionReport> f : callers.invokeAll(passes, 10, TimeUnit.SECONDS)) {
                    created += f.get().created().size();
                }
                assertEquals(1, created);
                assertEquals(1, repository.count());
            } finally {
                callers.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Incremental pass")
    class Incremental {

        @Test
        @DisplayName("Should compare the delta with its bucket mates only")
        void testIncremental() {
            ConflictDetector detector = detector(SimilarityScorer.unavailable());
            NormativeProvision unrelated = requires("C").topicTags("aviation").build();
            DetectionReport initial = detector.detect(List.of(federal(), unrelated));
            assertEquals(0, initial.comparedPairs());

            DetectionReport delta = detector.detectIncremental(List.of(state()));

            assertEquals(1, delta.comparedPairs());
            assertEquals(1, delta.created().size());
            assertEquals(3, detector.currentIndex().size());
        }

        @Test
        @DisplayName("A changed provision refreshes its existing conflict")
        void testChangedProvision() {
            ConflictDetector detector = detector(SimilarityScorer.unavailable());
            Conflict original = detector.detect(List.of(federal(), state())).created().get(0);

            DetectionReport delta = detector.detectIncremental(
                    List.of(prohibits("A").authorityLevel(4).build()));

            assertEquals(1, delta.updated().size());
            assertEquals(original.getId(), delta.updated().get(0).getId());
            assertEquals(3, delta.updated().get(0).getEvidence().authorityGap());
        }
    }
}
