package com.regulatory.conflict.api;

import com.regulatory.conflict.analytics.AnalyticsSnapshot;
import com.regulatory.conflict.analytics.ResolutionAnalytics;
import com.regulatory.conflict.audit.AuditRepository;
import com.regulatory.conflict.audit.AuditService;
import com.regulatory.conflict.audit.InMemoryAuditRepository;
import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictStatus;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.ResolutionRecord;
import com.regulatory.conflict.detection.BucketingStrategy;
import com.regulatory.conflict.detection.ConflictDetector;
import com.regulatory.conflict.detection.DefaultBucketingStrategy;
import com.regulatory.conflict.detection.DetectionReport;
import com.regulatory.conflict.detection.DetectionScope;
import com.regulatory.conflict.detection.ProvisionIndex;
import com.regulatory.conflict.detection.ReachEstimator;
import com.regulatory.conflict.escalation.EscalationCase;
import com.regulatory.conflict.escalation.EscalationManager;
import com.regulatory.conflict.escalation.NoOpNotificationService;
import com.regulatory.conflict.escalation.NotificationDispatcher;
import com.regulatory.conflict.escalation.NotificationService;
import com.regulatory.conflict.lock.ConflictLock;
import com.regulatory.conflict.lock.LocalConflictLock;
import com.regulatory.conflict.logging.LogContext;
import com.regulatory.conflict.metrics.MetricsService;
import com.regulatory.conflict.metrics.MicrometerMetricsService;
import com.regulatory.conflict.metrics.NoOpMetricsService;
import com.regulatory.conflict.similarity.CachingSimilarityScorer;
import com.regulatory.conflict.similarity.SimilarityScorer;
import com.regulatory.conflict.similarity.TimeBoundedSimilarityScorer;
import com.regulatory.conflict.store.ConflictRepository;
import com.regulatory.conflict.store.EscalationCaseRepository;
import com.regulatory.conflict.store.InMemoryConflictRepository;
import com.regulatory.conflict.store.InMemoryEscalationCaseRepository;
import com.regulatory.conflict.store.InMemoryResolutionRecordRepository;
import com.regulatory.conflict.store.ResolutionRecordRepository;
import com.regulatory.conflict.strategy.ResolutionEngine;
import com.regulatory.conflict.strategy.ResolutionResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine. Wires detection, resolution, escalation and analytics over
 * shared repositories and runs detection cycles.
 *
 * <pre>{@code
 * try (ConflictEngine engine = ConflictEngine.builder()
 *         .config(EngineConfigLoader.load(path))
 *         .similarityScorer(scorer)
 *         .build()) {
 *     CycleReport report = engine.runCycle(provisions);
 * }
 * }</pre>
 *
 * <p>The engine owns its thread pools and shuts them down on {@link #close()}. Repositories,
 * lock, scorer and notification service may be supplied by the caller; in-memory defaults are
 * used otherwise.</p>
 */
public class ConflictEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConflictEngine.class);

    private final EngineConfig config;
    private final ConflictRepository conflictRepository;
    private final ResolutionRecordRepository recordRepository;
    private final EscalationCaseRepository caseRepository;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final ResolutionAnalytics analytics;
    private final ConflictDetector detector;
    private final ResolutionEngine resolutionEngine;
    private final EscalationManager escalationManager;
    private final ConflictQueryService queryService;
    private final CachingSimilarityScorer similarityCache;

    private final ExecutorService detectionExecutor;
    private final ExecutorService similarityExecutor;
    private final ExecutorService notificationExecutor;
    private final ScheduledExecutorService slaScheduler;

    private ConflictEngine(Builder builder) {
        this.config = builder.config;
        this.conflictRepository = builder.conflictRepository != null
                ? builder.conflictRepository : new InMemoryConflictRepository();
        this.recordRepository = builder.recordRepository != null
                ? builder.recordRepository : new InMemoryResolutionRecordRepository();
        this.caseRepository = builder.caseRepository != null
                ? builder.caseRepository : new InMemoryEscalationCaseRepository();
        AuditRepository auditRepository = builder.auditRepository != null
                ? builder.auditRepository : new InMemoryAuditRepository();
        this.auditService = new AuditService(auditRepository, config.getClock());
        if (builder.metricsService != null) {
            this.metrics = builder.metricsService;
        } else if (builder.meterRegistry != null) {
            this.metrics = new MicrometerMetricsService(builder.meterRegistry);
        } else {
            this.metrics = new NoOpMetricsService();
        }

        this.detectionExecutor = Executors.newFixedThreadPool(
                config.getDetectionParallelism(), daemonThreads("conflict-detection"));
        this.similarityExecutor = Executors.newFixedThreadPool(
                config.getDetectionParallelism(), daemonThreads("conflict-similarity"));
        this.notificationExecutor = Executors.newCachedThreadPool(daemonThreads("conflict-notification"));
        this.slaScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("conflict-sla"));

        SimilarityScorer bounded = new TimeBoundedSimilarityScorer(
                builder.similarityScorer, similarityExecutor, config.getSimilarityTimeout());
        this.similarityCache = new CachingSimilarityScorer(
                bounded, config.getSimilarityCacheSize(), config.getSimilarityCacheTtl());

        this.analytics = new ResolutionAnalytics(config.getClock());
        this.detector = new ConflictDetector(config, conflictRepository, similarityCache,
                builder.reachEstimator, builder.bucketing, detectionExecutor, metrics, auditService);

        NotificationDispatcher dispatcher = new NotificationDispatcher(builder.notificationService,
                notificationExecutor, config.getNotificationMaxAttempts(), config.getNotificationRetryDelay(),
                config.getNotificationTimeout(), metrics);
        this.escalationManager = new EscalationManager(config, caseRepository, slaScheduler, dispatcher,
                metrics, auditService);

        ConflictLock lock = builder.conflictLock != null ? builder.conflictLock : new LocalConflictLock();
        this.resolutionEngine = new ResolutionEngine(config, conflictRepository, recordRepository,
                id -> detector.currentIndex().get(id), lock, escalationManager, analytics, metrics, auditService);
        this.queryService = new ConflictQueryService(conflictRepository, recordRepository, caseRepository);

        log.info("engine.started parallelism={} confidenceThreshold={} similarityThreshold={}",
                config.getDetectionParallelism(), config.getConfidenceThreshold(), config.getSimilarityThreshold());
    }

    public static Builder builder() {
        return new Builder();
    }

    public CycleReport runCycle(Collection<NormativeProvision> provisions) {
        return runCycle(provisions, DetectionScope.all(), Set.of());
    }

    /**
     * Runs a full detection pass over the snapshot, then resolves every conflict left in
     * {@code DETECTED} state whose provisions are part of the snapshot. All resolutions of the
     * cycle read the same analytics snapshot.
     */
    public CycleReport runCycle(Collection<NormativeProvision> provisions, DetectionScope scope,
                                Set<String> activeContextFlags) {
        DetectionReport detection = detector.detect(provisions, scope);
        return resolveDetected(detection, activeContextFlags);
    }

    /**
     * Adds the delta to the index of the last pass, compares it with its bucket mates and
     * resolves what is left in {@code DETECTED} state.
     */
    public CycleReport runIncrementalCycle(Collection<NormativeProvision> newOrChanged) {
        DetectionReport detection = detector.detectIncremental(newOrChanged);
        return resolveDetected(detection, Set.of());
    }

    private CycleReport resolveDetected(DetectionReport detection, Set<String> activeContextFlags) {
        try (LogContext ctx = LogContext.forDetection(detection.runId(), "resolve")) {
            ProvisionIndex index = detector.currentIndex();
            AnalyticsSnapshot snapshot = analytics.snapshot();
            List<String> pending = conflictRepository.findByStatus(ConflictStatus.DETECTED).stream()
                    .filter(c -> index.get(c.getPairKey().first()).isPresent()
                            && index.get(c.getPairKey().second()).isPresent())
                    .map(Conflict::getId)
                    .toList();
            List<ResolutionResult> results = pending.stream()
                    .map(id -> resolutionEngine.resolve(id, snapshot, activeContextFlags))
                    .toList();
            CycleReport report = new CycleReport(detection, results);
            log.info("cycle.completed runId={} detected={} resolved={} escalated={} failed={} skipped={} snapshotVersion={}",
                    detection.runId(), detection.created().size(), report.resolvedCount(),
                    report.escalatedCount(), report.failedCount(), report.skippedCount(), snapshot.version());
            return report;
        }
    }

    public ResolutionResult resolve(String conflictId) {
        return resolutionEngine.resolve(conflictId, analytics.snapshot());
    }

    public ResolutionRecord revertResolution(String conflictId, String actorId, String reason) {
        return resolutionEngine.revertResolution(conflictId, actorId, reason);
    }

    public EscalationCase acknowledgeEscalation(String caseId, String actorId) {
        return escalationManager.acknowledge(caseId, actorId);
    }

    public EscalationCase startReview(String caseId, String actorId) {
        return escalationManager.startReview(caseId, actorId);
    }

    public EscalationCase closeEscalation(String caseId, String actorId, String note) {
        return escalationManager.close(caseId, actorId, note);
    }

    public EscalationCase reopenEscalation(String caseId, String actorId, String reason) {
        return escalationManager.reopen(caseId, actorId, reason);
    }

    public List<EscalationCase> advanceOverdueEscalations() {
        return escalationManager.advanceOverdue();
    }

    /**
     * Drops cached similarity scores of a provision whose text changed outside a detection pass.
     */
    public void invalidateSimilarity(String provisionId) {
        similarityCache.invalidate(provisionId);
    }

    public ConflictQueryService queries() {
        return queryService;
    }

    public AnalyticsSnapshot analyticsSnapshot() {
        return analytics.snapshot();
    }

    /**
     * Waits until every analytics update queued so far is visible in {@link #analyticsSnapshot()}.
     */
    public boolean awaitAnalytics(Duration timeout) {
        return analytics.awaitQuiescence(timeout);
    }

    public AuditService auditService() {
        return auditService;
    }

    public EngineConfig config() {
        return config;
    }

    @Override
    public void close() {
        escalationManager.close();
        analytics.close();
        shutdown(detectionExecutor);
        shutdown(similarityExecutor);
        shutdown(notificationExecutor);
        shutdown(slaScheduler);
        log.info("engine.stopped");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private SimilarityScorer similarityScorer = SimilarityScorer.unavailable();
        private ReachEstimator reachEstimator = ReachEstimator.none();
        private BucketingStrategy bucketing = new DefaultBucketingStrategy();
        private NotificationService notificationService = new NoOpNotificationService();
        private ConflictLock conflictLock;
        private ConflictRepository conflictRepository;
        private ResolutionRecordRepository recordRepository;
        private EscalationCaseRepository caseRepository;
        private AuditRepository auditRepository;
        private MetricsService metricsService;
        private MeterRegistry meterRegistry;

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets the scorer used by the semantic check. Calls are bounded by the configured
         * similarity timeout and cached per pair. Defaults to a scorer that is always unavailable.
         */
        public Builder similarityScorer(SimilarityScorer similarityScorer) {
            this.similarityScorer = similarityScorer;
            return this;
        }

        public Builder reachEstimator(ReachEstimator reachEstimator) {
            this.reachEstimator = reachEstimator;
            return this;
        }

        public Builder bucketing(BucketingStrategy bucketing) {
            this.bucketing = bucketing;
            return this;
        }

        public Builder notificationService(NotificationService notificationService) {
            this.notificationService = notificationService;
            return this;
        }

        /**
         * Sets the per-conflict lock. Defaults to {@link LocalConflictLock}.
         */
        public Builder conflictLock(ConflictLock conflictLock) {
            this.conflictLock = conflictLock;
            return this;
        }

        public Builder conflictRepository(ConflictRepository conflictRepository) {
            this.conflictRepository = conflictRepository;
            return this;
        }

        public Builder recordRepository(ResolutionRecordRepository recordRepository) {
            this.recordRepository = recordRepository;
            return this;
        }

        public Builder caseRepository(EscalationCaseRepository caseRepository) {
            this.caseRepository = caseRepository;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        /**
         * Sets a custom metrics service. Takes precedence over {@link #meterRegistry}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Records metrics into the given Micrometer registry.
         */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public ConflictEngine build() {
            if (config == null) {
                throw new IllegalStateException("EngineConfig is required");
            }
            if (similarityScorer == null || reachEstimator == null || bucketing == null
                    || notificationService == null) {
                throw new IllegalStateException("similarityScorer, reachEstimator, bucketing and "
                        + "notificationService must not be null");
            }
            return new ConflictEngine(this);
        }
    }
}
