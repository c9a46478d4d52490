package com.regulatory.conflict.detection;

import com.regulatory.conflict.audit.AuditAction;
import com.regulatory.conflict.audit.AuditService;
import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictCandidate;
import com.regulatory.conflict.core.model.ConflictEvidence;
import com.regulatory.conflict.core.model.ConflictKey;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.PairKey;
import com.regulatory.conflict.logging.LogContext;
import com.regulatory.conflict.metrics.MetricsService;
import com.regulatory.conflict.metrics.NoOpMetricsService;
import com.regulatory.conflict.similarity.SimilarityScorer;
import com.regulatory.conflict.store.ConflictRepository;
import com.regulatory.conflict.store.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans provisions for temporal, jurisdictional, hierarchical and semantic conflicts.
 *
 * <p>Provisions are grouped into buckets by topic and jurisdiction; buckets are scanned in
 * parallel and each distinct pair is evaluated once per pass. Every fired check is written
 * through {@link ConflictRepository#upsert}, so re-running a pass on unchanged input writes
 * nothing and two concurrent passes never duplicate a conflict.</p>
 */
public class ConflictDetector {
    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    private final EngineConfig config;
    private final ConflictRepository repository;
    private final List<ConflictCheck> checks;
    private final SeverityCalculator severityCalculator;
    private final BucketingStrategy bucketing;
    private final ExecutorService executor;
    private final MetricsService metrics;
    private final AuditService auditService;
    private volatile ProvisionIndex index;

    public ConflictDetector(EngineConfig config, ConflictRepository repository,
                            SimilarityScorer scorer, ExecutorService executor) {
        this(config, repository, scorer, ReachEstimator.none(), new DefaultBucketingStrategy(),
                executor, new NoOpMetricsService(), new AuditService());
    }

    public ConflictDetector(EngineConfig config, ConflictRepository repository, SimilarityScorer scorer,
                            ReachEstimator reachEstimator, BucketingStrategy bucketing,
                            ExecutorService executor, MetricsService metrics, AuditService auditService) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.bucketing = Objects.requireNonNull(bucketing, "bucketing is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.auditService = auditService != null ? auditService : new AuditService();
        this.severityCalculator = new SeverityCalculator(config, reachEstimator);
        this.checks = List.of(
                new TemporalConflictCheck(),
                new JurisdictionalConflictCheck(),
                new HierarchicalConflictCheck(),
                new SemanticConflictCheck(scorer, config.getSimilarityThreshold()));
        this.index = new ProvisionIndex(bucketing);
    }

    public DetectionReport detect(Collection<NormativeProvision> provisions) {
        return detect(provisions, DetectionScope.all());
    }

    /**
     * Runs a full pass over a provision snapshot. The snapshot becomes the index used by
     * later incremental passes.
     */
    public DetectionReport detect(Collection<NormativeProvision> provisions, DetectionScope scope) {
        Objects.requireNonNull(provisions, "provisions is required");
        Objects.requireNonNull(scope, "scope is required");
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forDetection(runId, "full")) {
            ProvisionIndex snapshot = new ProvisionIndex(bucketing);
            for (NormativeProvision provision : provisions) {
                if (scope.includes(provision)) {
                    snapshot.put(provision);
                }
            }
            this.index = snapshot;

            Pass pass = new Pass(runId, scope);
            List<Callable<Void>> scans = new ArrayList<>();
            for (Map.Entry<BucketKey, List<NormativeProvision>> bucket : snapshot.buckets().entrySet()) {
                List<NormativeProvision> members = bucket.getValue();
                if (members.size() < 2) {
                    continue;
                }
                scans.add(() -> {
                    for (int i = 0; i < members.size(); i++) {
                        for (int j = i + 1; j < members.size(); j++) {
                            pass.evaluate(members.get(i), members.get(j));
                        }
                    }
                    return null;
                });
            }
            log.info("detection.started runId={} provisions={} scans={}", runId, snapshot.size(), scans.size());
            return pass.run(scans);
        }
    }

    public DetectionReport detectIncremental(Collection<NormativeProvision> newOrChanged) {
        return detectIncremental(newOrChanged, index);
    }

    /**
     * Adds the delta to {@code existingIndex} and compares each delta provision with its
     * bucket mates only.
     */
    public DetectionReport detectIncremental(Collection<NormativeProvision> newOrChanged, ProvisionIndex existingIndex) {
        Objects.requireNonNull(newOrChanged, "newOrChanged is required");
        Objects.requireNonNull(existingIndex, "existingIndex is required");
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forDetection(runId, "incremental")) {
            newOrChanged.forEach(existingIndex::put);
            this.index = existingIndex;

            Pass pass = new Pass(runId, DetectionScope.all());
            List<Callable<Void>> scans = new ArrayList<>();
            for (NormativeProvision provision : newOrChanged) {
                List<NormativeProvision> candidates = existingIndex.candidatesFor(provision.getId());
                scans.add(() -> {
                    for (NormativeProvision candidate : candidates) {
                        pass.evaluate(provision, candidate);
                    }
                    return null;
                });
            }
            log.info("detection.started runId={} delta={} indexed={}", runId, newOrChanged.size(), existingIndex.size());
            return pass.run(scans);
        }
    }

    /**
     * Returns the provision index of the most recent pass.
     */
    public ProvisionIndex currentIndex() {
        return index;
    }

    /**
     * State of one detection pass, shared by its concurrent scans.
     */
    private final class Pass {
        private final String runId;
        private final DetectionScope scope;
        private final Instant startedAt;
        private final Set<PairKey> seen = ConcurrentHashMap.newKeySet();
        private final Queue<Conflict> created = new ConcurrentLinkedQueue<>();
        private final Queue<Conflict> updated = new ConcurrentLinkedQueue<>();
        private final Queue<Conflict> unchanged = new ConcurrentLinkedQueue<>();
        private final Set<PairKey> pending = ConcurrentHashMap.newKeySet();
        private final Queue<DataQualityIssue> issues = new ConcurrentLinkedQueue<>();
        private final AtomicInteger compared = new AtomicInteger();

        Pass(String runId, DetectionScope scope) {
            this.runId = runId;
            this.scope = scope;
            this.startedAt = config.getClock().instant();
        }

        void evaluate(NormativeProvision a, NormativeProvision b) {
            if (a.getId().equals(b.getId()) || !seen.add(PairKey.of(a.getId(), b.getId()))) {
                return;
            }
            compared.incrementAndGet();
            PairFacts facts = PairFacts.of(a, b);
            for (ConflictCheck check : checks) {
                if (!scope.includes(check.type())) {
                    continue;
                }
                CheckResult result = check.evaluate(facts);
                switch (result.outcome()) {
                    case FIRED -> write(facts, check, result.evidence());
                    case SKIPPED_DATA_QUALITY -> {
                        issues.add(new DataQualityIssue(facts.pairKey(), check.type(), result.reason()));
                        metrics.incrementDataQualitySkip(check.type());
                        log.debug("detection.skipped pair={} check={} reason={}",
                                facts.pairKey(), check.type(), result.reason());
                    }
                    case SKIPPED_PENDING -> {
                        pending.add(facts.pairKey());
                        metrics.incrementSemanticCheckPending();
                        log.info("detection.pending pair={} check={} reason={}",
                                facts.pairKey(), check.type(), result.reason());
                    }
                    case CLEAR -> {
                    }
                }
            }
        }

        private void write(PairFacts facts, ConflictCheck check, ConflictEvidence evidence) {
            Set<String> frameworks = new HashSet<>();
            frameworks.add(facts.first().getFrameworkId());
            frameworks.add(facts.second().getFrameworkId());
            Set<String> jurisdictions = new HashSet<>(facts.first().getJurisdiction());
            jurisdictions.addAll(facts.second().getJurisdiction());

            ConflictCandidate candidate = new ConflictCandidate(
                    new ConflictKey(facts.pairKey(), check.type()),
                    severityCalculator.severity(facts, evidence),
                    evidence, frameworks, jurisdictions);
            UpsertResult result = repository.upsert(candidate, config.getClock().instant());
            Conflict conflict = result.conflict();
            switch (result.kind()) {
                case CREATED -> {
                    created.add(conflict);
                    metrics.incrementConflictDetected(conflict.getType());
                    metrics.recordSeverity(conflict.getSeverity());
                    auditService.recordSystem(AuditAction.CONFLICT_DETECTED, conflict.getId(), Map.of(
                            "pair", conflict.getPairKey().toString(),
                            "type", conflict.getType().name(),
                            "severity", conflict.getSeverity()));
                    log.info("conflict.detected conflictId={} type={} pair={} severity={}",
                            conflict.getId(), conflict.getType(), conflict.getPairKey(),
                            String.format("%.3f", conflict.getSeverity()));
                }
                case UPDATED -> {
                    updated.add(conflict);
                    auditService.recordSystem(AuditAction.CONFLICT_UPDATED, conflict.getId(), Map.of(
                            "severity", conflict.getSeverity(),
                            "status", conflict.getStatus().name()));
                    log.info("conflict.updated conflictId={} type={} status={} severity={}",
                            conflict.getId(), conflict.getType(), conflict.getStatus(),
                            String.format("%.3f", conflict.getSeverity()));
                }
                case UNCHANGED -> unchanged.add(conflict);
            }
        }

        DetectionReport run(List<Callable<Void>> scans) {
            int incomplete = 0;
            try {
                List<Future<Void>> futures = executor.invokeAll(
                        scans, config.getDetectionTimeout().toMillis(), TimeUnit.MILLISECONDS);
                for (Future<Void> future : futures) {
                    try {
                        future.get();
                    } catch (CancellationException e) {
                        incomplete++;
                    } catch (ExecutionException e) {
                        throw new ConflictDetectionException("Bucket scan failed in run " + runId, e.getCause());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConflictDetectionException("Detection interrupted in run " + runId, e);
            }
            if (incomplete > 0) {
                log.warn("detection.incomplete runId={} cancelledScans={} timeout={}",
                        runId, incomplete, config.getDetectionTimeout());
            }
            Duration duration = Duration.between(startedAt, config.getClock().instant());
            metrics.recordDetectionDuration(duration);
            DetectionReport report = new DetectionReport(runId, new ArrayList<>(created), new ArrayList<>(updated),
                    new ArrayList<>(unchanged), pending, new ArrayList<>(issues), compared.get(), incomplete, duration);
            log.info("detection.completed runId={} pairs={} created={} updated={} unchanged={} pending={} skipped={}",
                    runId, report.comparedPairs(), report.created().size(), report.updated().size(),
                    report.unchanged().size(), report.semanticPending().size(), report.dataQualityIssues().size());
            return report;
        }
    }
}
