package com.regulatory.conflict.strategy;

import com.regulatory.conflict.analytics.AnalyticsSnapshot;
import com.regulatory.conflict.analytics.JurisdictionBuckets;
import com.regulatory.conflict.analytics.ResolutionAnalytics;
import com.regulatory.conflict.analytics.StatKey;
import com.regulatory.conflict.audit.AuditAction;
import com.regulatory.conflict.audit.AuditService;
import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ConflictStatus;
import com.regulatory.conflict.core.model.FailureReason;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.ResolutionOutcome;
import com.regulatory.conflict.core.model.ResolutionRecord;
import com.regulatory.conflict.core.model.StrategyKind;
import com.regulatory.conflict.escalation.EscalationCase;
import com.regulatory.conflict.escalation.EscalationManager;
import com.regulatory.conflict.lock.ConflictLock;
import com.regulatory.conflict.lock.LockAcquisitionException;
import com.regulatory.conflict.logging.LogContext;
import com.regulatory.conflict.metrics.MetricsService;
import com.regulatory.conflict.metrics.NoOpMetricsService;
import com.regulatory.conflict.store.ConcurrentConflictModificationException;
import com.regulatory.conflict.store.ConflictNotFoundException;
import com.regulatory.conflict.store.ConflictRepository;
import com.regulatory.conflict.store.ResolutionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Drives a detected conflict through
 * {@code DETECTED -> STRATEGY_SELECTED -> APPLIED -> RESOLVED | ESCALATED | FAILED}.
 *
 * <p>Only one resolver works on a conflict at a time ({@link ConflictLock}). Every state
 * change is a compare-and-set on the conflict version; a lost race re-reads the conflict and
 * retries up to the configured bound, after which the conflict is escalated. Conflicts that
 * no strategy fits, or whose blended confidence is below the threshold, are always
 * escalated and never auto-applied.</p>
 */
public class ResolutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    private static final Set<ConflictStatus> IN_FLIGHT =
            EnumSet.of(ConflictStatus.DETECTED, ConflictStatus.STRATEGY_SELECTED, ConflictStatus.APPLIED);

    private final EngineConfig config;
    private final ConflictRepository conflicts;
    private final ResolutionRecordRepository records;
    private final ProvisionLookup provisions;
    private final StrategySelector selector;
    private final ConfidenceBlender blender;
    private final ConflictLock lock;
    private final EscalationManager escalationManager;
    private final ResolutionAnalytics analytics;
    private final MetricsService metrics;
    private final AuditService auditService;
    private final Clock clock;

    public ResolutionEngine(EngineConfig config, ConflictRepository conflicts, ResolutionRecordRepository records,
                            ProvisionLookup provisions, ConflictLock lock, EscalationManager escalationManager,
                            ResolutionAnalytics analytics, MetricsService metrics, AuditService auditService) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.conflicts = Objects.requireNonNull(conflicts, "conflicts is required");
        this.records = Objects.requireNonNull(records, "records is required");
        this.provisions = Objects.requireNonNull(provisions, "provisions is required");
        this.lock = Objects.requireNonNull(lock, "lock is required");
        this.escalationManager = Objects.requireNonNull(escalationManager, "escalationManager is required");
        this.analytics = Objects.requireNonNull(analytics, "analytics is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.auditService = auditService != null ? auditService : new AuditService();
        this.selector = new StrategySelector(config);
        this.blender = new ConfidenceBlender(config.getPriorStrength(), config.getMaxPriorWeight());
        this.clock = config.getClock();
    }

    public ResolutionResult resolve(String conflictId, AnalyticsSnapshot snapshot) {
        return resolve(conflictId, snapshot, Set.of());
    }

    /**
     * Resolves one conflict against an analytics snapshot taken by the caller.
     *
     * @param activeContextFlags situational flags used by Contextualization
     * @return {@link ResolutionResult.Outcome#SKIPPED} if the conflict is not {@code DETECTED}
     *         or another resolver holds it
     * @throws ConflictNotFoundException if no conflict has the id
     */
    public ResolutionResult resolve(String conflictId, AnalyticsSnapshot snapshot, Set<String> activeContextFlags) {
        Objects.requireNonNull(conflictId, "conflictId is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
        try {
            return lock.withLock(conflictId, () -> resolveLocked(conflictId, snapshot, activeContextFlags));
        } catch (LockAcquisitionException e) {
            log.info("resolution.busy conflictId={} reason={}", conflictId, e.getMessage());
            return ResolutionResult.skipped(require(conflictId));
        }
    }

    /**
     * Resolves each conflict in turn against the same snapshot, so that outcomes recorded
     * during the run do not change the confidence of later conflicts in it.
     */
    public List<ResolutionResult> resolveAll(Collection<String> conflictIds, AnalyticsSnapshot snapshot) {
        List<ResolutionResult> results = new ArrayList<>(conflictIds.size());
        for (String conflictId : conflictIds) {
            results.add(resolve(conflictId, snapshot));
        }
        return results;
    }

    /**
     * Cancels the effective resolution of a resolved conflict. Appends a {@code REVERTED}
     * record and reopens the conflict as {@code DETECTED} for the next cycle.
     *
     * @throws IllegalStateException if the conflict is not resolved
     */
    public ResolutionRecord revertResolution(String conflictId, String actorId, String reason) {
        Objects.requireNonNull(conflictId, "conflictId is required");
        return lock.withLock(conflictId, () -> {
            Conflict current = require(conflictId);
            if (current.getStatus() != ConflictStatus.RESOLVED) {
                throw new IllegalStateException("Conflict " + conflictId + " is " + current.getStatus()
                        + ", only resolved conflicts can be reverted");
            }
            List<ResolutionRecord> effective = records.findEffective(conflictId);
            if (effective.size() != 1) {
                throw new IllegalStateException("Conflict " + conflictId + " has " + effective.size()
                        + " effective resolution records");
            }
            ResolutionRecord applied = effective.get(0);
            Instant now = clock.instant();
            ResolutionRecord revert = ResolutionRecord.builder()
                    .conflictId(conflictId)
                    .strategy(applied.strategy())
                    .outcome(ResolutionOutcome.REVERTED)
                    .confidence(applied.confidence())
                    .rationale(Rationale.of(applied.strategy(), "manual-revert")
                            .factor("reverts", applied.id())
                            .factor("reason", reason != null ? reason : "")
                            .build())
                    .revertsRecordId(applied.id())
                    .actorId(actorId)
                    .appliedAt(now)
                    .build();
            records.append(revert);
            Conflict reopened = transition(conflictId, EnumSet.of(ConflictStatus.RESOLVED),
                    c -> c.transitionTo(ConflictStatus.DETECTED, now));
            analytics.recordOutcome(reopened, revert);
            auditService.record(AuditAction.RESOLUTION_REVERTED, conflictId, actorId, Map.of(
                    "recordId", applied.id(),
                    "strategy", applied.strategy().name(),
                    "reason", reason != null ? reason : ""));
            auditService.record(AuditAction.CONFLICT_REOPENED, conflictId, actorId, Map.of());
            log.info("resolution.reverted conflictId={} recordId={} strategy={} by={}",
                    conflictId, applied.id(), applied.strategy(), actorId);
            return revert;
        });
    }

    private ResolutionResult resolveLocked(String conflictId, AnalyticsSnapshot snapshot, Set<String> flags) {
        Conflict initial = require(conflictId);
        try (LogContext ctx = LogContext.forResolution(conflictId, initial.getType().name())) {
            if (initial.getStatus() != ConflictStatus.DETECTED) {
                log.debug("resolution.skipped conflictId={} status={}", conflictId, initial.getStatus());
                return ResolutionResult.skipped(initial);
            }
            try {
                return selectAndApply(conflictId, snapshot, flags);
            } catch (ConcurrentConflictModificationException e) {
                log.warn("resolution.contended conflictId={} attempts={}", conflictId, e.getAttempts());
                Conflict escalated = transition(conflictId, IN_FLIGHT,
                        c -> c.withFailure(ConflictStatus.ESCALATED, FailureReason.CONCURRENT_MODIFICATION,
                                clock.instant()));
                return escalate(escalated, FailureReason.CONCURRENT_MODIFICATION, e.getMessage(), null, null);
            }
        }
    }

    private ResolutionResult selectAndApply(String conflictId, AnalyticsSnapshot snapshot, Set<String> flags) {
        int maxAttempts = config.getResolutionMaxRetries() + 1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Conflict current = require(conflictId);
            if (current.getStatus() != ConflictStatus.DETECTED) {
                return ResolutionResult.skipped(current);
            }
            Instant now = clock.instant();
            Optional<ResolutionContext> context = contextFor(current, flags);
            StrategySelection selection = context
                    .map(ctx -> selector.select(current, ctx))
                    .orElseGet(() -> new StrategySelection.Inapplicable(
                            "Provisions of " + current.getPairKey() + " are not in the current snapshot"));

            if (selection instanceof StrategySelection.Inapplicable inapplicable) {
                Conflict failed = current.withFailure(ConflictStatus.FAILED, FailureReason.STRATEGY_INAPPLICABLE, now);
                if (!conflicts.compareAndSet(current, failed)) {
                    continue;
                }
                return escalate(failed, FailureReason.STRATEGY_INAPPLICABLE, inapplicable.reason(), null, null);
            }

            StrategySelection.Selected selected = (StrategySelection.Selected) selection;
            StrategyKind kind = selected.strategy().kind();
            StatKey statKey = new StatKey(current.getType(), JurisdictionBuckets.bucketOf(current), kind);
            BlendedConfidence confidence = blender.blend(selected.rawConfidence(), snapshot.stat(statKey).orElse(null));
            metrics.recordConfidence(confidence.combined());

            if (confidence.combined() < config.getConfidenceThreshold()) {
                Conflict escalated = current.withFailure(ConflictStatus.ESCALATED, FailureReason.LOW_CONFIDENCE, now);
                if (!conflicts.compareAndSet(current, escalated)) {
                    continue;
                }
                return escalate(escalated, FailureReason.LOW_CONFIDENCE, String.format(
                        "%s confidence %.3f below threshold %.3f", kind, confidence.combined(),
                        config.getConfidenceThreshold()), confidence, null);
            }

            Conflict withStrategy = current.withSelectedStrategy(kind, now);
            if (!conflicts.compareAndSet(current, withStrategy)) {
                log.debug("resolution.retry conflictId={} attempt={}", conflictId, attempt);
                continue;
            }
            auditService.recordSystem(AuditAction.STRATEGY_SELECTED, conflictId, Map.of(
                    "strategy", kind.name(),
                    "branch", selected.branch(),
                    "rawConfidence", confidence.raw(),
                    "combinedConfidence", confidence.combined()));
            log.info("strategy.selected conflictId={} strategy={} branch={} raw={} combined={}",
                    conflictId, kind, selected.branch(), String.format("%.3f", confidence.raw()),
                    String.format("%.3f", confidence.combined()));
            return apply(withStrategy, selected.strategy(), context.get(), confidence);
        }
        throw new ConcurrentConflictModificationException(conflictId, maxAttempts);
    }

    private ResolutionResult apply(Conflict conflict, ResolutionStrategy strategy, ResolutionContext context,
                                   BlendedConfidence confidence) {
        String conflictId = conflict.getId();
        Instant now = clock.instant();
        StrategyApplication application;
        try {
            application = strategy.apply(conflict, context);
        } catch (StrategyApplicationException e) {
            ResolutionRecord failedRecord = ResolutionRecord.builder()
                    .conflictId(conflictId)
                    .strategy(strategy.kind())
                    .outcome(ResolutionOutcome.FAILED)
                    .confidence(confidence.combined())
                    .rationale(Rationale.of(strategy.kind(), "application-failed")
                            .factor("error", e.getMessage())
                            .build())
                    .appliedAt(now)
                    .build();
            records.append(failedRecord);
            Conflict failed = transition(conflictId, EnumSet.of(ConflictStatus.STRATEGY_SELECTED),
                    c -> c.withFailure(ConflictStatus.FAILED, FailureReason.STRATEGY_APPLICATION_FAILED, now));
            analytics.recordOutcome(failed, failedRecord);
            auditService.recordSystem(AuditAction.RESOLUTION_FAILED, conflictId, Map.of(
                    "strategy", strategy.kind().name(),
                    "error", e.getMessage()));
            return escalate(failed, FailureReason.STRATEGY_APPLICATION_FAILED, e.getMessage(), confidence, failedRecord);
        }

        Conflict applied = transition(conflictId, EnumSet.of(ConflictStatus.STRATEGY_SELECTED),
                c -> c.transitionTo(ConflictStatus.APPLIED, now));
        ResolutionRecord record = ResolutionRecord.builder()
                .conflictId(conflictId)
                .strategy(strategy.kind())
                .parameters(application.parameters())
                .outcome(ResolutionOutcome.APPLIED)
                .confidence(confidence.combined())
                .rationale(application.rationale())
                .winningProvisionId(application.winningProvisionId())
                .schedule(application.schedule())
                .appliedAt(now)
                .build();
        records.append(record);

        List<ResolutionRecord> effective = records.findEffective(conflictId);
        if (effective.size() != 1) {
            log.error("resolution.ambiguous conflictId={} effectiveRecords={}", conflictId, effective.size());
            Conflict escalated = transition(conflictId, EnumSet.of(ConflictStatus.APPLIED),
                    c -> c.withFailure(ConflictStatus.ESCALATED, FailureReason.STRATEGY_APPLICATION_FAILED, now));
            return escalate(escalated, FailureReason.STRATEGY_APPLICATION_FAILED,
                    effective.size() + " effective resolution records", confidence, record);
        }

        Conflict resolved = transition(conflictId, EnumSet.of(ConflictStatus.APPLIED),
                c -> c.transitionTo(ConflictStatus.RESOLVED, now));
        escalationManager.closeForConflict(conflictId, "Resolved automatically by " + strategy.kind());
        analytics.recordOutcome(resolved, record);
        metrics.incrementResolutionApplied(resolved.getType(), strategy.kind());
        auditService.recordSystem(AuditAction.RESOLUTION_APPLIED, conflictId, Map.of(
                "recordId", record.id(),
                "strategy", strategy.kind().name(),
                "winner", record.winner().orElse("none"),
                "confidence", record.confidence()));
        log.info("resolution.applied conflictId={} recordId={} strategy={} winner={} confidence={}",
                conflictId, record.id(), strategy.kind(), record.winner().orElse("none"),
                String.format("%.3f", record.confidence()));
        return new ResolutionResult(resolved, ResolutionResult.Outcome.RESOLVED, record, null, confidence, null);
    }

    private ResolutionResult escalate(Conflict conflict, FailureReason reason, String detail,
                                      BlendedConfidence confidence, ResolutionRecord record) {
        metrics.incrementResolutionEscalated(conflict.getType(), reason);
        EscalationCase escalationCase = escalationManager.open(conflict, reason + ": " + detail);
        log.warn("resolution.escalated conflictId={} status={} reason={} caseId={} detail={}",
                conflict.getId(), conflict.getStatus(), reason, escalationCase.getId(), detail);
        ResolutionResult.Outcome outcome = conflict.getStatus() == ConflictStatus.FAILED
                ? ResolutionResult.Outcome.FAILED
                : ResolutionResult.Outcome.ESCALATED;
        return new ResolutionResult(conflict, outcome, record, escalationCase, confidence, reason);
    }

    /**
     * Applies {@code change} to a fresh copy of the conflict and writes it with
     * compare-and-set, re-reading on every lost race.
     */
    private Conflict transition(String conflictId, Set<ConflictStatus> expected, UnaryOperator<Conflict> change) {
        int maxAttempts = config.getResolutionMaxRetries() + 1;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Conflict fresh = require(conflictId);
            if (!expected.contains(fresh.getStatus())) {
                throw new IllegalStateException("Conflict " + conflictId + " moved to " + fresh.getStatus()
                        + " while expected in " + expected);
            }
            Conflict next = change.apply(fresh);
            if (conflicts.compareAndSet(fresh, next)) {
                return next;
            }
        }
        throw new ConcurrentConflictModificationException(conflictId, maxAttempts);
    }

    private Optional<ResolutionContext> contextFor(Conflict conflict, Set<String> flags) {
        Optional<NormativeProvision> first = provisions.find(conflict.getPairKey().first());
        Optional<NormativeProvision> second = provisions.find(conflict.getPairKey().second());
        if (first.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResolutionContext(first.get(), second.get(), flags, LocalDate.now(clock)));
    }

    private Conflict require(String conflictId) {
        return conflicts.findById(conflictId)
                .orElseThrow(() -> new ConflictNotFoundException("Conflict not found: " + conflictId));
    }
}
