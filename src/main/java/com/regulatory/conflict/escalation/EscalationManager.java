package com.regulatory.conflict.escalation;

import com.regulatory.conflict.audit.AuditAction;
import com.regulatory.conflict.audit.AuditService;
import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.config.SlaPolicy;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.logging.LogContext;
import com.regulatory.conflict.metrics.MetricsService;
import com.regulatory.conflict.metrics.NoOpMetricsService;
import com.regulatory.conflict.store.ConflictNotFoundException;
import com.regulatory.conflict.store.EscalationCaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Opens, advances and closes escalation cases.
 *
 * <p>Every open case has one SLA timer. When it expires while the case is still
 * {@link EscalationStatus#OPEN}, the case moves one level up with the SLA window of the new
 * level and a fresh timer. Acknowledging or closing a case cancels its timer. Notifications
 * go through the {@link NotificationDispatcher} and never hold up a state change.</p>
 */
public class EscalationManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EscalationManager.class);

    private final EscalationCaseRepository repository;
    private final ScheduledExecutorService scheduler;
    private final NotificationDispatcher dispatcher;
    private final SlaPolicy slaPolicy;
    private final double highSeverityThreshold;
    private final Clock clock;
    private final MetricsService metrics;
    private final AuditService auditService;
    private final ConcurrentMap<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    public EscalationManager(EngineConfig config, EscalationCaseRepository repository,
                             ScheduledExecutorService scheduler, NotificationDispatcher dispatcher,
                             MetricsService metrics, AuditService auditService) {
        Objects.requireNonNull(config, "config is required");
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler is required");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher is required");
        this.slaPolicy = config.getSlaPolicy();
        this.highSeverityThreshold = config.getHighSeverityThreshold();
        this.clock = config.getClock();
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.auditService = auditService != null ? auditService : new AuditService();
    }

    /**
     * Opens a case for the conflict, or returns the case already open for it.
     * The initial level is 2 for conflicts at or above the high-severity threshold, else 1.
     * A conflict escalated again after a closed case never starts below the level that case
     * had reached; the new case links back to it.
     */
    public EscalationCase open(Conflict conflict, String reason) {
        int severityLevel = conflict.getSeverity() >= highSeverityThreshold ? 2 : 1;
        Optional<EscalationCase> lastClosed = repository.findByConflictId(conflict.getId()).stream()
                .filter(EscalationCase::isClosed)
                .reduce((first, second) -> second);
        int level = lastClosed.map(closed -> Math.max(severityLevel, closed.getLevel())).orElse(severityLevel);
        return openCase(conflict.getId(), level, reason, lastClosed.map(EscalationCase::getId).orElse(null));
    }

    /**
     * Opens a new case for the conflict of a closed case. The new case links back to the
     * closed one and starts at the level the closed case had reached.
     */
    public EscalationCase reopen(String caseId, String actorId, String reason) {
        EscalationCase closed = require(caseId);
        if (!closed.isClosed()) {
            throw new IllegalStateException("Only closed cases can be reopened, case " + caseId
                    + " is " + closed.getStatus());
        }
        EscalationCase reopened = openCase(closed.getConflictId(), closed.getLevel(), reason, caseId);
        log.info("escalation.reopened caseId={} previousCaseId={} by={}", reopened.getId(), caseId, actorId);
        return reopened;
    }

    private EscalationCase openCase(String conflictId, int level, String reason, String previousCaseId) {
        Instant now = clock.instant();
        EscalationCaseRepository.OpenResult result = repository.openIfAbsent(conflictId, () ->
                EscalationCase.builder()
                        .conflictId(conflictId)
                        .previousCaseId(previousCaseId)
                        .reason(reason)
                        .openedAt(now)
                        .level(level)
                        .slaDeadline(now.plus(slaPolicy.windowFor(level)))
                        .build());
        EscalationCase escalationCase = result.escalationCase();
        if (!result.created()) {
            log.debug("escalation.already_open caseId={} conflictId={}", escalationCase.getId(), conflictId);
            return escalationCase;
        }
        try (LogContext ctx = LogContext.forEscalation(escalationCase.getId(), conflictId)) {
            scheduleTimer(escalationCase);
            auditService.recordSystem(AuditAction.ESCALATION_OPENED, escalationCase.getId(), Map.of(
                    "conflictId", conflictId,
                    "level", level,
                    "reason", reason != null ? reason : ""));
            log.info("escalation.opened caseId={} conflictId={} level={} deadline={} reason={}",
                    escalationCase.getId(), conflictId, level, escalationCase.getSlaDeadline(), reason);
            notifyStakeholder(escalationCase);
        }
        return escalationCase;
    }

    public EscalationCase acknowledge(String caseId, String actorId) {
        EscalationCase escalationCase = require(caseId);
        escalationCase.markAcknowledged(actorId, clock.instant());
        cancelTimer(caseId);
        auditService.record(AuditAction.ESCALATION_ACKNOWLEDGED, caseId, actorId, Map.of(
                "level", escalationCase.getLevel()));
        log.info("escalation.acknowledged caseId={} by={} level={}", caseId, actorId, escalationCase.getLevel());
        return escalationCase;
    }

    public EscalationCase startReview(String caseId, String actorId) {
        EscalationCase escalationCase = require(caseId);
        escalationCase.markInReview();
        auditService.record(AuditAction.ESCALATION_IN_REVIEW, caseId, actorId, Map.of());
        log.info("escalation.in_review caseId={} by={}", caseId, actorId);
        return escalationCase;
    }

    /**
     * Closes a case from any non-closed state and cancels its timer.
     *
     * @throws IllegalStateException if the case is already closed
     */
    public EscalationCase close(String caseId, String actorId, String note) {
        EscalationCase escalationCase = require(caseId);
        escalationCase.markClosed(actorId, note, clock.instant());
        cancelTimer(caseId);
        repository.release(escalationCase);
        auditService.record(AuditAction.ESCALATION_CLOSED, caseId, actorId, Map.of(
                "conflictId", escalationCase.getConflictId(),
                "note", note != null ? note : ""));
        log.info("escalation.closed caseId={} conflictId={} by={} level={}",
                caseId, escalationCase.getConflictId(), actorId, escalationCase.getLevel());
        return escalationCase;
    }

    /**
     * Closes the open case of a conflict that was since resolved automatically, if any.
     */
    public Optional<EscalationCase> closeForConflict(String conflictId, String note) {
        return repository.findOpenByConflictId(conflictId)
                .map(open -> close(open.getId(), AuditService.SYSTEM_ACTOR, note));
    }

    /**
     * Advances every open case whose deadline has passed on the configured clock.
     *
     * @return the cases that moved up a level
     */
    public List<EscalationCase> advanceOverdue() {
        Instant now = clock.instant();
        List<EscalationCase> advanced = new ArrayList<>();
        for (EscalationCase escalationCase : repository.findNonClosed()) {
            Instant deadline = escalationCase.getSlaDeadline();
            if (escalationCase.isOpen() && !now.isBefore(deadline) && advance(escalationCase, deadline)) {
                advanced.add(escalationCase);
            }
        }
        return advanced;
    }

    public Optional<EscalationCase> findOpenCase(String conflictId) {
        return repository.findOpenByConflictId(conflictId);
    }

    /**
     * Returns whether an SLA timer is pending for the case.
     */
    public boolean hasActiveTimer(String caseId) {
        ScheduledFuture<?> timer = timers.get(caseId);
        return timer != null && !timer.isDone();
    }

    private boolean advance(EscalationCase escalationCase, Instant expectedDeadline) {
        int nextLevel = escalationCase.getLevel() + 1;
        Instant newDeadline = clock.instant().plus(slaPolicy.windowFor(nextLevel));
        if (!escalationCase.advanceLevel(expectedDeadline, newDeadline)) {
            return false;
        }
        try (LogContext ctx = LogContext.forEscalation(escalationCase.getId(), escalationCase.getConflictId())) {
            scheduleTimer(escalationCase);
            metrics.incrementEscalationAdvanced(escalationCase.getLevel());
            auditService.recordSystem(AuditAction.ESCALATION_ADVANCED, escalationCase.getId(), Map.of(
                    "level", escalationCase.getLevel(),
                    "deadline", newDeadline.toString()));
            log.warn("escalation.advanced caseId={} conflictId={} level={} deadline={}",
                    escalationCase.getId(), escalationCase.getConflictId(), escalationCase.getLevel(), newDeadline);
            notifyStakeholder(escalationCase);
        }
        return true;
    }

    private void scheduleTimer(EscalationCase escalationCase) {
        Instant deadline = escalationCase.getSlaDeadline();
        long delayMs = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
        ScheduledFuture<?> timer = scheduler.schedule(
                () -> onSlaExpired(escalationCase.getId(), deadline), delayMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = timers.put(escalationCase.getId(), timer);
        if (previous != null) {
            previous.cancel(false);
        }
        // A close racing with scheduling must not leave a live timer behind.
        if (escalationCase.isClosed()) {
            cancelTimer(escalationCase.getId());
        }
    }

    private void onSlaExpired(String caseId, Instant deadline) {
        repository.findById(caseId).ifPresent(escalationCase -> {
            if (!advance(escalationCase, deadline)) {
                log.debug("escalation.timer_ignored caseId={} status={}", caseId, escalationCase.getStatus());
            }
        });
    }

    private void cancelTimer(String caseId) {
        ScheduledFuture<?> timer = timers.remove(caseId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private void notifyStakeholder(EscalationCase escalationCase) {
        String stakeholder = slaPolicy.stakeholderFor(escalationCase.getLevel());
        dispatcher.dispatch(stakeholder, escalationCase);
    }

    private EscalationCase require(String caseId) {
        return repository.findById(caseId)
                .orElseThrow(() -> new ConflictNotFoundException("Escalation case not found: " + caseId));
    }

    /**
     * Cancels all pending SLA timers. Does not shut down the scheduler.
     */
    @Override
    public void close() {
        timers.values().forEach(timer -> timer.cancel(false));
        timers.clear();
    }
}
