package com.regulatory.conflict.metrics;

import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.FailureReason;
import com.regulatory.conflict.core.model.StrategyKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code conflict.detection.duration} Timer</li>
 *   <li>{@code conflict.detected} Counter (tag: type)</li>
 *   <li>{@code conflict.severity} DistributionSummary</li>
 *   <li>{@code conflict.semantic.pending} Counter</li>
 *   <li>{@code conflict.detection.skipped} Counter (tag: type)</li>
 *   <li>{@code conflict.resolution.applied} Counter (tags: type, strategy)</li>
 *   <li>{@code conflict.resolution.escalated} Counter (tags: type, reason)</li>
 *   <li>{@code conflict.resolution.confidence} DistributionSummary</li>
 *   <li>{@code conflict.escalation.advanced} Counter (tag: level)</li>
 *   <li>{@code conflict.notification.failed} Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer detectionTimer;
    private final DistributionSummary severitySummary;
    private final DistributionSummary confidenceSummary;
    private final Counter semanticPendingCounter;
    private final Counter notificationFailedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.detectionTimer = Timer.builder("conflict.detection.duration")
                .description("Duration of detection passes")
                .register(registry);
        this.severitySummary = DistributionSummary.builder("conflict.severity")
                .description("Distribution of conflict severities")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("conflict.resolution.confidence")
                .description("Distribution of combined strategy confidences")
                .register(registry);
        this.semanticPendingCounter = Counter.builder("conflict.semantic.pending")
                .description("Semantic checks skipped because the scorer was unavailable")
                .register(registry);
        this.notificationFailedCounter = Counter.builder("conflict.notification.failed")
                .description("Notifications that exhausted their retries")
                .register(registry);
    }

    @Override
    public void recordDetectionDuration(Duration duration) {
        detectionTimer.record(duration);
    }

    @Override
    public void incrementConflictDetected(ConflictType type) {
        counter("detected:" + type.name(), "conflict.detected", "Conflicts created by detection",
                "type", type.name()).increment();
    }

    @Override
    public void recordSeverity(double severity) {
        severitySummary.record(severity);
    }

    @Override
    public void incrementSemanticCheckPending() {
        semanticPendingCounter.increment();
    }

    @Override
    public void incrementDataQualitySkip(ConflictType type) {
        counter("skipped:" + type.name(), "conflict.detection.skipped", "Checks skipped for missing data",
                "type", type.name()).increment();
    }

    @Override
    public void incrementResolutionApplied(ConflictType type, StrategyKind strategy) {
        String key = "applied:" + type.name() + ":" + strategy.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("conflict.resolution.applied")
                        .description("Resolutions applied automatically")
                        .tag("type", type.name())
                        .tag("strategy", strategy.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementResolutionEscalated(ConflictType type, FailureReason reason) {
        String key = "escalated:" + type.name() + ":" + reason.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("conflict.resolution.escalated")
                        .description("Conflicts routed to escalation")
                        .tag("type", type.name())
                        .tag("reason", reason.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void incrementEscalationAdvanced(int level) {
        counter("advanced:" + level, "conflict.escalation.advanced", "Escalation level advances on SLA expiry",
                "level", String.valueOf(level)).increment();
    }

    @Override
    public void incrementNotificationFailed() {
        notificationFailedCounter.increment();
    }

    private Counter counter(String key, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
