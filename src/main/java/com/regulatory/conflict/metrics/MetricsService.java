package com.regulatory.conflict.metrics;

import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.FailureReason;
import com.regulatory.conflict.core.model.StrategyKind;

import java.time.Duration;

/**
 * Interface for recording engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without a
 * metrics registry.
 */
public interface MetricsService {

    void recordDetectionDuration(Duration duration);

    void incrementConflictDetected(ConflictType type);

    void recordSeverity(double severity);

    void incrementSemanticCheckPending();

    void incrementDataQualitySkip(ConflictType type);

    void incrementResolutionApplied(ConflictType type, StrategyKind strategy);

    void incrementResolutionEscalated(ConflictType type, FailureReason reason);

    void recordConfidence(double confidence);

    void incrementEscalationAdvanced(int level);

    void incrementNotificationFailed();
}
