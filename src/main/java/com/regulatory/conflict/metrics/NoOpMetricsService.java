package com.regulatory.conflict.metrics;

import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.FailureReason;
import com.regulatory.conflict.core.model.StrategyKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordDetectionDuration(Duration duration) {
    }

    @Override
    public void incrementConflictDetected(ConflictType type) {
    }

    @Override
    public void recordSeverity(double severity) {
    }

    @Override
    public void incrementSemanticCheckPending() {
    }

    @Override
    public void incrementDataQualitySkip(ConflictType type) {
    }

    @Override
    public void incrementResolutionApplied(ConflictType type, StrategyKind strategy) {
    }

    @Override
    public void incrementResolutionEscalated(ConflictType type, FailureReason reason) {
    }

    @Override
    public void recordConfidence(double confidence) {
    }

    @Override
    public void incrementEscalationAdvanced(int level) {
    }

    @Override
    public void incrementNotificationFailed() {
    }
}
