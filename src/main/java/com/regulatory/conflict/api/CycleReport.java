package com.regulatory.conflict.api;

import com.regulatory.conflict.detection.DetectionReport;
import com.regulatory.conflict.strategy.ResolutionResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one detection-and-resolution cycle.
 *
 * @param detection   what the detection pass found
 * @param resolutions one result per conflict that was in {@code DETECTED} state when resolution began
 */
public record CycleReport(DetectionReport detection, List<ResolutionResult> resolutions) {

    public CycleReport {
        Objects.requireNonNull(detection, "detection is required");
        resolutions = resolutions != null ? List.copyOf(resolutions) : List.of();
    }

    public long resolvedCount() {
        return count(ResolutionResult.Outcome.RESOLVED);
    }

    public long escalatedCount() {
        return count(ResolutionResult.Outcome.ESCALATED);
    }

    public long failedCount() {
        return count(ResolutionResult.Outcome.FAILED);
    }

    public long skippedCount() {
        return count(ResolutionResult.Outcome.SKIPPED);
    }

    public List<ResolutionResult> withOutcome(ResolutionResult.Outcome outcome) {
        return resolutions.stream().filter(r -> r.outcome() == outcome).toList();
    }

    private long count(ResolutionResult.Outcome outcome) {
        return resolutions.stream().filter(r -> r.outcome() == outcome).count();
    }
}
