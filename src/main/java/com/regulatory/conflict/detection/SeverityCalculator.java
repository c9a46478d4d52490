package com.regulatory.conflict.detection;

import com.regulatory.conflict.config.EngineConfig;
import com.regulatory.conflict.config.SeverityWeights;
import com.regulatory.conflict.core.model.ConflictEvidence;
import com.regulatory.conflict.core.model.NormativeProvision;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Severity = weighted sum of authority gap, jurisdictional reach and urgency, each
 * normalized to [0, 1]:
 * <ul>
 *   <li>gap: {@code min(1, authorityGap / authorityScale)}, 0 when unknown</li>
 *   <li>reach: from the {@link ReachEstimator}, clamped</li>
 *   <li>urgency: 1 once the conflict is in force, decaying linearly to 0 at the horizon</li>
 * </ul>
 * Days are counted on the configured clock so repeated runs on the same day agree.
 */
public class SeverityCalculator {

    private final SeverityWeights weights;
    private final int authorityScale;
    private final int horizonDays;
    private final ReachEstimator reachEstimator;
    private final EngineConfig config;

    public SeverityCalculator(EngineConfig config, ReachEstimator reachEstimator) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.reachEstimator = Objects.requireNonNull(reachEstimator, "reachEstimator is required");
        this.weights = config.getSeverityWeights();
        this.authorityScale = config.getAuthorityScale();
        this.horizonDays = config.getUrgencyHorizonDays();
    }

    public double severity(PairFacts facts, ConflictEvidence evidence) {
        double gap = evidence.authorityGap() != null
                ? Math.min(1.0, evidence.authorityGap() / (double) authorityScale)
                : 0.0;
        double reach = clamp(reachEstimator.estimate(facts.first(), facts.second(),
                evidence.jurisdictionIntersection()));
        double urgency = urgency(facts);
        return clamp(weights.authorityGap() * gap + weights.reach() * reach + weights.urgency() * urgency);
    }

    double urgency(PairFacts facts) {
        LocalDate manifestsOn = facts.overlapStart() != null
                ? facts.overlapStart()
                : latestEffectiveDate(facts.first(), facts.second());
        if (manifestsOn == null) {
            return 1.0;
        }
        long days = ChronoUnit.DAYS.between(LocalDate.now(config.getClock()), manifestsOn);
        if (days <= 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - days / (double) horizonDays);
    }

    private static LocalDate latestEffectiveDate(NormativeProvision a, NormativeProvision b) {
        Optional<LocalDate> da = a.getEffectiveDate();
        Optional<LocalDate> db = b.getEffectiveDate();
        if (da.isPresent() && db.isPresent()) {
            return da.get().isAfter(db.get()) ? da.get() : db.get();
        }
        return da.or(() -> db).orElse(null);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
