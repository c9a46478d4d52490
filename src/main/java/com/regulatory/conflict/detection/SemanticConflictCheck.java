package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.similarity.SimilarityScore;
import com.regulatory.conflict.similarity.SimilarityScorer;

import java.util.Objects;
import java.util.Optional;

/**
 * Fires when the scorer finds two provisions of different polarity close in meaning.
 * An unavailable scorer leaves the pair pending instead of clearing it.
 */
public class SemanticConflictCheck implements ConflictCheck {

    private final SimilarityScorer scorer;
    private final double threshold;

    public SemanticConflictCheck(SimilarityScorer scorer, double threshold) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
    }

    @Override
    public ConflictType type() {
        return ConflictType.SEMANTIC;
    }

    @Override
    public CheckResult evaluate(PairFacts facts) {
        if (facts.sharedTopics().isEmpty() || !facts.polarityDiffers()) {
            return CheckResult.clear();
        }
        if (facts.bothHaveJurisdiction() && facts.jurisdictionIntersection().isEmpty()) {
            return CheckResult.clear();
        }
        Optional<SimilarityScore> score = scorer.score(facts.first(), facts.second());
        if (score.isEmpty()) {
            return CheckResult.pending("similarity scorer unavailable");
        }
        if (score.get().similarity() < threshold) {
            return CheckResult.clear();
        }
        return CheckResult.fired(baseEvidence(facts)
                .similarity(score.get().similarity(), score.get().confidence())
                .build());
    }
}
