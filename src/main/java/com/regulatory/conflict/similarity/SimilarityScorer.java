package com.regulatory.conflict.similarity;

import com.regulatory.conflict.core.model.NormativeProvision;

import java.util.Optional;

/**
 * External collaborator that compares the meaning of two provisions.
 *
 * <p>Implementations return {@link Optional#empty()} when no score can be produced
 * (service down, model not loaded). Callers must treat an empty result as "unknown",
 * never as "not similar".</p>
 */
@FunctionalInterface
public interface SimilarityScorer {

    /**
     * Scores two provisions. Argument order must not affect the result.
     *
     * @return the score, or empty if the scorer is unavailable
     */
    Optional<SimilarityScore> score(NormativeProvision a, NormativeProvision b);

    /**
     * A scorer that is never available. Semantic checks stay pending with it.
     */
    static SimilarityScorer unavailable() {
        return (a, b) -> Optional.empty();
    }
}
