package com.regulatory.conflict.similarity;

/**
 * Semantic similarity of two provisions as reported by a scorer.
 *
 * @param similarity how close the two provisions' meaning is, 0.0 to 1.0
 * @param confidence how sure the scorer is about {@code similarity}, 0.0 to 1.0
 */
public record SimilarityScore(double similarity, double confidence) {

    public SimilarityScore {
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be between 0.0 and 1.0, got " + similarity);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
        }
    }
}
