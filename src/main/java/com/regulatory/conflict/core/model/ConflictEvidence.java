package com.regulatory.conflict.core.model;

import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;

/**
 * Facts that made a check fire. Only the fields relevant to the conflict type are populated.
 *
 * @param sharedTopics             topic tags common to both provisions
 * @param jurisdictionIntersection scope tags common to both provisions
 * @param overlapStart             first day of the validity overlap (temporal)
 * @param overlapEnd               last day of the validity overlap, null when open-ended
 * @param authorityGap             absolute difference in authority rank, when both are known
 * @param similarity               semantic similarity reported by the scorer (semantic)
 * @param similarityConfidence     scorer confidence in {@code similarity} (semantic)
 */
public record ConflictEvidence(
        Set<String> sharedTopics,
        Set<String> jurisdictionIntersection,
        LocalDate overlapStart,
        LocalDate overlapEnd,
        Integer authorityGap,
        Double similarity,
        Double similarityConfidence
) {
    public ConflictEvidence {
        sharedTopics = sharedTopics != null ? Set.copyOf(sharedTopics) : Set.of();
        jurisdictionIntersection = jurisdictionIntersection != null ? Set.copyOf(jurisdictionIntersection) : Set.of();
    }

    public Optional<Double> similarityValue() {
        return Optional.ofNullable(similarity);
    }

    public Optional<Double> similarityConfidenceValue() {
        return Optional.ofNullable(similarityConfidence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Set<String> sharedTopics;
        private Set<String> jurisdictionIntersection;
        private LocalDate overlapStart;
        private LocalDate overlapEnd;
        private Integer authorityGap;
        private Double similarity;
        private Double similarityConfidence;

        public Builder sharedTopics(Set<String> sharedTopics) {
            this.sharedTopics = sharedTopics;
            return this;
        }

        public Builder jurisdictionIntersection(Set<String> jurisdictionIntersection) {
            this.jurisdictionIntersection = jurisdictionIntersection;
            return this;
        }

        public Builder overlap(LocalDate start, LocalDate end) {
            this.overlapStart = start;
            this.overlapEnd = end;
            return this;
        }

        public Builder authorityGap(Integer authorityGap) {
            this.authorityGap = authorityGap;
            return this;
        }

        public Builder similarity(double similarity, double confidence) {
            this.similarity = similarity;
            this.similarityConfidence = confidence;
            return this;
        }

        public ConflictEvidence build() {
            return new ConflictEvidence(sharedTopics, jurisdictionIntersection, overlapStart, overlapEnd,
                    authorityGap, similarity, similarityConfidence);
        }
    }
}
