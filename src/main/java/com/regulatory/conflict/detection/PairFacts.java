package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.Jurisdictions;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.PairKey;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Facts about a provision pair computed once and shared by every check.
 *
 * @param first           the provision whose id sorts first
 * @param second          the other provision
 * @param sharedTopics    topic tags both carry, lower-cased
 * @param jurisdictionIntersection overlap of the two scopes, empty if either has none
 * @param overlapStart    first day both are in force, null if unknown or disjoint
 * @param overlapEnd      last day both are in force, null if open-ended or unknown
 * @param windowsOverlap  whether the validity windows overlap; null when a date is missing
 * @param authorityGap    absolute authority difference, null if either level is missing
 */
public record PairFacts(
        NormativeProvision first,
        NormativeProvision second,
        Set<String> sharedTopics,
        Set<String> jurisdictionIntersection,
        LocalDate overlapStart,
        LocalDate overlapEnd,
        Boolean windowsOverlap,
        Integer authorityGap
) {

    public static PairFacts of(NormativeProvision a, NormativeProvision b) {
        PairKey key = PairKey.of(a.getId(), b.getId());
        NormativeProvision first = key.first().equals(a.getId()) ? a : b;
        NormativeProvision second = first == a ? b : a;

        Set<String> topics = new TreeSet<>();
        Set<String> secondTopics = normalize(second.getTopicTags());
        for (String topic : normalize(first.getTopicTags())) {
            if (secondTopics.contains(topic)) {
                topics.add(topic);
            }
        }

        Set<String> intersection = Jurisdictions.intersect(first.getJurisdiction(), second.getJurisdiction());

        LocalDate start = null;
        LocalDate end = null;
        Boolean overlap = null;
        Optional<LocalDate> firstEffective = first.getEffectiveDate();
        Optional<LocalDate> secondEffective = second.getEffectiveDate();
        if (firstEffective.isPresent() && secondEffective.isPresent()) {
            LocalDate candidateStart = max(firstEffective.get(), secondEffective.get());
            LocalDate candidateEnd = min(first.getExpiryDate().orElse(null), second.getExpiryDate().orElse(null));
            overlap = candidateEnd == null || !candidateStart.isAfter(candidateEnd);
            if (overlap) {
                start = candidateStart;
                end = candidateEnd;
            }
        }

        Integer gap = null;
        if (first.getAuthorityLevel().isPresent() && second.getAuthorityLevel().isPresent()) {
            gap = Math.abs(first.getAuthorityLevel().get() - second.getAuthorityLevel().get());
        }
        return new PairFacts(first, second, Set.copyOf(topics), Set.copyOf(intersection), start, end, overlap, gap);
    }

    public PairKey pairKey() {
        return PairKey.of(first.getId(), second.getId());
    }

    public boolean bothHaveJurisdiction() {
        return first.hasJurisdiction() && second.hasJurisdiction();
    }

    public boolean polarityDiffers() {
        return first.getPolarity() != second.getPolarity();
    }

    public boolean polarityIncompatible() {
        return first.getPolarity().isIncompatibleWith(second.getPolarity());
    }

    public boolean eitherSupersedes() {
        return first.supersedes(second) || second.supersedes(first);
    }

    private static Set<String> normalize(Set<String> tags) {
        Set<String> result = new TreeSet<>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                result.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isBefore(b) ? a : b;
    }
}
