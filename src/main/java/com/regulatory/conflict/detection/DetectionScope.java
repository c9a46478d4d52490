package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.ConflictType;
import com.regulatory.conflict.core.model.Jurisdictions;
import com.regulatory.conflict.core.model.NormativeProvision;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Optional restriction of a detection pass. Empty sets mean "no restriction".
 *
 * @param frameworkIds  only provisions of these frameworks
 * @param jurisdictions only provisions whose scope touches one of these tags
 * @param topics        only provisions carrying one of these topics
 * @param types         only these checks
 */
public record DetectionScope(
        Set<String> frameworkIds,
        Set<String> jurisdictions,
        Set<String> topics,
        Set<ConflictType> types
) {
    private static final DetectionScope ALL = new DetectionScope(Set.of(), Set.of(), Set.of(), Set.of());

    public DetectionScope {
        frameworkIds = frameworkIds != null ? Set.copyOf(frameworkIds) : Set.of();
        jurisdictions = jurisdictions != null ? Set.copyOf(jurisdictions) : Set.of();
        topics = topics != null
                ? topics.stream().map(t -> t.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet())
                : Set.of();
        types = types != null && !types.isEmpty() ? Set.copyOf(EnumSet.copyOf(types)) : Set.of();
    }

    public static DetectionScope all() {
        return ALL;
    }

    public static DetectionScope ofTypes(ConflictType... types) {
        return new DetectionScope(Set.of(), Set.of(), Set.of(), Set.of(types));
    }

    public boolean includes(ConflictType type) {
        return types.isEmpty() || types.contains(type);
    }

    public boolean includes(NormativeProvision provision) {
        if (!frameworkIds.isEmpty() && !frameworkIds.contains(provision.getFrameworkId())) {
            return false;
        }
        if (!topics.isEmpty() && provision.getTopicTags().stream()
                .noneMatch(t -> topics.contains(t.toLowerCase(Locale.ROOT)))) {
            return false;
        }
        if (!jurisdictions.isEmpty() && provision.hasJurisdiction()
                && Jurisdictions.intersect(jurisdictions, provision.getJurisdiction()).isEmpty()) {
            return false;
        }
        return true;
    }
}
