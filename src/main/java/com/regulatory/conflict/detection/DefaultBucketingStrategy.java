package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.Jurisdictions;
import com.regulatory.conflict.core.model.NormativeProvision;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Default bucketing: one key per topic tag and top-level jurisdiction segment
 * (e.g. {@code data-breach|US} for jurisdiction {@code US/CA}). Provisions without a
 * jurisdiction get the wildcard key {@code topic|*}.
 *
 * <p>Keying on the top-level segment keeps {@code US} and {@code US/CA} in the same bucket,
 * since a parent jurisdiction overlaps all of its children.</p>
 */
public class DefaultBucketingStrategy implements BucketingStrategy {

    @Override
    public Set<BucketKey> bucketKeys(NormativeProvision provision) {
        Set<BucketKey> keys = new LinkedHashSet<>();
        for (String rawTopic : provision.getTopicTags()) {
            if (rawTopic == null || rawTopic.isBlank()) {
                continue;
            }
            String topic = rawTopic.trim().toLowerCase(Locale.ROOT);
            if (!provision.hasJurisdiction()) {
                keys.add(BucketKey.wildcard(topic));
                continue;
            }
            for (String tag : provision.getJurisdiction()) {
                keys.add(new BucketKey(topic, Jurisdictions.topLevel(tag)));
            }
        }
        return keys;
    }
}
