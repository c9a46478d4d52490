package com.regulatory.conflict.detection;

import java.util.Objects;

/**
 * Candidate bucket of a provision. A {@code null} jurisdiction is the wildcard bucket of
 * provisions that carry no jurisdiction at all.
 */
public record BucketKey(String topic, String jurisdiction) {

    public static final String WILDCARD = "*";

    public BucketKey {
        Objects.requireNonNull(topic, "topic is required");
    }

    public static BucketKey wildcard(String topic) {
        return new BucketKey(topic, null);
    }

    public boolean isWildcard() {
        return jurisdiction == null;
    }

    @Override
    public String toString() {
        return topic + "|" + (jurisdiction != null ? jurisdiction : WILDCARD);
    }
}
