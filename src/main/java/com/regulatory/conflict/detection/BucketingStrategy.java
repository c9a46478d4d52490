package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.NormativeProvision;

import java.util.Set;

/**
 * Strategy interface for grouping provisions into candidate buckets.
 * Only provisions that share a bucket are compared, which avoids a full pairwise scan.
 *
 * <p>Keys must be coarse enough that two provisions able to conflict always share at least
 * one bucket.</p>
 */
public interface BucketingStrategy {

    /**
     * Generates the bucket keys for a provision.
     *
     * @return set of keys (never null, empty if the provision has no topic)
     */
    Set<BucketKey> bucketKeys(NormativeProvision provision);
}
