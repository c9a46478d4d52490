package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.NormativeProvision;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Provisions of the current snapshot, indexed by id and by bucket.
 *
 * <p>Provisions in a wildcard bucket ({@code topic|*}) are members of every bucket of the
 * same topic. Putting a provision whose id is already indexed replaces it.</p>
 */
public class ProvisionIndex {

    private final BucketingStrategy bucketing;
    private final Map<String, NormativeProvision> byId = new HashMap<>();
    private final Map<String, Set<BucketKey>> keysById = new HashMap<>();
    private final Map<BucketKey, Set<String>> idsByBucket = new HashMap<>();

    public ProvisionIndex(BucketingStrategy bucketing) {
        this.bucketing = Objects.requireNonNull(bucketing, "bucketing is required");
    }

    public static ProvisionIndex of(BucketingStrategy bucketing, Collection<NormativeProvision> provisions) {
        ProvisionIndex index = new ProvisionIndex(bucketing);
        provisions.forEach(index::put);
        return index;
    }

    public synchronized void put(NormativeProvision provision) {
        remove(provision.getId());
        Set<BucketKey> keys = bucketing.bucketKeys(provision);
        byId.put(provision.getId(), provision);
        keysById.put(provision.getId(), keys);
        for (BucketKey key : keys) {
            idsByBucket.computeIfAbsent(key, k -> new TreeSet<>()).add(provision.getId());
        }
    }

    public synchronized Optional<NormativeProvision> remove(String provisionId) {
        NormativeProvision removed = byId.remove(provisionId);
        Set<BucketKey> keys = keysById.remove(provisionId);
        if (keys != null) {
            for (BucketKey key : keys) {
                Set<String> ids = idsByBucket.get(key);
                if (ids != null) {
                    ids.remove(provisionId);
                    if (ids.isEmpty()) {
                        idsByBucket.remove(key);
                    }
                }
            }
        }
        return Optional.ofNullable(removed);
    }

    public synchronized Optional<NormativeProvision> get(String provisionId) {
        return Optional.ofNullable(byId.get(provisionId));
    }

    public synchronized List<NormativeProvision> all() {
        return byId.values().stream()
                .sorted(Comparator.comparing(NormativeProvision::getId))
                .toList();
    }

    public synchronized int size() {
        return byId.size();
    }

    public synchronized Set<BucketKey> keysOf(String provisionId) {
        return Set.copyOf(keysById.getOrDefault(provisionId, Set.of()));
    }

    /**
     * Returns every bucket with its members, wildcard provisions folded into the buckets of
     * their topic. Members are sorted by id.
     */
    public synchronized Map<BucketKey, List<NormativeProvision>> buckets() {
        Map<BucketKey, List<NormativeProvision>> result = new LinkedHashMap<>();
        for (BucketKey key : idsByBucket.keySet()) {
            Set<String> members = new TreeSet<>(idsByBucket.get(key));
            if (!key.isWildcard()) {
                members.addAll(idsByBucket.getOrDefault(BucketKey.wildcard(key.topic()), Set.of()));
            }
            result.put(key, resolve(members));
        }
        return result;
    }

    /**
     * Returns the provisions sharing at least one bucket with the given one, excluding itself.
     */
    public synchronized List<NormativeProvision> candidatesFor(String provisionId) {
        Set<String> candidates = new TreeSet<>();
        for (BucketKey key : keysById.getOrDefault(provisionId, Set.of())) {
            if (key.isWildcard()) {
                idsByBucket.forEach((other, ids) -> {
                    if (other.topic().equals(key.topic())) {
                        candidates.addAll(ids);
                    }
                });
            } else {
                candidates.addAll(idsByBucket.getOrDefault(key, Set.of()));
                candidates.addAll(idsByBucket.getOrDefault(BucketKey.wildcard(key.topic()), Set.of()));
            }
        }
        candidates.remove(provisionId);
        return resolve(candidates);
    }

    private List<NormativeProvision> resolve(Collection<String> ids) {
        List<NormativeProvision> provisions = new ArrayList<>(ids.size());
        for (String id : ids) {
            NormativeProvision p = byId.get(id);
            if (p != null) {
                provisions.add(p);
            }
        }
        return provisions;
    }
}
