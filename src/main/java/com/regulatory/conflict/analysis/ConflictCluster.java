package com.regulatory.conflict.analysis;

import java.util.List;
import java.util.Set;

/**
 * A connected group of provisions linked by active conflicts.
 *
 * @param provisionIds ids of the provisions in the cluster
 * @param conflictIds  ids of the active conflicts between them
 * @param priority     sum of the conflict severities; larger clusters of severe conflicts come first
 */
public record ConflictCluster(Set<String> provisionIds, List<String> conflictIds, double priority) {

    public ConflictCluster {
        provisionIds = provisionIds != null ? Set.copyOf(provisionIds) : Set.of();
        conflictIds = conflictIds != null ? List.copyOf(conflictIds) : List.of();
    }

    public int size() {
        return provisionIds.size();
    }

    public boolean contains(String provisionId) {
        return provisionIds.contains(provisionId);
    }
}
