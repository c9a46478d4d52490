package com.regulatory.conflict.analysis;

import com.regulatory.conflict.core.model.Conflict;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Undirected graph of provisions with one edge per active conflict, weighted by severity.
 * Resolved conflicts are left out. Built once from a conflict list and read-only afterwards.
 */
public final class ConflictGraph {

    private final Map<String, List<Conflict>> edgesByProvision;
    private final List<Conflict> edges;

    private ConflictGraph(Map<String, List<Conflict>> edgesByProvision, List<Conflict> edges) {
        this.edgesByProvision = edgesByProvision;
        this.edges = edges;
    }

    public static ConflictGraph of(Collection<Conflict> conflicts) {
        Map<String, List<Conflict>> byProvision = new HashMap<>();
        List<Conflict> active = new ArrayList<>();
        for (Conflict conflict : conflicts) {
            if (!conflict.getStatus().isActive()) {
                continue;
            }
            active.add(conflict);
            byProvision.computeIfAbsent(conflict.getPairKey().first(), k -> new ArrayList<>()).add(conflict);
            byProvision.computeIfAbsent(conflict.getPairKey().second(), k -> new ArrayList<>()).add(conflict);
        }
        return new ConflictGraph(byProvision, List.copyOf(active));
    }

    public Set<String> provisions() {
        return Set.copyOf(edgesByProvision.keySet());
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Number of active conflicts the provision takes part in, 0 if it has none.
     */
    public int conflictCount(String provisionId) {
        List<Conflict> incident = edgesByProvision.get(provisionId);
        return incident != null ? incident.size() : 0;
    }

    /**
     * Provisions ordered by descending conflict count, ties broken by id.
     */
    public Map<String, Integer> mostEntangled(int limit) {
        Map<String, Integer> ranked = new LinkedHashMap<>();
        edgesByProvision.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, List<Conflict>>>comparingInt(e -> e.getValue().size())
                        .reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(limit)
                .forEach(e -> ranked.put(e.getKey(), e.getValue().size()));
        return ranked;
    }

    /**
     * Connected components, highest priority first.
     */
    public List<ConflictCluster> clusters() {
        Set<String> visited = new HashSet<>();
        List<ConflictCluster> clusters = new ArrayList<>();
        for (String start : new TreeSet<>(edgesByProvision.keySet())) {
            if (visited.contains(start)) {
                continue;
            }
            Set<String> members = new HashSet<>();
            Set<Conflict> clusterEdges = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            visited.add(start);
            while (!queue.isEmpty()) {
                String provisionId = queue.poll();
                members.add(provisionId);
                for (Conflict conflict : edgesByProvision.get(provisionId)) {
                    clusterEdges.add(conflict);
                    String neighbour = conflict.getPairKey().other(provisionId);
                    if (visited.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
            double priority = clusterEdges.stream().mapToDouble(Conflict::getSeverity).sum();
            List<String> conflictIds = clusterEdges.stream().map(Conflict::getId).sorted().toList();
            clusters.add(new ConflictCluster(members, conflictIds, priority));
        }
        clusters.sort(Comparator.comparingDouble(ConflictCluster::priority).reversed()
                .thenComparing(c -> c.conflictIds().get(0)));
        return clusters;
    }
}
