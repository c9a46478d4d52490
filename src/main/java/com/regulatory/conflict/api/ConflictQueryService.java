package com.regulatory.conflict.api;

import com.regulatory.conflict.analysis.ConflictCluster;
import com.regulatory.conflict.analysis.ConflictGraph;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.ResolutionRecord;
import com.regulatory.conflict.escalation.EscalationCase;
import com.regulatory.conflict.escalation.EscalationStatus;
import com.regulatory.conflict.store.ConflictRepository;
import com.regulatory.conflict.store.EscalationCaseRepository;
import com.regulatory.conflict.store.ResolutionRecordRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only, paginated access to conflicts, resolution records and escalation cases.
 *
 * <p>Each call reads the repositories once; every conflict it returns is in a state some
 * writer committed, never a half-applied one.</p>
 */
public class ConflictQueryService {

    private final ConflictRepository conflicts;
    private final ResolutionRecordRepository records;
    private final EscalationCaseRepository cases;

    public ConflictQueryService(ConflictRepository conflicts, ResolutionRecordRepository records,
                                EscalationCaseRepository cases) {
        this.conflicts = Objects.requireNonNull(conflicts, "conflicts is required");
        this.records = Objects.requireNonNull(records, "records is required");
        this.cases = Objects.requireNonNull(cases, "cases is required");
    }

    public Optional<Conflict> findConflict(String conflictId) {
        return conflicts.findById(conflictId);
    }

    public Page<Conflict> findConflicts(ConflictQuery query, PageRequest page) {
        List<Conflict> matching = conflicts.findAll().stream()
                .filter(query::matches)
                .sorted(order(Comparator.comparing(Conflict::getDetectedAt).thenComparing(Conflict::getId), page))
                .toList();
        return Page.slice(matching, page);
    }

    /**
     * Resolution records whose conflict matches {@code query} and whose application time is in
     * the query's time range.
     */
    public Page<ResolutionRecord> findRecords(ConflictQuery query, PageRequest page) {
        ConflictQuery conflictFilter = withoutTimeRange(query);
        Map<String, Conflict> byId = conflicts.findAll().stream()
                .filter(conflictFilter::matches)
                .collect(Collectors.toMap(Conflict::getId, Function.identity()));
        List<ResolutionRecord> matching = records.findAll().stream()
                .filter(record -> byId.containsKey(record.conflictId()))
                .filter(record -> query.inRange(record.appliedAt()))
                .sorted(order(Comparator.comparing(ResolutionRecord::appliedAt).thenComparing(ResolutionRecord::id), page))
                .toList();
        return Page.slice(matching, page);
    }

    public List<ResolutionRecord> findRecordsForConflict(String conflictId) {
        return records.findByConflictId(conflictId);
    }

    /**
     * Escalation cases in the given statuses (all statuses when empty) whose conflict matches
     * {@code query} and whose opening time is in the query's time range.
     */
    public Page<EscalationCase> findEscalationCases(ConflictQuery query, Set<EscalationStatus> statuses,
                                                    PageRequest page) {
        ConflictQuery conflictFilter = withoutTimeRange(query);
        Set<String> conflictIds = conflicts.findAll().stream()
                .filter(conflictFilter::matches)
                .map(Conflict::getId)
                .collect(Collectors.toSet());
        List<EscalationCase> matching = cases.findAll().stream()
                .filter(c -> statuses.isEmpty() || statuses.contains(c.getStatus()))
                .filter(c -> conflictIds.contains(c.getConflictId()))
                .filter(c -> query.inRange(c.getOpenedAt()))
                .sorted(order(Comparator.comparing(EscalationCase::getOpenedAt).thenComparing(EscalationCase::getId), page))
                .toList();
        return Page.slice(matching, page);
    }

    public List<EscalationCase> findEscalationHistory(String conflictId) {
        return cases.findByConflictId(conflictId);
    }

    public ConflictGraph conflictGraph(ConflictQuery query) {
        return ConflictGraph.of(conflicts.findAll().stream().filter(query::matches).toList());
    }

    /**
     * Clusters of entangled provisions, highest priority first.
     */
    public List<ConflictCluster> priorityClusters(ConflictQuery query) {
        return conflictGraph(query).clusters();
    }

    private static <T> Comparator<T> order(Comparator<T> ascending, PageRequest page) {
        return page.direction() == PageRequest.SortDirection.NEWEST_FIRST ? ascending.reversed() : ascending;
    }

    private static ConflictQuery withoutTimeRange(ConflictQuery query) {
        ConflictQuery.Builder builder = ConflictQuery.builder()
                .severityBetween(query.getMinSeverity(), query.getMaxSeverity())
                .jurisdiction(query.getJurisdiction())
                .frameworkId(query.getFrameworkId());
        query.getStatuses().forEach(builder::status);
        query.getTypes().forEach(builder::type);
        return builder.build();
    }
}
