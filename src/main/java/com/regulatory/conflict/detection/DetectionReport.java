package com.regulatory.conflict.detection;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.PairKey;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one detection pass.
 *
 * @param runId             id shared by all log lines of the pass
 * @param created           conflicts the pass created
 * @param updated           active conflicts whose facts changed
 * @param unchanged         conflicts already stored with the same facts
 * @param semanticPending   pairs whose semantic check must be retried
 * @param dataQualityIssues checks skipped for missing provision data
 * @param comparedPairs     number of distinct pairs evaluated
 * @param incompleteScans   bucket scans cancelled by the detection timeout
 * @param duration          wall time of the pass
 */
public record DetectionReport(
        String runId,
        List<Conflict> created,
        List<Conflict> updated,
        List<Conflict> unchanged,
        Set<PairKey> semanticPending,
        List<DataQualityIssue> dataQualityIssues,
        int comparedPairs,
        int incompleteScans,
        Duration duration
) {
    public DetectionReport {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        unchanged = List.copyOf(unchanged);
        semanticPending = Set.copyOf(semanticPending);
        dataQualityIssues = List.copyOf(dataQualityIssues);
    }

    /**
     * Returns every conflict the pass observed, whether written or not.
     */
    public List<Conflict> conflicts() {
        List<Conflict> all = new ArrayList<>(created.size() + updated.size() + unchanged.size());
        all.addAll(created);
        all.addAll(updated);
        all.addAll(unchanged);
        return all;
    }

    public boolean hasChanges() {
        return !created.isEmpty() || !updated.isEmpty();
    }

    public boolean isComplete() {
        return incompleteScans == 0;
    }
}
