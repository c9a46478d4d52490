package com.regulatory.conflict.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * One row of an applicability schedule: which provision governs, over which days and scope.
 *
 * @param provisionId the provision that applies
 * @param from        first day (inclusive), null for "since always"
 * @param until       last day (inclusive), null for open-ended
 * @param scope       jurisdiction tags where it applies, empty for "everywhere it claims"
 */
public record ScheduleEntry(String provisionId, LocalDate from, LocalDate until, Set<String> scope) {

    public ScheduleEntry {
        Objects.requireNonNull(provisionId, "provisionId is required");
        scope = scope != null ? Set.copyOf(scope) : Set.of();
    }

    public boolean coversDay(LocalDate day) {
        return (from == null || !day.isBefore(from)) && (until == null || !day.isAfter(until));
    }
}
