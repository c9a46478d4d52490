package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.ScheduleEntry;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What applying a strategy decided.
 *
 * @param winningProvisionId the provision that prevails, null when there is no single winner
 * @param schedule           where and when each provision applies, empty if not scheduled
 * @param parameters         strategy parameters recorded with the resolution
 * @param rationale          structured explanation
 */
public record StrategyApplication(
        String winningProvisionId,
        List<ScheduleEntry> schedule,
        Map<String, String> parameters,
        Rationale rationale
) {
    public StrategyApplication {
        Objects.requireNonNull(rationale, "rationale is required");
        schedule = schedule != null ? List.copyOf(schedule) : List.of();
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }
}
