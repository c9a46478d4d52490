package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.ScheduleEntry;
import com.regulatory.conflict.core.model.StrategyKind;

import java.util.List;
import java.util.Map;

/**
 * The provisions are in force over disjoint windows; each applies during its own window.
 * No single winner is recorded, only the schedule.
 */
public record TemporalResolution(List<ScheduleEntry> windows) implements ResolutionStrategy {

    public TemporalResolution {
        windows = List.copyOf(windows);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.TEMPORAL_RESOLUTION;
    }

    @Override
    public StrategyApplication apply(Conflict conflict, ResolutionContext context) {
        for (int i = 1; i < windows.size(); i++) {
            ScheduleEntry previous = windows.get(i - 1);
            ScheduleEntry next = windows.get(i);
            if (previous.until() == null || next.from() == null || !previous.until().isBefore(next.from())) {
                throw new StrategyApplicationException(kind(), "Validity windows of "
                        + previous.provisionId() + " and " + next.provisionId() + " overlap");
            }
        }
        Rationale.Builder rationale = Rationale.of(kind(), "active-window-applies");
        for (ScheduleEntry window : windows) {
            rationale.factor(window.provisionId(), window.from() + ".." + (window.until() != null ? window.until() : ""));
        }
        ScheduleEntry current = windows.stream()
                .filter(w -> w.coversDay(context.asOf()))
                .findFirst()
                .orElse(null);
        return new StrategyApplication(null, windows,
                Map.of("activeOnResolution", current != null ? current.provisionId() : "none"),
                rationale.build());
    }
}
