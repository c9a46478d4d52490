package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.NormativeProvision;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.ScheduleEntry;
import com.regulatory.conflict.core.model.StrategyKind;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The narrower provision prevails inside its own scope; the broader one keeps applying
 * everywhere else.
 *
 * @param dimension {@code jurisdiction} or {@code topic}, whichever scope is nested
 */
public record LexSpecialis(String specialId, String generalId, Set<String> specialScope,
                           Set<String> generalScope, String dimension) implements ResolutionStrategy {

    public LexSpecialis {
        specialScope = Set.copyOf(specialScope);
        generalScope = Set.copyOf(generalScope);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.LEX_SPECIALIS;
    }

    @Override
    public StrategyApplication apply(Conflict conflict, ResolutionContext context) {
        NormativeProvision special = context.provision(specialId);
        NormativeProvision general = context.provision(generalId);
        List<ScheduleEntry> schedule = List.of(
                new ScheduleEntry(specialId, special.getEffectiveDate().orElse(null),
                        special.getExpiryDate().orElse(null), specialScope),
                new ScheduleEntry(generalId, general.getEffectiveDate().orElse(null),
                        general.getExpiryDate().orElse(null), generalScope));
        Rationale rationale = Rationale.of(kind(), "narrower-scope-wins")
                .factor("dimension", dimension)
                .factor("special", specialId)
                .factor("specialScope", String.join(",", new TreeSet<>(specialScope)))
                .factor("general", generalId)
                .factor("generalScope", String.join(",", new TreeSet<>(generalScope)))
                .build();
        return new StrategyApplication(specialId, schedule,
                Map.of("dimension", dimension, "exceptWithin", specialId), rationale);
    }
}
