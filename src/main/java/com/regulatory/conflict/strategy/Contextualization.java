package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.StrategyKind;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The conflict only arises under certain situations; the provision whose declared context
 * flags are all active applies. Fails when the active context does not single one out.
 */
public record Contextualization(String firstId, Set<String> firstFlags, String secondId, Set<String> secondFlags)
        implements ResolutionStrategy {

    public Contextualization {
        firstFlags = Set.copyOf(firstFlags);
        secondFlags = Set.copyOf(secondFlags);
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.CONTEXTUALIZATION;
    }

    @Override
    public StrategyApplication apply(Conflict conflict, ResolutionContext context) {
        Set<String> active = context.activeContextFlags();
        boolean firstMatches = !firstFlags.isEmpty() && active.containsAll(firstFlags);
        boolean secondMatches = !secondFlags.isEmpty() && active.containsAll(secondFlags);
        if (firstMatches == secondMatches) {
            throw new StrategyApplicationException(kind(), "Active context " + new TreeSet<>(active)
                    + (firstMatches ? " matches both provisions" : " matches neither provision"));
        }
        String winner = firstMatches ? firstId : secondId;
        Set<String> matched = firstMatches ? firstFlags : secondFlags;
        Rationale rationale = Rationale.of(kind(), "declared-context-applies")
                .factor("applies", winner)
                .factor("matchedFlags", String.join(",", new TreeSet<>(matched)))
                .build();
        return new StrategyApplication(winner, List.of(),
                Map.of("context", String.join(",", new TreeSet<>(active))), rationale);
    }
}
