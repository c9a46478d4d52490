package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.StrategyKind;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * The later provision prevails over the earlier one of the same issuer and scope.
 */
public record LexPosterior(String laterId, String earlierId, LocalDate laterDate, LocalDate earlierDate)
        implements ResolutionStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.LEX_POSTERIOR;
    }

    @Override
    public StrategyApplication apply(Conflict conflict, ResolutionContext context) {
        if (!laterDate.isAfter(earlierDate)) {
            throw new StrategyApplicationException(kind(), "Effective dates do not order "
                    + laterId + " after " + earlierId);
        }
        Rationale rationale = Rationale.of(kind(), "later-enactment-wins")
                .factor("later", laterId)
                .factor("laterEffective", laterDate)
                .factor("earlier", earlierId)
                .factor("earlierEffective", earlierDate)
                .build();
        return new StrategyApplication(laterId, List.of(),
                Map.of("effectiveFrom", laterDate.toString()), rationale);
    }
}
