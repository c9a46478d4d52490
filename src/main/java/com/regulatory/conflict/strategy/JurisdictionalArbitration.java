package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.StrategyKind;

import java.util.List;
import java.util.Map;

/**
 * No authority hierarchy decides, but the configured precedence table ranks one provision's
 * jurisdiction above the other's.
 *
 * @param winnerRank tier index of the winner (lower is stronger)
 */
public record JurisdictionalArbitration(String winnerId, String loserId, String winningTier,
                                        int winnerRank, int loserRank) implements ResolutionStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.JURISDICTIONAL_ARBITRATION;
    }

    @Override
    public StrategyApplication apply(Conflict conflict, ResolutionContext context) {
        if (winnerRank >= loserRank) {
            throw new StrategyApplicationException(kind(), "Precedence ranks " + winnerRank + " and "
                    + loserRank + " do not order " + winnerId + " first");
        }
        Rationale rationale = Rationale.of(kind(), "precedence-table")
                .factor("winner", winnerId)
                .factor("winnerRank", winnerRank)
                .factor("loser", loserId)
                .factor("loserRank", loserRank)
                .build();
        return new StrategyApplication(winnerId, List.of(), Map.of("tier", winningTier), rationale);
    }
}
