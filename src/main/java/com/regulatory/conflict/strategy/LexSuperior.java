package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.StrategyKind;

import java.util.List;
import java.util.Map;

/**
 * The provision of the higher-ranking issuer prevails.
 */
public record LexSuperior(String superiorId, String inferiorId, int superiorLevel, int inferiorLevel)
        implements ResolutionStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.LEX_SUPERIOR;
    }

    @Override
    public StrategyApplication apply(Conflict conflict, ResolutionContext context) {
        if (superiorLevel <= inferiorLevel) {
            throw new StrategyApplicationException(kind(), "Authority levels do not rank "
                    + superiorId + " above " + inferiorId);
        }
        Rationale rationale = Rationale.of(kind(), "higher-authority-wins")
                .factor("superior", superiorId)
                .factor("superiorLevel", superiorLevel)
                .factor("inferior", inferiorId)
                .factor("inferiorLevel", inferiorLevel)
                .build();
        return new StrategyApplication(superiorId, List.of(),
                Map.of("authorityGap", String.valueOf(superiorLevel - inferiorLevel)), rationale);
    }
}
