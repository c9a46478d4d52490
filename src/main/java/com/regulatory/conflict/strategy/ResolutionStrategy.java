package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.StrategyKind;

/**
 * One of the eight ways a conflict can be settled. Each variant carries the facts found
 * when it was selected; {@link #apply} turns them into an outcome.
 */
public sealed interface ResolutionStrategy
        permits LexSuperior, LexPosterior, LexSpecialis, Harmonization,
                Contextualization, Delegation, TemporalResolution, JurisdictionalArbitration {

    StrategyKind kind();

    /**
     * @throws StrategyApplicationException if the strategy cannot decide in this context
     */
    StrategyApplication apply(Conflict conflict, ResolutionContext context);
}
