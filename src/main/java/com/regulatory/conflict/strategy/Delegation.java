package com.regulatory.conflict.strategy;

import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.StrategyKind;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolution authority for the topic is assigned to a named body. No provision wins; the
 * record names the delegate the decision is deferred to.
 */
public record Delegation(String delegate, String topic) implements ResolutionStrategy {

    public Delegation {
        Objects.requireNonNull(delegate, "delegate is required");
        Objects.requireNonNull(topic, "topic is required");
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.DELEGATION;
    }

    @Override
    public StrategyApplication apply(Conflict conflict, ResolutionContext context) {
        Rationale rationale = Rationale.of(kind(), "deferred-to-delegate")
                .factor("delegate", delegate)
                .factor("topic", topic)
                .build();
        return new StrategyApplication(null, List.of(), Map.of("delegate", delegate, "topic", topic), rationale);
    }
}
