package com.regulatory.conflict.strategy;

import com.regulatory.conflict.config.HarmonizationPolicy;
import com.regulatory.conflict.core.model.Conflict;
import com.regulatory.conflict.core.model.Quantity;
import com.regulatory.conflict.core.model.Rationale;
import com.regulatory.conflict.core.model.StrategyKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges two obligations that differ only in a threshold into one combined requirement.
 * With {@link HarmonizationPolicy#MOST_RESTRICTIVE} the stricter threshold satisfies both.
 */
public record Harmonization(String firstId, Quantity firstQuantity, String secondId, Quantity secondQuantity,
                            HarmonizationPolicy policy) implements ResolutionStrategy {

    @Override
    public StrategyKind kind() {
        return StrategyKind.HARMONIZATION;
    }

    @Override
    public StrategyApplication apply(Conflict conflict, ResolutionContext context) {
        if (!firstQuantity.isComparableTo(secondQuantity)) {
            throw new StrategyApplicationException(kind(), "Quantities " + firstQuantity.metric()
                    + " and " + secondQuantity.metric() + " cannot be merged");
        }
        double merged = switch (policy) {
            case MOST_RESTRICTIVE -> firstQuantity.mostRestrictive(secondQuantity);
            case LEAST_RESTRICTIVE -> firstQuantity.leastRestrictive(secondQuantity);
        };
        String source = Double.compare(merged, firstQuantity.value()) == 0 ? firstId : secondId;

        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("metric", firstQuantity.metric());
        parameters.put("value", format(merged));
        parameters.put("unit", firstQuantity.unit());
        parameters.put("direction", firstQuantity.direction().name());
        parameters.put("policy", policy.name());

        Rationale rationale = Rationale.of(kind(), policy == HarmonizationPolicy.MOST_RESTRICTIVE
                        ? "most-restrictive-wins" : "least-restrictive-wins")
                .factor(firstId, format(firstQuantity.value()) + " " + firstQuantity.unit())
                .factor(secondId, format(secondQuantity.value()) + " " + secondQuantity.unit())
                .factor("combined", format(merged) + " " + firstQuantity.unit())
                .build();
        return new StrategyApplication(source, List.of(), parameters, rationale);
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
