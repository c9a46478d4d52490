package com.regulatory.conflict.core.model;

import java.util.Objects;

/**
 * Numeric threshold attached to an obligation, e.g. "notify within 24 hours".
 *
 * @param metric    what is being measured (e.g. {@code notification-deadline})
 * @param value     the threshold value
 * @param unit      the unit of {@code value} (e.g. {@code hours})
 * @param direction whether the threshold is an upper or lower bound
 */
public record Quantity(String metric, double value, String unit, Bound direction) {

    public enum Bound {
        /** Value is a ceiling: a lower value is more restrictive. */
        MAXIMUM,
        /** Value is a floor: a higher value is more restrictive. */
        MINIMUM
    }

    public Quantity {
        Objects.requireNonNull(metric, "metric is required");
        Objects.requireNonNull(unit, "unit is required");
        Objects.requireNonNull(direction, "direction is required");
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite");
        }
    }

    public static Quantity atMost(String metric, double value, String unit) {
        return new Quantity(metric, value, unit, Bound.MAXIMUM);
    }

    public static Quantity atLeast(String metric, double value, String unit) {
        return new Quantity(metric, value, unit, Bound.MINIMUM);
    }

    /**
     * Returns whether the two quantities measure the same thing in the same way and can be merged.
     */
    public boolean isComparableTo(Quantity other) {
        return other != null
                && metric.equals(other.metric)
                && unit.equals(other.unit)
                && direction == other.direction;
    }

    /**
     * Returns the more restrictive of the two values.
     */
    public double mostRestrictive(Quantity other) {
        return direction == Bound.MAXIMUM ? Math.min(value, other.value) : Math.max(value, other.value);
    }

    /**
     * Returns the less restrictive of the two values.
     */
    public double leastRestrictive(Quantity other) {
        return direction == Bound.MAXIMUM ? Math.max(value, other.value) : Math.min(value, other.value);
    }
}
