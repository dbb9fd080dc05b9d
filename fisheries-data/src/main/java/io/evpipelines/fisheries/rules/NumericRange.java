package io.evpipelines.fisheries.rules;

import io.evpipelines.fisheries.ConfigurationException;

/**
 * Inclusive numeric bounds; a null end is unbounded.
 */
public record NumericRange(Double min, Double max) {
    public NumericRange {
        if (min == null && max == null) {
            throw new ConfigurationException("A range needs at least one bound");
        }
        if (min != null && max != null && min > max) {
            throw new ConfigurationException("Range minimum " + min + " exceeds maximum " + max);
        }
    }

    public static NumericRange between(double min, double max) {
        return new NumericRange(min, max);
    }

    public static NumericRange atLeast(double min) {
        return new NumericRange(min, null);
    }

    public boolean contains(double value) {
        if (min != null && value < min) return false;
        return max == null || value <= max;
    }

    public String describe() {
        if (max == null) return ">= " + format(min);
        if (min == null) return "<= " + format(max);
        return "[" + format(min) + ", " + format(max) + "]";
    }

    private static String format(double d) {
        return d == Math.rint(d) ? Long.toString((long) d) : Double.toString(d);
    }
}
