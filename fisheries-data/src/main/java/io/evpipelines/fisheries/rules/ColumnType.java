package io.evpipelines.fisheries.rules;

import io.evpipelines.fisheries.ConfigurationException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Declared type of a column. Cells are kept as text; these parse on demand and report conformance.
 */
public enum ColumnType {
    INTEGER,
    REAL,
    STRING;

    public boolean conforms(String raw) {
        return switch (this) {
            case INTEGER -> parseInteger(raw).isPresent();
            case REAL -> parseReal(raw).isPresent();
            case STRING -> raw != null;
        };
    }

    /** Numeric value of a conforming INTEGER or REAL cell. */
    public OptionalDouble numericValue(String raw) {
        return switch (this) {
            case INTEGER -> {
                OptionalLong v = parseInteger(raw);
                yield v.isPresent() ? OptionalDouble.of(v.getAsLong()) : OptionalDouble.empty();
            }
            case REAL -> parseReal(raw);
            case STRING -> OptionalDouble.empty();
        };
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Integer value of the cell. A decimal with zero fraction ({@code 2021.0}) counts as an integer since
     * spreadsheet exports often write whole numbers that way.
     */
    public static OptionalLong parseInteger(String raw) {
        BigDecimal d = decimal(raw);
        if (d == null) return OptionalLong.empty();
        try {
            return OptionalLong.of(d.stripTrailingZeros().longValueExact());
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    /** Finite real value of the cell. NaN, infinities and blanks do not parse. */
    public static OptionalDouble parseReal(String raw) {
        BigDecimal d = decimal(raw);
        if (d == null) return OptionalDouble.empty();
        double v = d.doubleValue();
        return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
    }

    public static ColumnType fromName(String name) {
        if (name == null) throw new ConfigurationException("Column type is required");
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "integer", "int" -> INTEGER;
            case "real", "double", "float" -> REAL;
            case "string", "text" -> STRING;
            default -> throw new ConfigurationException("Unknown column type: '" + name + "'");
        };
    }

    private static BigDecimal decimal(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
