package io.evpipelines.fisheries.validation;

/**
 * One offending cell. Schema-level violations (a missing column) have no row and use {@link #NO_ROW}.
 */
public record Violation(long rowIndex, String column, String value, String reason) {
    public static final long NO_ROW = -1;

    public static Violation missingColumn(String column) {
        return new Violation(NO_ROW, column, null, "required column missing");
    }

    public boolean isRowLevel() { return rowIndex != NO_ROW; }
}
