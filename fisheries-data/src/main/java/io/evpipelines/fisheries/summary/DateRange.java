package io.evpipelines.fisheries.summary;

/**
 * Observed year span; both ends are null when no row carried a parsable year.
 */
public record DateRange(Long minYear, Long maxYear) {
    public static final DateRange EMPTY = new DateRange(null, null);

    public boolean isEmpty() { return minYear == null; }

    /** Smallest span covering both ranges. */
    public DateRange union(DateRange other) {
        if (other == null || other.isEmpty()) return this;
        if (isEmpty()) return other;
        return new DateRange(Math.min(minYear, other.minYear), Math.max(maxYear, other.maxYear));
    }
}
