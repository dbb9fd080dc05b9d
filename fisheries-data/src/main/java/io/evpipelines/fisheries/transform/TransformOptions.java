package io.evpipelines.fisheries.transform;

/**
 * The two caller-supplied switches of a transform run.
 *
 * @param removeAggregates drop rows carrying an aggregate marker
 * @param removeDisplay    drop the display-only columns
 */
public record TransformOptions(boolean removeAggregates, boolean removeDisplay) {
    /** {@code removeAggregates=true}, {@code removeDisplay=false}. */
    public static final TransformOptions DEFAULTS = new TransformOptions(true, false);
}
