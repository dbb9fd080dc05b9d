package io.evpipelines.runtime;

import java.time.Duration;

/**
 * Counts for one completed pipeline run. {@code recordsDropped} is input minus output and is negative only when a
 * transform fans out.
 */
public record PipelineResult(long recordsIn, long recordsOut, Duration elapsed) {
    public long recordsDropped() { return recordsIn - recordsOut; }
}
