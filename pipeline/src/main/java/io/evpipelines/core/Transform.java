package io.evpipelines.core;

import java.util.List;

/**
 * Transform converts an input record into zero or more output records.
 * Implementations must carry the input's seq over to their outputs.
 */
@FunctionalInterface
public interface Transform<I, O> {
    List<Record<O>> apply(Record<I> input) throws Exception;
}
