package io.evpipelines.transform;

import io.evpipelines.core.Record;
import io.evpipelines.core.Transform;

import java.util.List;

/**
 * Passes every record through unchanged.
 */
public class IdentityTransform<T> implements Transform<T, T> {
    @Override
    public List<Record<T>> apply(Record<T> input) {
        return List.of(input);
    }
}
