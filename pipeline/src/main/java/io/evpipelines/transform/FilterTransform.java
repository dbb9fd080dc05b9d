package io.evpipelines.transform;

import io.evpipelines.core.Record;
import io.evpipelines.core.Transform;

import java.util.List;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;

/**
 * Keeps a record when the predicate accepts it, drops it otherwise. Never alters the payload.
 */
public class FilterTransform<T> implements Transform<T, T> {
    private final Predicate<Record<T>> keep;
    private final LongAdder dropped = new LongAdder();

    public FilterTransform(Predicate<Record<T>> keep) {
        this.keep = keep;
    }

    /** Filter that drops records whose payload matches. */
    public static <T> FilterTransform<T> dropping(Predicate<T> drop) {
        return new FilterTransform<>(r -> !drop.test(r.payload()));
    }

    @Override
    public List<Record<T>> apply(Record<T> input) {
        if (keep.test(input)) return List.of(input);
        dropped.increment();
        return List.of();
    }

    /** Records dropped so far by this instance. */
    public long dropped() { return dropped.sum(); }
}
