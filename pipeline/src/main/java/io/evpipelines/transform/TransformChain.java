package io.evpipelines.transform;

import io.evpipelines.core.Record;
import io.evpipelines.core.Transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequentially applies transforms of the same payload type, flattening outputs. A record dropped by one stage
 * is not seen by the stages after it.
 */
public class TransformChain<T> implements Transform<T, T> {
    private final List<Transform<T, T>> stages;

    @SafeVarargs
    public TransformChain(Transform<T, T>... stages) {
        this(List.of(stages));
    }

    public TransformChain(List<Transform<T, T>> stages) {
        this.stages = List.copyOf(stages);
    }

    public int size() { return stages.size(); }

    @Override
    public List<Record<T>> apply(Record<T> input) throws Exception {
        List<Record<T>> current = List.of(input);
        for (Transform<T, T> stage : stages) {
            if (current.isEmpty()) break;
            List<Record<T>> next = new ArrayList<>();
            for (Record<T> r : current) {
                List<Record<T>> out = stage.apply(r);
                if (out != null) next.addAll(out);
            }
            current = next;
        }
        return current;
    }
}
