package io.evpipelines.transform;

import io.evpipelines.core.Record;
import io.evpipelines.core.Transform;
import io.evpipelines.table.Row;

import java.util.List;
import java.util.Set;

/**
 * Removes the named columns from every row regardless of their content.
 */
public class DropColumnsTransform implements Transform<Row, Row> {
    private final Set<String> columns;

    public DropColumnsTransform(Set<String> columns) {
        this.columns = Set.copyOf(columns);
    }

    public Set<String> columns() { return columns; }

    @Override
    public List<Record<Row>> apply(Record<Row> input) {
        return List.of(input.withPayload(input.payload().without(columns)));
    }
}
