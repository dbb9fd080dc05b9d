package io.evpipelines.source;

import io.evpipelines.core.Record;
import io.evpipelines.core.Source;
import io.evpipelines.table.Row;
import io.evpipelines.table.Table;

import java.util.Optional;

/**
 * Emits the rows of an in-memory table in order; seq is the row index.
 */
public class TableSource implements Source<Row> {
    private final Table table;
    private int idx = 0;

    public TableSource(Table table) {
        this.table = table;
    }

    @Override
    public Optional<Record<Row>> poll() {
        if (idx >= table.size()) return Optional.empty();
        Record<Row> r = new Record<>(idx, table.row(idx));
        idx++;
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return idx >= table.size();
    }
}
