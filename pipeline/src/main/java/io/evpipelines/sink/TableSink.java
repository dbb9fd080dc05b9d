package io.evpipelines.sink;

import io.evpipelines.core.BatchSink;
import io.evpipelines.core.Record;
import io.evpipelines.table.Row;
import io.evpipelines.table.Table;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects rows into a new in-memory table with the given column order.
 */
public class TableSink implements BatchSink<Row> {
    private final List<String> columns;
    private final List<Row> rows = new ArrayList<>();

    public TableSink(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    @Override
    public void accept(Record<Row> record) {
        rows.add(record.payload());
    }

    @Override
    public void acceptBatch(List<Record<Row>> records) {
        for (Record<Row> r : records) {
            accept(r);
        }
    }

    public Table table() {
        return new Table(columns, rows);
    }
}
