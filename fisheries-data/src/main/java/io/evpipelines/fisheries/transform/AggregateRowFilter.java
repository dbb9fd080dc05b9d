package io.evpipelines.fisheries.transform;

import io.evpipelines.table.Row;
import io.evpipelines.transform.FilterTransform;

import java.util.Map;
import java.util.Set;

/**
 * Drops rollup rows: a row is an aggregate when any marker column holds one of its markers
 * (for commercial data, {@code species_group = "All Species"} or {@code ecosystem_type = "All Ecosystems"}).
 * Other columns play no part in the decision.
 */
public class AggregateRowFilter extends FilterTransform<Row> {
    public AggregateRowFilter(Map<String, Set<String>> markers) {
        super(r -> !isAggregate(r.payload(), markers));
    }

    public static boolean isAggregate(Row row, Map<String, Set<String>> markers) {
        for (Map.Entry<String, Set<String>> e : markers.entrySet()) {
            String v = row.get(e.getKey());
            if (v != null && e.getValue().contains(v)) return true;
        }
        return false;
    }
}
