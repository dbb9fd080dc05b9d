package io.evpipelines.fisheries.transform;

import com.codahale.metrics.MetricRegistry;
import io.evpipelines.core.Transform;
import io.evpipelines.fisheries.rules.SchemaRules;
import io.evpipelines.metrics.Metrics;
import io.evpipelines.runtime.PipelineBuilder;
import io.evpipelines.runtime.PipelineResult;
import io.evpipelines.sink.TableSink;
import io.evpipelines.source.TableSource;
import io.evpipelines.table.Row;
import io.evpipelines.table.Table;
import io.evpipelines.transform.DropColumnsTransform;
import io.evpipelines.transform.FilterTransform;
import io.evpipelines.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives a filtered table from a validated one. Only deletes: rejected rows (when asked), aggregate rows,
 * display-only columns. The input table is left as it was.
 */
public class Transformer {
    private static final Logger LOG = LoggerFactory.getLogger(Transformer.class);

    private final SchemaRules rules;
    private final Metrics metrics;

    public Transformer(SchemaRules rules) {
        this(rules, new Metrics(new MetricRegistry()));
    }

    public Transformer(SchemaRules rules, Metrics metrics) {
        this.rules = rules;
        this.metrics = metrics.scoped(rules.variant().key());
    }

    public Table transform(Table table, TransformOptions options) throws Exception {
        return transform(table, options, Set.of());
    }

    /**
     * @param rejectedRows indices of rows to drop before aggregate filtering; empty under the warn policy
     */
    public Table transform(Table table, TransformOptions options, Set<Long> rejectedRows) throws Exception {
        List<Transform<Row, Row>> stages = new ArrayList<>();

        FilterTransform<Row> rejectFilter = null;
        if (!rejectedRows.isEmpty()) {
            Set<Long> rejected = Set.copyOf(rejectedRows);
            rejectFilter = new FilterTransform<>(r -> !rejected.contains(r.seq()));
            stages.add(rejectFilter);
        }

        AggregateRowFilter aggregateFilter = null;
        if (options.removeAggregates()) {
            LOG.info("Removing aggregate rows...");
            aggregateFilter = new AggregateRowFilter(rules.aggregateMarkers());
            stages.add(aggregateFilter);
        } else {
            LOG.info("Skipping aggregate row removal (remove_aggregates=false)");
        }

        List<String> columns = table.columns();
        if (options.removeDisplay()) {
            Set<String> present = new LinkedHashSet<>(rules.displayColumns());
            present.retainAll(table.columns());
            if (present.isEmpty()) {
                LOG.info("No display columns to remove");
            } else {
                stages.add(new DropColumnsTransform(present));
                columns = table.columnsWithout(present);
                LOG.info("Removed columns: {}", present);
            }
        } else {
            LOG.info("Keeping display columns (remove_display=false)");
        }

        TableSink sink = new TableSink(columns);
        PipelineResult result = new PipelineBuilder<Row, Row>()
                .source(new TableSource(table))
                .transform(new TransformChain<>(stages))
                .sink(sink)
                .metrics(metrics)
                .name("transform")
                .build()
                .run();

        if (rejectFilter != null) {
            LOG.warn("Rejected {} rows flagged by validation", rejectFilter.dropped());
            metrics.counter("transform.rows.rejected").inc(rejectFilter.dropped());
        }
        if (aggregateFilter != null) {
            if (aggregateFilter.dropped() > 0) {
                LOG.info("Removed {} aggregate rows", aggregateFilter.dropped());
            } else {
                LOG.info("No aggregate rows found to remove");
            }
            metrics.counter("transform.rows.aggregate").inc(aggregateFilter.dropped());
        }
        LOG.debug("Transform kept {} of {} rows in {} ms", result.recordsOut(), result.recordsIn(),
                result.elapsed().toMillis());
        return sink.table();
    }
}
