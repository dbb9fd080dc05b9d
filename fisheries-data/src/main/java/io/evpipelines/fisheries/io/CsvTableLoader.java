package io.evpipelines.fisheries.io;

import io.evpipelines.fisheries.DatasetVariant;
import io.evpipelines.fisheries.InputLoadException;
import io.evpipelines.metrics.Metrics;
import io.evpipelines.runtime.Pipeline;
import io.evpipelines.sink.TableSink;
import io.evpipelines.source.CsvRowSource;
import io.evpipelines.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Loads a whole CSV file into memory. Any read or parse problem becomes an {@link InputLoadException}.
 */
public class CsvTableLoader {
    private static final Logger LOG = LoggerFactory.getLogger(CsvTableLoader.class);

    private final Metrics metrics;

    public CsvTableLoader(Metrics metrics) {
        this.metrics = metrics;
    }

    public Table load(DatasetVariant variant, Path file) throws InputLoadException {
        LOG.info("Loading {} data from {}", variant.key(), file);
        try {
            CsvRowSource source = new CsvRowSource(file);
            TableSink sink = new TableSink(source.columns());
            Pipeline.drain(source, sink, metrics.scoped(variant.key()).scoped("load"));
            Table table = sink.table();
            LOG.info("Loaded {} rows from {}", String.format("%,d", table.size()), file.getFileName());
            return table;
        } catch (Exception e) {
            LOG.error("Error loading {} data: {}", variant.key(), e.getMessage());
            throw new InputLoadException(variant, "Cannot load input " + file + ": " + e.getMessage(), e);
        }
    }
}
