package io.evpipelines.fisheries.io;

import io.evpipelines.fisheries.DatasetVariant;
import io.evpipelines.fisheries.OutputWriteException;
import io.evpipelines.metrics.Metrics;
import io.evpipelines.runtime.Pipeline;
import io.evpipelines.runtime.PipelineResult;
import io.evpipelines.sink.CsvRowSink;
import io.evpipelines.source.TableSource;
import io.evpipelines.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a cleaned table as CSV. Rows go to a temporary file next to the target which is moved into place
 * only once complete.
 */
public class CleanedCsvExporter {
    private static final Logger LOG = LoggerFactory.getLogger(CleanedCsvExporter.class);

    private final Metrics metrics;

    public CleanedCsvExporter(Metrics metrics) {
        this.metrics = metrics;
    }

    public Path export(DatasetVariant variant, Table table, Path target) throws OutputWriteException {
        LOG.info("Exporting cleaned {} data...", variant.key());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            PipelineResult result = Pipeline.drain(new TableSource(table), new CsvRowSink(tmp, table.columns()),
                    metrics.scoped(variant.key()).scoped("export"));
            move(tmp, target);
            LOG.info("Exported {} rows to {}", String.format("%,d", result.recordsOut()), target);
            return target;
        } catch (Exception e) {
            deleteIfExists(tmp, e);
            throw new OutputWriteException(variant, "Cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteIfExists(Path tmp, Exception primary) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
