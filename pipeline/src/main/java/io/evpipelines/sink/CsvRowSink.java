package io.evpipelines.sink;

import com.opencsv.CSVWriter;
import io.evpipelines.core.BatchSink;
import io.evpipelines.core.Record;
import io.evpipelines.table.Row;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes rows as UTF-8 CSV with a header line. Cells are quoted only when they contain a separator,
 * quote or line break, so numbers are always written bare.
 */
public class CsvRowSink implements BatchSink<Row> {
    private final Path file;
    private final List<String> columns;
    private final CSVWriter writer;
    private long rowsWritten = 0;

    public CsvRowSink(Path file, List<String> columns) throws IOException {
        this.file = file;
        this.columns = List.copyOf(columns);
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        this.writer = new CSVWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
        writer.writeNext(this.columns.toArray(new String[0]), false);
    }

    @Override
    public void accept(Record<Row> record) throws IOException {
        Row row = record.payload();
        String[] line = new String[columns.size()];
        for (int i = 0; i < line.length; i++) {
            String v = row.get(columns.get(i));
            line[i] = v == null ? "" : v;
        }
        writer.writeNext(line, false);
        rowsWritten++;
    }

    @Override
    public void acceptBatch(List<Record<Row>> records) throws IOException {
        for (Record<Row> r : records) {
            accept(r);
        }
        if (writer.checkError()) {
            throw new IOException("Failed writing to " + file, writer.getException());
        }
    }

    public Path file() { return file; }
    public long rowsWritten() { return rowsWritten; }

    @Override
    public void close() throws IOException {
        boolean failed = writer.checkError();
        writer.close();
        if (failed) {
            throw new IOException("Failed writing to " + file, writer.getException());
        }
    }
}
