package io.evpipelines.source;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import io.evpipelines.core.Record;
import io.evpipelines.core.Source;
import io.evpipelines.table.Row;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Streams a UTF-8 CSV file with a header row as {@link Row} records. Blank lines are skipped;
 * a data line whose width differs from the header fails with {@link CsvFormatException}.
 */
public class CsvRowSource implements Source<Row> {
    private static final char BOM = '\uFEFF';

    private final Path file;
    private final CSVReader reader;
    private final List<String> columns;
    private long idx = 0;
    private boolean finished = false;

    public CsvRowSource(Path file) throws IOException {
        this.file = file;
        // RFC 4180: quotes escape by doubling, backslashes are plain text
        this.reader = new CSVReaderBuilder(Files.newBufferedReader(file, StandardCharsets.UTF_8))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build();
        try {
            String[] header = readLine();
            if (header == null) {
                throw new CsvFormatException("Missing header row in " + file.getFileName(), 1);
            }
            if (!header[0].isEmpty() && header[0].charAt(0) == BOM) {
                header[0] = header[0].substring(1);
            }
            this.columns = List.of(header);
        } catch (IOException e) {
            reader.close();
            throw e;
        }
    }

    public List<String> columns() { return columns; }

    @Override
    public Optional<Record<Row>> poll() throws IOException {
        if (finished) return Optional.empty();
        String[] values = readLine();
        while (values != null && isBlank(values)) {
            values = readLine();
        }
        if (values == null) {
            finished = true;
            return Optional.empty();
        }
        if (values.length != columns.size()) {
            throw new CsvFormatException("Expected " + columns.size() + " fields but found " + values.length
                    + " in " + file.getFileName(), reader.getLinesRead());
        }
        Record<Row> r = new Record<>(idx++, Row.of(columns, Arrays.asList(values)));
        return Optional.of(r);
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private String[] readLine() throws IOException {
        try {
            return reader.readNext();
        } catch (CsvValidationException e) {
            throw new CsvFormatException("Unparsable CSV in " + file.getFileName(), reader.getLinesRead(), e);
        }
    }

    private static boolean isBlank(String[] values) {
        return values.length == 1 && values[0].isBlank();
    }
}
