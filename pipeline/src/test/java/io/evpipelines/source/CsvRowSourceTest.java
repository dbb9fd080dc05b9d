package io.evpipelines.source;

import io.evpipelines.core.Record;
import io.evpipelines.sink.CsvRowSink;
import io.evpipelines.table.Row;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CsvRowSourceTest {
    @TempDir
    Path tmp;

    @Test
    void readsHeaderAndRowsInOrder() throws Exception {
        Path f = write("\uFEFFyear,species_group,exchange_value\n2021,Pelagics,10\n\n2020,\"Deep 7, Bottomfish\",5.5\n");
        List<Record<Row>> rows = new ArrayList<>();
        try (CsvRowSource src = new CsvRowSource(f)) {
            assertEquals(List.of("year", "species_group", "exchange_value"), src.columns());
            Optional<Record<Row>> r;
            while ((r = src.poll()).isPresent()) rows.add(r.get());
            assertTrue(src.isFinished());
        }
        assertEquals(2, rows.size());
        assertEquals(0, rows.get(0).seq());
        assertEquals(1, rows.get(1).seq());
        assertEquals("Deep 7, Bottomfish", rows.get(1).payload().get("species_group"));
        assertEquals("5.5", rows.get(1).payload().get("exchange_value"));
    }

    @Test
    void widthMismatchIsFormatError() throws Exception {
        Path f = write("a,b\n1,2\n3\n");
        try (CsvRowSource src = new CsvRowSource(f)) {
            assertTrue(src.poll().isPresent());
            CsvFormatException e = assertThrows(CsvFormatException.class, src::poll);
            assertEquals(3, e.lineNumber());
        }
    }

    @Test
    void emptyFileHasNoHeader() throws Exception {
        Path f = write("");
        assertThrows(CsvFormatException.class, () -> new CsvRowSource(f));
    }

    @Test
    void headerOnlyFileIsEmptyNotBroken() throws Exception {
        Path f = write("a,b\n");
        try (CsvRowSource src = new CsvRowSource(f)) {
            assertTrue(src.poll().isEmpty());
            assertTrue(src.isFinished());
        }
    }

    @Test
    void backslashesAreKeptAsText() throws Exception {
        Path f = write("a,b\nC:\\data\\x,\"say \"\"hi\"\"\"\n\"ends with \\\",z\n");
        List<Row> rows = readAll(f);
        assertEquals(2, rows.size());
        assertEquals("C:\\data\\x", rows.get(0).get("a"));
        assertEquals("say \"hi\"", rows.get(0).get("b"));
        assertEquals("ends with \\", rows.get(1).get("a"));
        assertEquals("z", rows.get(1).get("b"));
    }

    @Test
    void reads_back_what_the_sink_wrote() throws Exception {
        List<String> cols = List.of("path", "note", "value");
        List<Row> written = List.of(
                Row.of(cols, List.of("C:\\data\\x", "a, \"b\"", "10289")),
                Row.of(cols, List.of("ends with \\", "Inshore — Reef", "")),
                Row.of(cols, List.of("two\nlines", "\\\"", "0.5")));
        Path f = tmp.resolve("round.csv");
        try (CsvRowSink sink = new CsvRowSink(f, cols)) {
            List<Record<Row>> batch = new ArrayList<>();
            for (int i = 0; i < written.size(); i++) batch.add(new Record<>(i, written.get(i)));
            sink.acceptBatch(batch);
        }
        assertEquals(written, readAll(f));
    }

    private static List<Row> readAll(Path f) throws Exception {
        List<Row> rows = new ArrayList<>();
        try (CsvRowSource src = new CsvRowSource(f)) {
            Optional<Record<Row>> r;
            while ((r = src.poll()).isPresent()) rows.add(r.get().payload());
        }
        return rows;
    }

    private Path write(String content) throws Exception {
        Path f = tmp.resolve("in.csv");
        Files.writeString(f, content, StandardCharsets.UTF_8);
        return f;
    }
}
