package io.evpipelines.fisheries;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evpipelines.fisheries.io.OutputNaming;
import io.evpipelines.fisheries.rules.SchemaRules;
import io.evpipelines.fisheries.summary.DateRange;
import io.evpipelines.fisheries.transform.TransformOptions;
import io.evpipelines.fisheries.transform.ViolationPolicy;
import io.evpipelines.fisheries.validation.CheckCategory;
import io.evpipelines.metrics.Metrics;
import io.evpipelines.table.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static io.evpipelines.fisheries.FisheriesFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class VariantCleanerTest {
    @TempDir
    Path dir;

    private Path out;
    private MetricRegistry registry;

    @BeforeEach
    void setUp() {
        out = dir.resolve("cleaned");
        registry = new MetricRegistry();
    }

    private VariantCleaner cleaner(SchemaRules rules, TransformOptions options, ViolationPolicy policy,
                                   boolean diagnostics) {
        return new VariantCleaner(rules, options, policy, diagnostics, new OutputNaming(out, CLOCK),
                new Metrics(registry), CLOCK);
    }

    @Test
    void cleans_commercial_end_to_end() throws Exception {
        Path input = writeCsv(areaHundred(), dir.resolve("tidied_comm_ev.csv"));
        VariantResult r = cleaner(commercialRules(), TransformOptions.DEFAULTS, ViolationPolicy.WARN, false)
                .clean(input);

        assertEquals(DatasetVariant.COMMERCIAL, r.variant());
        assertEquals(out.resolve("cleaned_commercial_" + STAMP + ".csv"), r.outputFile());
        assertNull(r.diagnosticsFile());
        List<String> lines = Files.readAllLines(r.outputFile());
        assertEquals(3, lines.size());
        assertEquals(4, r.summary().rawRowCount());
        assertEquals(2, r.summary().cleanedRowCount());
        assertEquals(10289.0, r.summary().totalExchangeValue());
        // area 100 is outside 1..82 but only warned about
        assertFalse(r.report().passed());
        assertEquals(2, registry.counter("commercial.rows.removed").getCount());
    }

    @Test
    void missing_required_column_writes_no_cleaned_file() throws Exception {
        Path input = writeCsv(withoutColumn(areaHundred(), "exchange_value"), dir.resolve("tidied_comm_ev.csv"));
        VariantCleaner c = cleaner(commercialRules(), TransformOptions.DEFAULTS, ViolationPolicy.WARN, true);

        SchemaViolationException e = assertThrows(SchemaViolationException.class, () -> c.clean(input));
        assertEquals(List.of("exchange_value"), e.missingColumns());
        assertEquals(DatasetVariant.COMMERCIAL, e.variant());
        assertFalse(Files.exists(out.resolve("cleaned_commercial_" + STAMP + ".csv")));
        // diagnostics still describe the fatal report
        Path diag = out.resolve("validation_commercial_" + STAMP + ".json");
        JsonNode root = new ObjectMapper().readTree(diag.toFile());
        assertTrue(root.get("fatal").asBoolean());
    }

    @Test
    void unexpected_species_is_kept_under_warn_policy() throws Exception {
        Table t = nonCommercial(
                nonComm("2010", "Oahu", "Herbivores", REEF, "5"),
                nonComm("2010", "Oahu", "Bottomfish", REEF, "7"));
        Path input = writeCsv(t, dir.resolve("tidied_noncomm_ev.csv"));
        VariantResult r = cleaner(nonCommercialRules(), TransformOptions.DEFAULTS, ViolationPolicy.WARN, false)
                .clean(input);
        assertEquals(2, r.summary().cleanedRowCount());
        assertEquals(1, r.report().warningCount());
        assertEquals(out.resolve("cleaned_noncommercial_" + STAMP + ".csv"), r.outputFile());
    }

    @Test
    void out_of_range_year_is_warned_about_and_kept() throws Exception {
        Table t = commercial(
                comm("1990", "5", DEEP7, REEF, "12"),
                comm("2021", "5", DEEP7, REEF, "30"));
        Path input = writeCsv(t, dir.resolve("tidied_comm_ev.csv"));
        VariantResult r = cleaner(commercialRules(), TransformOptions.DEFAULTS, ViolationPolicy.WARN, false)
                .clean(input);

        assertEquals(Set.of("1990"),
                r.report().result(CheckCategory.RANGE).orElseThrow().offendingValues("year"));
        List<String> lines = Files.readAllLines(r.outputFile());
        assertEquals(3, lines.size());
        assertTrue(lines.get(1).startsWith("1990,5,Hawaii,"));
        assertEquals(new DateRange(1990L, 2021L), r.summary().dateRange());
        assertEquals(42.0, r.summary().totalExchangeValue());
    }

    @Test
    void reject_policy_drops_flagged_rows() throws Exception {
        Table t = nonCommercial(
                nonComm("2010", "Oahu", "Herbivores", REEF, "5"),
                nonComm("2010", "Oahu", "Bottomfish", REEF, "7"),
                nonComm("2001", "Oahu", "Herbivores", REEF, "3"));
        Path input = writeCsv(t, dir.resolve("tidied_noncomm_ev.csv"));
        VariantResult r = cleaner(nonCommercialRules(), TransformOptions.DEFAULTS, ViolationPolicy.REJECT, false)
                .clean(input);
        assertEquals(1, r.summary().cleanedRowCount());
        assertEquals(5.0, r.summary().totalExchangeValue());
    }

    @Test
    void writes_diagnostics_when_enabled() throws Exception {
        Path input = writeCsv(nonCommercialSample(), dir.resolve("tidied_noncomm_ev.csv"));
        VariantResult r = cleaner(nonCommercialRules(), new TransformOptions(false, true), ViolationPolicy.WARN, true)
                .clean(input);
        assertNotNull(r.diagnosticsFile());
        assertTrue(Files.exists(r.diagnosticsFile()));
        assertEquals(3, r.summary().cleanedRowCount());
        assertFalse(Files.readAllLines(r.outputFile()).get(0).contains("island_olelo"));
    }

    @Test
    void unreadable_input_is_a_load_failure() {
        VariantCleaner c = cleaner(commercialRules(), TransformOptions.DEFAULTS, ViolationPolicy.WARN, false);
        assertThrows(InputLoadException.class, () -> c.clean(dir.resolve("absent.csv")));
    }
}
