package io.evpipelines.fisheries.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evpipelines.fisheries.DatasetVariant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;

import static io.evpipelines.fisheries.FisheriesFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class SummaryJsonWriterTest {
    private final Summarizer summarizer = new Summarizer(CLOCK);
    private final SummaryJsonWriter writer = new SummaryJsonWriter();

    @TempDir
    Path dir;

    private SummaryRecord commercialSummary() {
        return summarizer.summarize(areaHundred(), areaHundred(), commercialRules());
    }

    private SummaryRecord nonCommercialSummary() {
        return summarizer.summarize(nonCommercialSample(), nonCommercialSample(), nonCommercialRules());
    }

    @Test
    void variant_document() {
        JsonNode n = writer.toJson(commercialSummary());
        assertEquals("commercial", n.get("data_type").asText());
        assertEquals(4, n.get("raw_row_count").asLong());
        assertEquals(0, n.get("rows_removed").asLong());
        assertEquals(2021, n.get("date_range").get("min_year").asLong());
        assertEquals(30867.0, n.get("total_exchange_value").asDouble());
        assertEquals(100, n.get("unique_area_ids").get(0).asLong());
        assertTrue(n.get("unique_area_ids").get(0).isNumber());
        assertEquals(3, n.get("unique_ecosystem_types").size());
        assertEquals(4, n.get("records_by_year").get("2021").asLong());
    }

    @Test
    void both_variants_succeeded() throws Exception {
        Map<DatasetVariant, SummaryRecord> summaries = new EnumMap<>(DatasetVariant.class);
        summaries.put(DatasetVariant.COMMERCIAL, commercialSummary());
        summaries.put(DatasetVariant.NON_COMMERCIAL, nonCommercialSummary());
        CombinedSummary combined = new CombinedSummary("2024-01-31T10:15:30", summaries, Map.of());

        Path f = writer.write(combined, dir.resolve("cleaning_summary.json"));
        JsonNode root = new ObjectMapper().readTree(f.toFile());
        assertEquals("2024-01-31T10:15:30", root.get("pipeline_timestamp").asText());
        assertEquals("non_commercial", root.get("non_commercial").get("data_type").asText());
        JsonNode overall = root.get("overall");
        assertEquals(7, overall.get("total_records").asLong());
        assertEquals(30867.0 + 3001.0, overall.get("total_exchange_value").asDouble(), 1e-9);
        assertEquals(2005, overall.get("combined_date_range").get("min_year").asLong());
        assertEquals(2022, overall.get("combined_date_range").get("max_year").asLong());
        assertFalse(root.has("failures"));
    }

    @Test
    void failed_variant_is_null_with_reason_and_no_overall() {
        Map<DatasetVariant, SummaryRecord> summaries = new EnumMap<>(DatasetVariant.class);
        summaries.put(DatasetVariant.COMMERCIAL, commercialSummary());
        CombinedSummary combined = new CombinedSummary("t", summaries,
                Map.of(DatasetVariant.NON_COMMERCIAL, "Missing required columns: [island]"));

        JsonNode root = writer.toJson(combined);
        assertTrue(root.get("non_commercial").isNull());
        assertEquals("commercial", root.get("commercial").get("data_type").asText());
        assertFalse(root.has("overall"));
        assertEquals("Missing required columns: [island]", root.get("failures").get("non_commercial").asText());
        assertTrue(combined.overall().isEmpty());
    }

    @Test
    void empty_summary_has_null_years() {
        SummaryRecord s = summarizer.summarize(areaHundred(), commercial(), commercialRules());
        JsonNode n = writer.toJson(s);
        assertTrue(n.get("date_range").get("min_year").isNull());
        assertEquals(0.0, n.get("total_exchange_value").asDouble());
    }
}
