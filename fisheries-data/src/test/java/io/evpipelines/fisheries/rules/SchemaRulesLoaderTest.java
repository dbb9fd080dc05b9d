package io.evpipelines.fisheries.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.evpipelines.fisheries.ConfigurationException;
import io.evpipelines.fisheries.DatasetVariant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaRulesLoaderTest {
    private final SchemaRulesLoader loader = new SchemaRulesLoader();
    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void bundled_commercial_rules() {
        SchemaRules r = loader.loadDefault(DatasetVariant.COMMERCIAL);
        assertEquals(DatasetVariant.COMMERCIAL, r.variant());
        assertEquals(List.of("year", "area_id", "county", "species_group", "ecosystem_type", "exchange_value"),
                r.requiredColumns());
        assertEquals(ColumnType.INTEGER, r.typeOf("area_id"));
        assertEquals(ColumnType.REAL, r.typeOf("exchange_value"));
        assertEquals(ColumnType.STRING, r.typeOf("county"));
        assertTrue(r.yearBounds().contains(1997));
        assertTrue(r.yearBounds().contains(2021));
        assertFalse(r.yearBounds().contains(2022));
        assertEquals(Set.of("All Species"), r.aggregateMarkers().get("species_group"));
        assertEquals(Set.of("All Ecosystems"), r.aggregateMarkers().get("ecosystem_type"));
        assertEquals("unique_area_ids", r.summaryDimensions().get("area_id"));
    }

    @Test
    void bundled_non_commercial_rules() {
        SchemaRules r = loader.loadDefault(DatasetVariant.NON_COMMERCIAL);
        assertTrue(r.requiredColumns().contains("island"));
        assertFalse(r.columnTypes().containsKey("area_id"));
        assertEquals(Set.of("Herbivores"), r.categoricalValues().get("species_group"));
        assertFalse(r.aggregateMarkers().containsKey("species_group"));
        assertTrue(r.yearBounds().contains(2022));
        assertFalse(r.yearBounds().contains(2004));
        assertTrue(r.displayColumns().contains("island_olelo"));
    }

    @Test
    void null_override_uses_bundled_rules() {
        SchemaRules r = loader.load(DatasetVariant.COMMERCIAL, null);
        assertEquals(loader.loadDefault(DatasetVariant.COMMERCIAL).requiredColumns(), r.requiredColumns());
    }

    @Test
    void override_file_replaces_bundled_rules() throws Exception {
        Path f = Files.writeString(dir.resolve("rules.json"), "{"
                + "\"variant\":\"commercial\","
                + "\"required_columns\":[\"year\",\"exchange_value\"],"
                + "\"column_types\":{\"year\":\"int\",\"exchange_value\":\"double\"},"
                + "\"ranges\":{\"year\":{\"min\":2000,\"max\":2001}}"
                + "}");
        SchemaRules r = loader.load(DatasetVariant.COMMERCIAL, f);
        assertEquals(List.of("year", "exchange_value"), r.requiredColumns());
        assertFalse(r.yearBounds().contains(1999));
        assertTrue(r.categoricalValues().isEmpty());
    }

    @Test
    void emptyClosedSetIsRejected() throws Exception {
        assertThrows(ConfigurationException.class, () -> parse("{"
                + "\"required_columns\":[\"year\",\"exchange_value\"],"
                + "\"categorical_values\":{\"county\":[]}}"));
    }

    @Test
    void markerOutsideClosedSetIsRejected() throws Exception {
        assertThrows(ConfigurationException.class, () -> parse("{"
                + "\"required_columns\":[\"year\",\"exchange_value\"],"
                + "\"categorical_values\":{\"species_group\":[\"Pelagics\"]},"
                + "\"aggregate_markers\":{\"species_group\":[\"All Species\"]}}"));
    }

    @Test
    void unknownColumnTypeIsRejected() throws Exception {
        assertThrows(ConfigurationException.class, () -> parse("{"
                + "\"required_columns\":[\"year\",\"exchange_value\"],"
                + "\"column_types\":{\"year\":\"date\"}}"));
    }

    @Test
    void rangeOnStringColumnIsRejected() throws Exception {
        assertThrows(ConfigurationException.class, () -> parse("{"
                + "\"required_columns\":[\"year\",\"exchange_value\",\"county\"],"
                + "\"ranges\":{\"county\":{\"min\":1}}}"));
    }

    @Test
    void valueColumnMustBeRequired() throws Exception {
        assertThrows(ConfigurationException.class, () -> parse("{\"required_columns\":[\"year\"]}"));
    }

    @Test
    void declaredVariantMustMatch() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.parse(
                DatasetVariant.COMMERCIAL,
                mapper.readTree("{\"variant\":\"non_commercial\",\"required_columns\":[\"year\",\"exchange_value\"]}"),
                "inline"));
        assertTrue(e.getMessage().contains("non_commercial"));
    }

    @Test
    void missing_or_malformed_file_is_a_configuration_error() throws Exception {
        assertThrows(ConfigurationException.class,
                () -> loader.loadFile(DatasetVariant.COMMERCIAL, dir.resolve("absent.json")));
        Path bad = Files.writeString(dir.resolve("bad.json"), "{ not json");
        assertThrows(ConfigurationException.class, () -> loader.loadFile(DatasetVariant.COMMERCIAL, bad));
    }

    private SchemaRules parse(String json) throws Exception {
        return loader.parse(DatasetVariant.COMMERCIAL, mapper.readTree(json), "inline");
    }
}
