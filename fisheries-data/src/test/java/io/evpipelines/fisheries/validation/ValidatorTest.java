package io.evpipelines.fisheries.validation;

import com.codahale.metrics.MetricRegistry;
import io.evpipelines.fisheries.rules.SchemaRules;
import io.evpipelines.metrics.Metrics;
import io.evpipelines.table.Table;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static io.evpipelines.fisheries.FisheriesFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class ValidatorTest {
    private final Validator validator = new Validator();
    private final SchemaRules comm = commercialRules();
    private final SchemaRules nonComm = nonCommercialRules();

    @Test
    void clean_commercial_table_passes_every_check() {
        Table t = commercial(
                comm("1997", "1", DEEP7, REEF, "10"),
                comm("2021", "82", "Pelagics", OPEN_OCEAN, "0"),
                comm("2021", "82", ALL_SPECIES, ALL_ECOSYSTEMS, "10"));
        ValidationReport report = validator.validate(t, comm);
        assertTrue(report.passed());
        assertFalse(report.isFatal());
        assertEquals(4, report.checks().size());
        assertEquals(3, report.rowCount());
        assertEquals(0, report.warningCount());
        assertTrue(report.offendingRows().isEmpty());
    }

    @Test
    void missing_value_column_is_fatal_and_stops_validation() {
        Table t = withoutColumn(areaHundred(), "exchange_value");
        ValidationReport report = validator.validate(t, comm);
        assertTrue(report.isFatal());
        assertFalse(report.passed());
        assertEquals(List.of("exchange_value"), report.missingColumns());
        assertEquals(1, report.checks().size());
        assertTrue(report.result(CheckCategory.TYPE).isEmpty());
    }

    @Test
    void missing_optional_column_is_not_a_violation() {
        Table t = withoutColumn(areaHundred(), "county_olelo");
        assertFalse(validator.validate(t, comm).isFatal());
    }

    @Test
    void nonNumericCellsAreTypeWarnings() {
        Table t = commercial(
                comm("2021", "5", DEEP7, REEF, "10"),
                comm("twenty", "5", DEEP7, REEF, "n/a"));
        ValidationReport report = validator.validate(t, comm);
        CheckResult types = report.result(CheckCategory.TYPE).orElseThrow();
        assertEquals(2, types.violations().size());
        assertEquals(Set.of(1L), types.offendingRows());
        assertEquals(Set.of("twenty"), types.offendingValues("year"));
        assertFalse(report.isFatal());
        // unparsable cells are not also reported as out of range
        assertTrue(report.result(CheckCategory.RANGE).orElseThrow().passed());
    }

    @Test
    void zero_fraction_year_is_an_integer() {
        Table t = commercial(comm("2021.0", "5", DEEP7, REEF, "10"));
        assertTrue(validator.checkTypes(t, comm).passed());
    }

    @Test
    void outOfRangeYearIsAWarning() {
        Table t = commercial(
                comm("1990", "5", DEEP7, REEF, "10"),
                comm("2021", "5", DEEP7, REEF, "10"));
        ValidationReport report = validator.validate(t, comm);
        CheckResult ranges = report.result(CheckCategory.RANGE).orElseThrow();
        assertEquals(Set.of("1990"), ranges.offendingValues("year"));
        assertEquals(Severity.WARNING, ranges.severity());
        assertFalse(report.isFatal());
        assertEquals(Set.of(0L), report.offendingRows());
    }

    @Test
    void negative_value_and_unknown_area_are_range_warnings() {
        Table t = commercial(comm("2021", "100", DEEP7, REEF, "-1"));
        CheckResult ranges = validator.checkRanges(t, comm);
        assertEquals(2, ranges.violations().size());
        assertEquals(Set.of("100"), ranges.offendingValues("area_id"));
        assertEquals(Set.of("-1"), ranges.offendingValues("exchange_value"));
    }

    @Test
    void non_commercial_accepts_years_up_to_2022() {
        assertTrue(validator.checkRanges(nonCommercialSample(), nonComm).passed());
    }

    @Test
    void unexpectedSpeciesIsACategoricalWarning() {
        Table t = nonCommercial(
                nonComm("2010", "Oahu", "Herbivores", REEF, "5"),
                nonComm("2010", "Oahu", "Bottomfish", REEF, "5"));
        ValidationReport report = validator.validate(t, nonComm);
        CheckResult categories = report.result(CheckCategory.CATEGORICAL).orElseThrow();
        assertEquals(Set.of("Bottomfish"), categories.offendingValues("species_group"));
        assertEquals(Set.of(1L), categories.offendingRows());
        assertFalse(report.isFatal());
    }

    @Test
    void validation_leaves_the_table_untouched() {
        Table t = areaHundred();
        List<?> before = List.copyOf(t.rows());
        validator.validate(t, comm);
        assertEquals(before, t.rows());
        assertEquals(4, t.size());
    }

    @Test
    void counts_violations_per_category() {
        MetricRegistry registry = new MetricRegistry();
        new Validator(new Metrics(registry)).validate(commercial(comm("1990", "5", DEEP7, REEF, "10")), comm);
        assertEquals(1, registry.counter("commercial.validation.range.violations").getCount());
        assertEquals(0, registry.counter("commercial.validation.type.violations").getCount());
        assertEquals(1, registry.timer("commercial.validation.time").getCount());
    }
}
