package io.evpipelines.fisheries.io;

import io.evpipelines.fisheries.DatasetVariant;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Date-stamped output file names, e.g. {@code cleaned_commercial_20240131.csv}.
 */
public class OutputNaming {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.BASIC_ISO_DATE;

    private final Path outputDir;
    private final Clock clock;

    public OutputNaming(Path outputDir, Clock clock) {
        this.outputDir = outputDir;
        this.clock = clock;
    }

    public Path outputDir() { return outputDir; }

    public Path cleanedCsv(DatasetVariant variant) {
        return outputDir.resolve(variant.outputPrefix() + "_" + stamp() + ".csv");
    }

    public Path summaryJson() {
        return outputDir.resolve("cleaning_summary_" + stamp() + ".json");
    }

    public Path diagnosticsJson(DatasetVariant variant) {
        return outputDir.resolve("validation_" + variant.key() + "_" + stamp() + ".json");
    }

    private String stamp() {
        return LocalDate.now(clock).format(STAMP);
    }
}
