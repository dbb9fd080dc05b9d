package io.evpipelines.fisheries.summary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evpipelines.fisheries.DatasetVariant;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Renders summaries with snake_case keys: {@code pipeline_timestamp}, then one object per variant
 * (null when that variant failed), then {@code overall} and {@code failures} when they apply.
 */
public class SummaryJsonWriter {
    private final ObjectMapper mapper;

    public SummaryJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public SummaryJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Path write(CombinedSummary summary, Path file) throws IOException {
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        mapper.writeValue(file.toFile(), toJson(summary));
        return file;
    }

    public ObjectNode toJson(CombinedSummary summary) {
        ObjectNode root = mapper.createObjectNode();
        root.put("pipeline_timestamp", summary.pipelineTimestamp());
        for (DatasetVariant v : DatasetVariant.values()) {
            SummaryRecord s = summary.summaries().get(v);
            if (s == null) root.putNull(v.key());
            else root.set(v.key(), toJson(s));
        }
        summary.overall().ifPresent(o -> {
            ObjectNode overall = root.putObject("overall");
            overall.put("total_records", o.totalRecords());
            overall.put("total_exchange_value", o.totalExchangeValue());
            putRange(overall.putObject("combined_date_range"), o.combinedDateRange());
        });
        if (!summary.failures().isEmpty()) {
            ObjectNode failures = root.putObject("failures");
            summary.failures().forEach((v, msg) -> failures.put(v.key(), msg));
        }
        return root;
    }

    public ObjectNode toJson(SummaryRecord s) {
        ObjectNode n = mapper.createObjectNode();
        n.put("data_type", s.dataType());
        n.put("processing_timestamp", s.processingTimestamp());
        n.put("raw_row_count", s.rawRowCount());
        n.put("cleaned_row_count", s.cleanedRowCount());
        n.put("rows_removed", s.rowsRemoved());
        putRange(n.putObject("date_range"), s.dateRange());
        n.put("total_exchange_value", s.totalExchangeValue());
        for (Map.Entry<String, List<Object>> e : s.distinctValues().entrySet()) {
            ArrayNode arr = n.putArray(e.getKey());
            for (Object o : e.getValue()) {
                if (o instanceof Long l) arr.add(l);
                else arr.add(String.valueOf(o));
            }
        }
        ObjectNode byYear = n.putObject("records_by_year");
        s.recordsByYear().forEach((y, c) -> byYear.put(String.valueOf(y), c));
        ObjectNode valueByYear = n.putObject("total_value_by_year");
        s.totalValueByYear().forEach((y, v) -> valueByYear.put(String.valueOf(y), v));
        return n;
    }

    private static void putRange(ObjectNode node, DateRange range) {
        if (range.isEmpty()) {
            node.putNull("min_year");
            node.putNull("max_year");
        } else {
            node.put("min_year", range.minYear());
            node.put("max_year", range.maxYear());
        }
    }
}
