package io.evpipelines.fisheries.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Diagnostics output: every check of a report with its severity, pass flag and violations.
 */
public class ReportJsonWriter {
    private final ObjectMapper mapper;

    public ReportJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ReportJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Path write(ValidationReport report, Path file) throws IOException {
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        mapper.writeValue(file.toFile(), toJson(report));
        return file;
    }

    public ObjectNode toJson(ValidationReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("data_type", report.variant().key());
        root.put("row_count", report.rowCount());
        root.put("passed", report.passed());
        root.put("fatal", report.isFatal());
        root.put("warning_count", report.warningCount());
        ArrayNode checks = root.putArray("checks");
        for (CheckResult c : report.checks()) {
            ObjectNode cn = checks.addObject();
            cn.put("category", c.category().key());
            cn.put("severity", c.severity().name());
            cn.put("passed", c.passed());
            cn.put("violation_count", c.violations().size());
            ArrayNode vs = cn.putArray("violations");
            for (Violation v : c.violations()) {
                ObjectNode vn = vs.addObject();
                if (v.isRowLevel()) vn.put("row", v.rowIndex());
                vn.put("column", v.column());
                if (v.value() == null) vn.putNull("value");
                else vn.put("value", v.value());
                vn.put("reason", v.reason());
            }
        }
        return root;
    }
}
