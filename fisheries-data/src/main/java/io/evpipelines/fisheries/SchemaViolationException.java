package io.evpipelines.fisheries;

import java.util.List;

/**
 * The input lacks required columns.
 */
public class SchemaViolationException extends VariantFailureException {
    private final List<String> missingColumns;

    public SchemaViolationException(DatasetVariant variant, List<String> missingColumns) {
        super(variant, "Missing required columns: " + missingColumns);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> missingColumns() { return missingColumns; }
}
