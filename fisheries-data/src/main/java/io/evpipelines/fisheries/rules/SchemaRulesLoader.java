package io.evpipelines.fisheries.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evpipelines.fisheries.ConfigurationException;
import io.evpipelines.fisheries.DatasetVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link SchemaRules} from JSON. The bundled defaults live on the classpath under {@code rules/};
 * a caller may point a variant at its own file instead.
 */
public class SchemaRulesLoader {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaRulesLoader.class);

    private final ObjectMapper mapper;

    public SchemaRulesLoader() {
        this(new ObjectMapper());
    }

    public SchemaRulesLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Rules from {@code override} when given, otherwise the bundled defaults. */
    public SchemaRules load(DatasetVariant variant, Path override) {
        return override == null ? loadDefault(variant) : loadFile(variant, override);
    }

    public SchemaRules loadDefault(DatasetVariant variant) {
        String resource = variant.rulesResource();
        try (InputStream in = SchemaRulesLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Rules resource not found on classpath: " + resource);
            }
            return parse(variant, mapper.readTree(in), resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read rules resource " + resource, e);
        }
    }

    public SchemaRules loadFile(DatasetVariant variant, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Rules file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            LOG.info("Loading {} rules from {}", variant.key(), file);
            return parse(variant, mapper.readTree(in), file.toString());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed rules file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read rules file " + file, e);
        }
    }

    SchemaRules parse(DatasetVariant variant, JsonNode root, String origin) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationException(origin + ": rules must be a JSON object");
        }
        JsonNode declared = root.get("variant");
        if (declared != null && DatasetVariant.fromName(declared.asText()) != variant) {
            throw new ConfigurationException(origin + ": declares variant '" + declared.asText()
                    + "' but was loaded for " + variant.key());
        }
        SchemaRules.Builder b = SchemaRules.builder(variant)
                .requiredColumns(strings(root, "required_columns", origin))
                .optionalColumns(strings(root, "optional_columns", origin))
                .displayColumns(strings(root, "display_columns", origin));
        if (root.hasNonNull("year_column")) b.yearColumn(root.get("year_column").asText());
        if (root.hasNonNull("value_column")) b.valueColumn(root.get("value_column").asText());

        for (Map.Entry<String, JsonNode> e : fields(root, "column_types")) {
            b.columnType(e.getKey(), ColumnType.fromName(e.getValue().asText()));
        }
        for (Map.Entry<String, JsonNode> e : fields(root, "ranges")) {
            JsonNode r = e.getValue();
            Double min = r.hasNonNull("min") ? r.get("min").asDouble() : null;
            Double max = r.hasNonNull("max") ? r.get("max").asDouble() : null;
            try {
                b.range(e.getKey(), new NumericRange(min, max));
            } catch (ConfigurationException ex) {
                throw new ConfigurationException(origin + ": range for '" + e.getKey() + "': " + ex.getMessage(), ex);
            }
        }
        for (Map.Entry<String, JsonNode> e : fields(root, "categorical_values")) {
            b.categorical(e.getKey(), strings(e.getValue(), origin + ".categorical_values." + e.getKey()));
        }
        for (Map.Entry<String, JsonNode> e : fields(root, "aggregate_markers")) {
            b.aggregateMarkers(e.getKey(), strings(e.getValue(), origin + ".aggregate_markers." + e.getKey()));
        }
        for (Map.Entry<String, JsonNode> e : fields(root, "summary_dimensions")) {
            b.summaryDimension(e.getKey(), e.getValue().asText());
        }
        return b.build();
    }

    private static List<String> strings(JsonNode root, String field, String origin) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) return List.of();
        return strings(n, origin + "." + field);
    }

    private static List<String> strings(JsonNode array, String where) {
        if (!array.isArray()) {
            throw new ConfigurationException(where + ": expected a JSON array");
        }
        List<String> out = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            if (!item.isTextual()) {
                throw new ConfigurationException(where + ": expected string values but found " + item);
            }
            out.add(item.asText());
        }
        return out;
    }

    private static List<Map.Entry<String, JsonNode>> fields(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) return List.of();
        if (!n.isObject()) {
            throw new ConfigurationException(field + ": expected a JSON object");
        }
        List<Map.Entry<String, JsonNode>> out = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> it = n.fields();
        while (it.hasNext()) out.add(it.next());
        return out;
    }
}
