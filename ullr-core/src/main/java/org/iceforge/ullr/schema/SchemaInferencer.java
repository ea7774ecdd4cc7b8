package org.iceforge.ullr.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.iceforge.ullr.logs.LogModels;

import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Derives a field-to-type map from a sample of decoded rows.
 * <p>
 * The result only describes what the sample contained; it is not a constraint on the log group.
 * Output is keyed by field name in natural order and does not depend on the order of the input rows.
 * <p>
 * Backend fields arrive as strings and are classified by their text. Values flattened out of a JSON
 * message keep their JSON type, so the string {@code "5"} and the number {@code 5} differ.
 * <p>
 * UNKNOWN is the bottom of the type order: a field seen only as null may become any concrete type
 * once a larger sample shows a value. A concrete type only ever stays put or widens to MIXED.
 */
public class SchemaInferencer {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final ObjectReader reader;

    public SchemaInferencer(ObjectMapper mapper) {
        this.reader = Objects.requireNonNull(mapper, "mapper").reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public SortedMap<String, SchemaEntry> infer(Collection<LogModels.DecodedRow> rows) {
        Map<String, Observation> seen = new TreeMap<>();
        if (rows != null) {
            for (LogModels.DecodedRow row : rows) {
                Set<String> inRow = new HashSet<>();
                for (LogModels.RawField f : row.raw().fields()) {
                    observe(seen, inRow, f.name(), classifyText(f.value()));
                }
                for (Map.Entry<String, Object> e : row.flattened().entrySet()) {
                    observe(seen, inRow, e.getKey(), classifyValue(e.getValue()));
                }
            }
        }

        SortedMap<String, SchemaEntry> out = new TreeMap<>();
        seen.forEach((name, obs) -> out.put(name, new SchemaEntry(name, obs.verdict(), obs.rows, obs.types)));
        return out;
    }

    /**
     * Type of a backend string value. Boolean tokens are checked before numbers, then JSON shape.
     */
    public FieldType classifyText(String value) {
        if (value == null) return FieldType.UNKNOWN;
        String t = value.trim();
        if (t.isEmpty()) return FieldType.STRING;
        if (t.equalsIgnoreCase("true") || t.equalsIgnoreCase("false")) return FieldType.BOOLEAN;
        if (NUMBER.matcher(t).matches()) return FieldType.NUMBER;

        char c = t.charAt(0);
        if (c == '{' || c == '[') {
            try {
                JsonNode n = reader.readTree(t);
                if (n != null && n.isObject()) return FieldType.OBJECT;
                if (n != null && n.isArray()) return FieldType.ARRAY;
            } catch (JsonProcessingException ignored) {
                // brace-prefixed text that is not JSON is still text
            }
        }
        return FieldType.STRING;
    }

    /** Type of a value produced by JSON decoding. */
    public FieldType classifyValue(Object value) {
        if (value == null) return FieldType.UNKNOWN;
        if (value instanceof Boolean) return FieldType.BOOLEAN;
        if (value instanceof Number) return FieldType.NUMBER;
        if (value instanceof Map<?, ?>) return FieldType.OBJECT;
        if (value instanceof Collection<?> || value.getClass().isArray()) return FieldType.ARRAY;
        return FieldType.STRING;
    }

    private static void observe(Map<String, Observation> seen, Set<String> inRow, String name, FieldType type) {
        Observation obs = seen.computeIfAbsent(name, k -> new Observation());
        if (inRow.add(name)) obs.rows++;
        if (type.concrete()) obs.types.add(type);
    }

    private static final class Observation {
        private final EnumSet<FieldType> types = EnumSet.noneOf(FieldType.class);
        private int rows;

        FieldType verdict() {
            if (types.isEmpty()) return FieldType.UNKNOWN;
            if (types.size() > 1) return FieldType.MIXED;
            return types.iterator().next();
        }
    }
}
