package org.iceforge.ullr.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.iceforge.ullr.logs.LogModels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lifts the top-level keys of a JSON message body into sibling fields.
 * <p>
 * Pure and total: a message that is plain text, a JSON scalar or a JSON array passes through
 * untouched, and a flattened key never replaces a field the backend already returned.
 */
public class ResultDecoder {
    private static final Logger logger = LoggerFactory.getLogger(ResultDecoder.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    // a JSON object followed by more text is a plain line, not a payload
    private final ObjectReader strictReader;
    private final String messageField;

    public ResultDecoder(ObjectMapper mapper, String messageField) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.strictReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.messageField = (messageField == null || messageField.isBlank()) ? LogModels.MESSAGE_FIELD : messageField;
    }

    public ResultDecoder(ObjectMapper mapper) {
        this(mapper, LogModels.MESSAGE_FIELD);
    }

    public List<LogModels.DecodedRow> decode(List<LogModels.RawRow> rows) {
        if (rows == null || rows.isEmpty()) return List.of();
        List<LogModels.DecodedRow> out = new ArrayList<>(rows.size());
        for (LogModels.RawRow row : rows) {
            out.add(decode(row));
        }
        return out;
    }

    public LogModels.DecodedRow decode(LogModels.RawRow row) {
        String message = row.value(messageField).orElse(null);
        if (message == null || message.isBlank()) {
            return LogModels.DecodedRow.passthrough(row);
        }

        String trimmed = message.trim();
        // Cheap pre-check: most log lines are plain text
        if (trimmed.charAt(0) != '{') {
            return LogModels.DecodedRow.passthrough(row);
        }

        JsonNode node;
        try {
            node = strictReader.readTree(trimmed);
        } catch (JsonProcessingException e) {
            logger.debug("{} is not valid JSON, passing row through: {}", messageField, e.getOriginalMessage());
            return LogModels.DecodedRow.passthrough(row);
        }
        if (node == null || !node.isObject()) {
            return LogModels.DecodedRow.passthrough(row);
        }

        Map<String, Object> flattened = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (row.has(e.getKey())) {
                logger.debug("Dropping flattened key '{}': shadows a backend field", e.getKey());
                continue;
            }
            flattened.put(e.getKey(), toValue(e.getValue()));
        }
        return new LogModels.DecodedRow(row, flattened);
    }

    private Object toValue(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return null;
        if (n.isTextual()) return n.textValue();
        if (n.isBoolean()) return n.booleanValue();
        if (n.isNumber()) return n.numberValue();
        if (n.isObject()) return mapper.convertValue(n, MAP_TYPE);
        if (n.isArray()) return mapper.convertValue(n, LIST_TYPE);
        return n.asText();
    }
}
