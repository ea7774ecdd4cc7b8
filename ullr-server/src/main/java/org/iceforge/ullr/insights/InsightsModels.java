package org.iceforge.ullr.insights;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.iceforge.ullr.query.QueryModels;
import org.iceforge.ullr.schema.FieldType;
import org.iceforge.ullr.schema.SchemaEntry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

public final class InsightsModels {
    private InsightsModels() {}

    /**
     * @param logGroupNames one name or a list of names
     * @param startTime epoch millis, inclusive; defaults to {@code endTime} minus the default lookback
     * @param endTime epoch millis, exclusive; defaults to now
     */
    public record QueryRequest(
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            List<String> logGroupNames,
            String queryString,
            Long startTime,
            Long endTime
    ) {}

    public record FieldsRequest(
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            List<String> logGroupNames
    ) {}

    public record QueryResponse(
            String queryId,
            QueryModels.QueryState status,
            List<String> logGroupNames,
            QueryModels.QueryStatistics statistics,
            int polls,
            long elapsedMillis,
            List<Map<String, Object>> results
    ) {}

    /**
     * Fields seen in one sample. The map is keyed by field name in natural order.
     */
    public record FieldDiscovery(
            String queryId,
            List<String> logGroupNames,
            int sampledRows,
            SortedMap<String, SchemaEntry> fields
    ) {
        public Map<String, FieldType> types() {
            Map<String, FieldType> out = new LinkedHashMap<>();
            fields.forEach((name, entry) -> out.put(name, entry.type()));
            return out;
        }
    }

    public record SourceExists(String logGroupName, boolean exists) {}

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ErrorResponse(String error, String message, Map<String, Object> details) {}
}
