package org.iceforge.ullr.logs;

import org.iceforge.ullr.query.QueryModels;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Row and metadata models shared by the backend SPI, the decoder and the schema inferencer.
 */
public final class LogModels {
    private LogModels() {}

    /** Backend-reserved name of the field carrying the full log line. */
    public static final String MESSAGE_FIELD = "@message";

    /** Backend-reserved name of the record timestamp field. */
    public static final String TIMESTAMP_FIELD = "@timestamp";

    public record RawField(String name, String value) {
        public RawField {
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * One matched record exactly as the backend returned it. Field order is kept for display only.
     */
    public record RawRow(List<RawField> fields) {
        public RawRow {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }

        public static RawRow of(String... namesAndValues) {
            if (namesAndValues.length % 2 != 0) {
                throw new IllegalArgumentException("expected name/value pairs, got " + namesAndValues.length + " items");
            }
            RawField[] out = new RawField[namesAndValues.length / 2];
            for (int i = 0; i < out.length; i++) {
                out[i] = new RawField(namesAndValues[2 * i], namesAndValues[2 * i + 1]);
            }
            return new RawRow(List.of(out));
        }

        public Optional<String> value(String name) {
            for (RawField f : fields) {
                if (f.name().equals(name)) return Optional.ofNullable(f.value());
            }
            return Optional.empty();
        }

        public boolean has(String name) {
            for (RawField f : fields) {
                if (f.name().equals(name)) return true;
            }
            return false;
        }
    }

    /**
     * A raw row plus the top-level keys lifted out of a JSON message body.
     * Flattened values are typed: String, Number, Boolean, List, Map or null.
     */
    public record DecodedRow(RawRow raw, Map<String, Object> flattened) {
        public DecodedRow {
            Objects.requireNonNull(raw, "raw");
            flattened = flattened == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(flattened));
        }

        public static DecodedRow passthrough(RawRow raw) {
            return new DecodedRow(raw, Map.of());
        }

        /** Raw fields first, in backend order, followed by flattened fields. */
        public Map<String, Object> fields() {
            Map<String, Object> out = new LinkedHashMap<>();
            for (RawField f : raw.fields()) out.put(f.name(), f.value());
            flattened.forEach(out::putIfAbsent);
            return out;
        }
    }

    /** Backend query status as reported by a poll. */
    public enum BackendStatus {
        SCHEDULED,
        RUNNING,
        COMPLETE,
        FAILED,
        CANCELLED,
        TIMEOUT,
        UNKNOWN;

        public boolean inProgress() {
            return this == SCHEDULED || this == RUNNING || this == UNKNOWN;
        }
    }

    /**
     * Result of one status check. {@code rows} is only populated once the status is COMPLETE.
     */
    public record QueryPoll(BackendStatus status,
                            List<RawRow> rows,
                            QueryModels.QueryStatistics statistics,
                            String reason) {
        public QueryPoll {
            Objects.requireNonNull(status, "status");
        }

        public static QueryPoll inProgress(BackendStatus status) {
            return new QueryPoll(status, null, null, null);
        }

        public static QueryPoll complete(List<RawRow> rows, QueryModels.QueryStatistics statistics) {
            return new QueryPoll(BackendStatus.COMPLETE, rows, statistics, null);
        }

        public static QueryPoll terminal(BackendStatus status, String reason) {
            return new QueryPoll(status, null, null, reason);
        }
    }

    public record LogSource(String name, String arn, Instant createdAt, Integer retentionDays, Long storedBytes) {}

    public record SavedQuery(String queryDefinitionId,
                             String name,
                             String queryString,
                             Instant lastModified,
                             List<String> logGroupNames) {}
}
