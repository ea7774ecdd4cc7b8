package org.iceforge.ullr.query;

import org.iceforge.ullr.logs.LogModels;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Models for one query run.
 */
public final class QueryModels {
    private QueryModels() {}

    public enum QueryState {
        SUBMITTED,
        RUNNING,
        COMPLETE,
        FAILED,
        CANCELLED,
        TIMED_OUT;

        public boolean terminal() {
            return this != SUBMITTED && this != RUNNING;
        }
    }

    /**
     * Half-open time range {@code [startMillis, endMillis)} in epoch milliseconds.
     */
    public record TimeWindow(long startMillis, long endMillis) {
        public TimeWindow {
            if (endMillis <= startMillis) {
                throw new IllegalArgumentException(
                        "window end must be after start: start=" + startMillis + " end=" + endMillis);
            }
        }

        /**
         * Fills in whatever bound the caller left out. A missing end is "now"; a missing start trails
         * the end by {@code lookback}.
         */
        public static TimeWindow resolve(Long startMillis, Long endMillis, Clock clock, Duration lookback) {
            Objects.requireNonNull(clock, "clock");
            Duration lb = (lookback == null || lookback.isNegative() || lookback.isZero()) ? Duration.ofHours(24) : lookback;
            long end = endMillis != null ? endMillis : clock.millis();
            long start = startMillis != null ? startMillis : end - lb.toMillis();
            return new TimeWindow(start, end);
        }

        public static TimeWindow trailing(Clock clock, Duration lookback) {
            return resolve(null, null, clock, lookback);
        }

        public Instant start() { return Instant.ofEpochMilli(startMillis); }
        public Instant end() { return Instant.ofEpochMilli(endMillis); }
    }

    public record QueryStatistics(double recordsMatched, double recordsScanned, double bytesScanned) {
        public static QueryStatistics empty() {
            return new QueryStatistics(0d, 0d, 0d);
        }
    }

    public record QueryResult(String queryId,
                              QueryState state,
                              List<LogModels.RawRow> rows,
                              QueryStatistics statistics,
                              int polls,
                              Duration elapsed) {
        public QueryResult {
            rows = rows == null ? List.of() : List.copyOf(rows);
            statistics = statistics == null ? QueryStatistics.empty() : statistics;
        }
    }
}
