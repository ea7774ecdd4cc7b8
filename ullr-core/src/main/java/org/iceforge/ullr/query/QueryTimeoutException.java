package org.iceforge.ullr.query;

import java.time.Duration;

/**
 * The polling ceiling elapsed before the query reached a terminal state.
 * The remote query may still be running.
 */
public class QueryTimeoutException extends LogInsightsException {

    private final String queryId;
    private final Duration elapsed;

    public QueryTimeoutException(String queryId, Duration elapsed) {
        super("Query " + queryId + " did not finish within " + elapsed.toMillis() + " ms");
        this.queryId = queryId;
        this.elapsed = elapsed;
    }

    public String queryId() { return queryId; }
    public Duration elapsed() { return elapsed; }

    @Override
    public String errorCode() {
        return "QUERY_TIMEOUT";
    }
}
