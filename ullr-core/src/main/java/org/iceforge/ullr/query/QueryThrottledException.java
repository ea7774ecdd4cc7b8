package org.iceforge.ullr.query;

/**
 * Polling kept hitting rate limits or transient network faults until the retry budget ran out.
 */
public class QueryThrottledException extends LogInsightsException {

    private final String queryId;
    private final int attempts;

    public QueryThrottledException(String queryId, int attempts, Throwable cause) {
        this("Query " + queryId + " still throttled or unreachable after " + attempts + " attempts",
                queryId, attempts, cause);
    }

    /** For calls made before a query id exists. */
    public QueryThrottledException(String message, String queryId, int attempts, Throwable cause) {
        super(message, cause);
        this.queryId = queryId;
        this.attempts = attempts;
    }

    public String queryId() { return queryId; }
    public int attempts() { return attempts; }

    @Override
    public String errorCode() {
        return "QUERY_THROTTLED";
    }
}
