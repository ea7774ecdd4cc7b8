package org.iceforge.ullr.query;

/**
 * The backend ended the query in a failure state. {@link #reason()} is what the backend reported.
 */
public class QueryExecutionFailedException extends LogInsightsException {

    private final String queryId;
    private final QueryModels.QueryState state;
    private final String reason;

    public QueryExecutionFailedException(String queryId, QueryModels.QueryState state, String reason, Throwable cause) {
        super("Query " + queryId + " ended " + state + (reason == null ? "" : ": " + reason), cause);
        this.queryId = queryId;
        this.state = state;
        this.reason = reason;
    }

    public QueryExecutionFailedException(String queryId, QueryModels.QueryState state, String reason) {
        this(queryId, state, reason, null);
    }

    public String queryId() { return queryId; }
    public QueryModels.QueryState state() { return state; }
    public String reason() { return reason; }

    @Override
    public String errorCode() {
        return "QUERY_EXECUTION_FAILED";
    }
}
