package org.iceforge.ullr.query;

/**
 * The backend refused to start the query: malformed query text, invalid parameters or missing
 * authorization. Never retried.
 */
public class QuerySubmissionException extends LogInsightsException {

    public QuerySubmissionException(String message, Throwable cause) {
        super(message, cause);
    }

    public QuerySubmissionException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "QUERY_SUBMISSION_FAILED";
    }
}
