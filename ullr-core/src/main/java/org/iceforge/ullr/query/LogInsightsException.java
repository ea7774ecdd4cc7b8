package org.iceforge.ullr.query;

/**
 * Root of every error that leaves the query core. Backend-specific exception types never cross it.
 */
public abstract class LogInsightsException extends RuntimeException {

    protected LogInsightsException(String message, Throwable cause) {
        super(message, cause);
    }

    protected LogInsightsException(String message) {
        super(message);
    }

    /** Stable machine-readable code, e.g. {@code QUERY_TIMEOUT}. */
    public abstract String errorCode();
}
