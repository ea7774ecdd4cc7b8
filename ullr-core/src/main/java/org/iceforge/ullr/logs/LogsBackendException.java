package org.iceforge.ullr.logs;

/**
 * Fault raised by a {@link LogInsightsBackend}, classified so callers can decide on retry.
 */
public class LogsBackendException extends RuntimeException {

    public enum Kind {
        THROTTLED,
        TRANSIENT,
        INVALID_REQUEST,
        ACCESS_DENIED,
        NOT_FOUND,
        INTERNAL;

        public boolean retryable() {
            return this == THROTTLED || this == TRANSIENT;
        }
    }

    private final Kind kind;

    public LogsBackendException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? Kind.INTERNAL : kind;
    }

    public LogsBackendException(Kind kind, String message) {
        this(kind, message, null);
    }

    public Kind kind() {
        return kind;
    }
}
