package org.iceforge.ullr.insights;

import org.iceforge.ullr.logs.LogsBackendException;
import org.iceforge.ullr.query.LogInsightsException;

/**
 * A metadata lookup (log group listing, existence check, saved queries) failed at the backend.
 */
public class BackendUnavailableException extends LogInsightsException {

    private final LogsBackendException.Kind kind;

    public BackendUnavailableException(String message, LogsBackendException cause) {
        super(message, cause);
        this.kind = cause.kind();
    }

    public LogsBackendException.Kind kind() {
        return kind;
    }

    @Override
    public String errorCode() {
        return "BACKEND_UNAVAILABLE";
    }
}
