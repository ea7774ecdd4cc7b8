package org.iceforge.ullr.aws;

import org.iceforge.ullr.logs.LogsBackendException;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatchlogs.model.InvalidParameterException;
import software.amazon.awssdk.services.cloudwatchlogs.model.LimitExceededException;
import software.amazon.awssdk.services.cloudwatchlogs.model.MalformedQueryException;
import software.amazon.awssdk.services.cloudwatchlogs.model.ResourceNotFoundException;
import software.amazon.awssdk.services.cloudwatchlogs.model.ServiceUnavailableException;

import java.util.Set;

/**
 * Maps AWS SDK exceptions onto {@link LogsBackendException.Kind}.
 */
public final class AwsErrors {
    private AwsErrors() {}

    private static final Set<String> ACCESS_DENIED_CODES = Set.of(
            "AccessDeniedException",
            "AccessDenied",
            "UnrecognizedClientException",
            "ExpiredTokenException",
            "InvalidClientTokenId");

    public static LogsBackendException.Kind classify(SdkException e) {
        if (e instanceof ResourceNotFoundException) return LogsBackendException.Kind.NOT_FOUND;
        if (e instanceof InvalidParameterException || e instanceof MalformedQueryException) {
            return LogsBackendException.Kind.INVALID_REQUEST;
        }
        // StartQuery reports too many concurrent queries this way
        if (e instanceof LimitExceededException) return LogsBackendException.Kind.THROTTLED;
        if (e instanceof ServiceUnavailableException) return LogsBackendException.Kind.TRANSIENT;

        if (e instanceof AwsServiceException ase) {
            if (ase.isThrottlingException()) return LogsBackendException.Kind.THROTTLED;
            AwsErrorDetails details = ase.awsErrorDetails();
            String code = details == null ? null : details.errorCode();
            if (code != null && ACCESS_DENIED_CODES.contains(code)) return LogsBackendException.Kind.ACCESS_DENIED;
            int status = ase.statusCode();
            if (status == 401 || status == 403) return LogsBackendException.Kind.ACCESS_DENIED;
            if (status == 404) return LogsBackendException.Kind.NOT_FOUND;
            if (status >= 500) return LogsBackendException.Kind.TRANSIENT;
            if (status >= 400) return LogsBackendException.Kind.INVALID_REQUEST;
            return LogsBackendException.Kind.INTERNAL;
        }
        // connect/read timeouts, DNS, pool exhaustion
        if (e instanceof SdkClientException) return LogsBackendException.Kind.TRANSIENT;
        return LogsBackendException.Kind.INTERNAL;
    }

    public static LogsBackendException translate(String operation, SdkException e) {
        LogsBackendException.Kind kind = classify(e);
        return new LogsBackendException(kind, operation + " failed (" + kind + "): " + e.getMessage(), e);
    }
}
