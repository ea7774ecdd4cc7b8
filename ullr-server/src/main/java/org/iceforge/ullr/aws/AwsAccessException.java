package org.iceforge.ullr.aws;

public class AwsAccessException extends RuntimeException {
    public AwsAccessException(String message, Throwable cause) { super(message, cause); }
    public AwsAccessException(String message) { super(message); }
}
