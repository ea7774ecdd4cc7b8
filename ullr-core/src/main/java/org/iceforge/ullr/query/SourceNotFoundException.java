package org.iceforge.ullr.query;

public class SourceNotFoundException extends LogInsightsException {

    private final String source;

    public SourceNotFoundException(String source, Throwable cause) {
        super("Log group '" + source + "' does not exist", cause);
        this.source = source;
    }

    public SourceNotFoundException(String source) {
        this(source, null);
    }

    public String source() {
        return source;
    }

    @Override
    public String errorCode() {
        return "SOURCE_NOT_FOUND";
    }
}
