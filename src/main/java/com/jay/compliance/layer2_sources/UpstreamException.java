package com.jay.compliance.layer2_sources;

public class UpstreamException extends SourceException {

    /** HTTP status, or 0 when the request never produced a response. */
    private final int code;

    public UpstreamException(String source, int code, String message) {
        this(source, code, message, null);
    }

    public UpstreamException(String source, int code, String message, Throwable cause) {
        super(source, message, cause);
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    @Override
    public SourceErrorType getType() {
        return SourceErrorType.UPSTREAM_ERROR;
    }
}
