package com.jay.compliance.layer2_sources;

public class SourceTimeoutException extends SourceException {

    public SourceTimeoutException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }

    @Override
    public SourceErrorType getType() {
        return SourceErrorType.TIMEOUT;
    }
}
