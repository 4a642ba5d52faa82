package com.jay.compliance.layer2_sources;

/**
 * Base of the adapter error taxonomy. Adapters never retry internally; every
 * call is independently retryable by its caller.
 */
public abstract class SourceException extends RuntimeException {

    private final String source;

    protected SourceException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    public abstract SourceErrorType getType();
}
