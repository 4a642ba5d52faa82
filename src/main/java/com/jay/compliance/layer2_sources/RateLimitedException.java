package com.jay.compliance.layer2_sources;

public class RateLimitedException extends SourceException {

    public RateLimitedException(String source) {
        super(source, source + " rate limit exceeded", null);
    }

    @Override
    public SourceErrorType getType() {
        return SourceErrorType.RATE_LIMITED;
    }
}
