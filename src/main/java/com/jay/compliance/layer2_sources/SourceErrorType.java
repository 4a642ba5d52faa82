package com.jay.compliance.layer2_sources;

public enum SourceErrorType {
    NOT_FOUND,
    RATE_LIMITED,
    UPSTREAM_ERROR,
    TIMEOUT
}
