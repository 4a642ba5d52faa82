package com.jay.compliance.layer4_orchestrator;

import com.jay.compliance.layer2_sources.SourceErrorType;

/**
 * Result of one adapter call as seen by the merge step: either a value or a
 * degraded marker naming what went wrong. Adapter exceptions never cross this
 * boundary.
 */
public record SourceOutcome<T>(T value, SourceErrorType errorType) {

    public static <T> SourceOutcome<T> ok(T value) {
        return new SourceOutcome<>(value, null);
    }

    public static <T> SourceOutcome<T> degraded(SourceErrorType errorType) {
        return new SourceOutcome<>(null, errorType);
    }

    public boolean isDegraded() {
        return errorType != null;
    }
}
