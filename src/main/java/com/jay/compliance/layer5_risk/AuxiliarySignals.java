package com.jay.compliance.layer5_risk;

/**
 * Scoring inputs that have no upstream source yet. The orchestrator passes
 * {@link #placeholders()} until PEP, UBO and name-history sources exist.
 */
public record AuxiliarySignals(int pepHits, boolean uboMissingAndRequired, int recentNameChanges) {

    public static AuxiliarySignals placeholders() {
        return new AuxiliarySignals(0, false, 0);
    }
}
