package com.jay.compliance.model.enums;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public static RiskLevel fromScore(double score) {
        if (score >= 0.75) return CRITICAL;
        if (score >= 0.50) return HIGH;
        if (score >= 0.25) return MEDIUM;
        return LOW;
    }
}
