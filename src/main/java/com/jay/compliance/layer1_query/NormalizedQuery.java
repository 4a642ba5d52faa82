package com.jay.compliance.layer1_query;

/**
 * Classification of a raw query. The two flags are independent: a string can be
 * neither, or in principle both, and callers must not assume they exclude each other.
 */
public record NormalizedQuery(String normalizedName, boolean registrationNumber, boolean vatNumber) {}
