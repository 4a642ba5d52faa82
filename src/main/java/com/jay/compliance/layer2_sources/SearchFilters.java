package com.jay.compliance.layer2_sources;

/** Optional narrowing of a registry search; null fields are not sent. */
public record SearchFilters(String registrationNumber, String city, int maxResults) {

    public static SearchFilters limit(int maxResults) {
        return new SearchFilters(null, null, maxResults);
    }

    public static SearchFilters byRegistrationNumber(String registrationNumber, int maxResults) {
        return new SearchFilters(registrationNumber, null, maxResults);
    }
}
