package com.jay.compliance.layer1_query;

import java.util.Locale;

/**
 * Inbound profile request. Immutable and request-scoped.
 * The country code is trimmed and upper-cased on construction.
 */
public record CompanyQuery(String raw, String country, boolean premium, boolean includeHistory) {

    public CompanyQuery {
        raw = raw == null ? "" : raw;
        country = country == null ? "" : country.trim().toUpperCase(Locale.ROOT);
    }

    public static CompanyQuery basic(String country, String raw) {
        return new CompanyQuery(raw, country, false, false);
    }
}
