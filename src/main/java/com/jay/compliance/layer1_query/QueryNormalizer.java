package com.jay.compliance.layer1_query;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Layer 1 — Query Normalizer.
 * Classifies a free-form query (registration number, VAT id, company name) and
 * produces the canonical lookup term. Pure: no I/O, never throws.
 */
@Component
public class QueryNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public NormalizedQuery normalize(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        return new NormalizedQuery(
            trimmed.toLowerCase(Locale.ROOT),
            isRegistrationNumber(trimmed),
            isVatNumber(trimmed));
    }

    /** Digits of a registration-number query with all whitespace removed, e.g. "6875 0110" → "68750110". */
    public String registrationDigits(String raw) {
        return raw == null ? "" : stripWhitespace(raw);
    }

    /**
     * Cache fingerprint of a profile request: profile:{COUNTRY}:{normalizedName}:{premium|basic}.
     * Equal logical queries (case, surrounding whitespace) always produce the same key.
     */
    public String profileKey(CompanyQuery query) {
        return "profile:" + query.country() + ":" + normalize(query.raw()).normalizedName() + ":"
            + (query.premium() ? "premium" : "basic");
    }

    public String searchKey(String country, String raw) {
        String cc = country == null ? "" : country.trim().toUpperCase(Locale.ROOT);
        return "search:" + cc + ":" + normalize(raw).normalizedName();
    }

    private boolean isRegistrationNumber(String s) {
        return isAllDigits(stripWhitespace(s));
    }

    private boolean isVatNumber(String s) {
        if (s.length() <= 2) return false;
        if (!Character.isLetter(s.charAt(0)) || !Character.isLetter(s.charAt(1))) return false;
        return isAllDigits(stripWhitespace(s.substring(2)));
    }

    private static boolean isAllDigits(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    private static String stripWhitespace(String s) {
        return WHITESPACE.matcher(s).replaceAll("");
    }
}
