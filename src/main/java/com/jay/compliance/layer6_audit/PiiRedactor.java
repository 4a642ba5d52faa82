package com.jay.compliance.layer6_audit;

import com.jay.compliance.config.ComplianceConfig;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Layer 6 — PII redaction and identifier hashing for anything that crosses into logs.
 */
public class PiiRedactor {

    public static final String PLACEHOLDER = "[REDACTED]";

    // Applied in order: emails first so their digits are not half-eaten by the phone rule
    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+\\.[a-zA-Z0-9-.]+"),
        Pattern.compile("\\b[A-Z]{2}\\s*\\d{8,}\\b"),
        Pattern.compile("\\+?\\d[\\d\\-\\s]{6,}\\d")
    );

    private static final String HMAC = "HmacSHA256";

    private final byte[] key;

    public PiiRedactor(String secretKey) {
        String k = secretKey == null || secretKey.isEmpty() ? "default-key" : secretKey;
        this.key = k.getBytes(StandardCharsets.UTF_8);
    }

    public static PiiRedactor from(ComplianceConfig config) {
        return new PiiRedactor(config.security().getPiiHashKey());
    }

    /** Replaces email-like, phone-like and registry-id-like substrings with {@link #PLACEHOLDER}. */
    public String redact(String text) {
        if (text == null || text.isEmpty()) return text;
        String out = text;
        for (Pattern p : PATTERNS) {
            out = p.matcher(out).replaceAll(PLACEHOLDER);
        }
        return out;
    }

    /** Deterministic keyed hash (HMAC-SHA256, hex) of an identifier. Empty input hashes to "". */
    public String hashIdentifier(String value) {
        if (value == null || value.isEmpty()) return "";
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(key, HMAC));
            return HexFormat.of().formatHex(mac.doFinal(value.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is mandatory on every JRE
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
