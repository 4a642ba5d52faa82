package com.jay.compliance.layer6_audit;

import com.jay.compliance.layer1_query.CompanyQuery;
import com.jay.compliance.model.AuditRecord;
import com.jay.compliance.model.enums.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The only place audit data is written to logs. Query text is hashed, source tags
 * and summaries pass through PII redaction first.
 */
@Component
public class AuditLogger {

    private static final Logger AUDIT = LoggerFactory.getLogger("compliance.audit");

    private final PiiRedactor redactor;

    public AuditLogger(PiiRedactor redactor) {
        this.redactor = redactor;
    }

    public void profileServed(CompanyQuery query, AuditRecord audit, boolean cacheHit, long elapsedMs) {
        if (!AUDIT.isInfoEnabled()) return;
        AUDIT.info("profile country={} query={} tier={} cacheHit={} elapsedMs={} sources={} calls={}",
            query.country(),
            redactor.hashIdentifier(query.raw().trim().toLowerCase(Locale.ROOT)),
            query.premium() ? "premium" : "basic",
            cacheHit,
            elapsedMs,
            redactTags(audit),
            redactCalls(audit.rawCalls()));
    }

    public void riskAssessed(String country, String registrationNumber, AuditRecord audit, RiskLevel level) {
        if (!AUDIT.isInfoEnabled()) return;
        AUDIT.info("risk country={} subject={} level={} sources={} calls={}",
            country,
            redactor.hashIdentifier(registrationNumber),
            level,
            redactTags(audit),
            redactCalls(audit.rawCalls()));
    }

    public void forgetRequested(String subjectHash, Long jobId) {
        AUDIT.info("forget requested job={} subject={}", jobId, subjectHash);
    }

    String redactTags(AuditRecord audit) {
        return audit.sources().stream()
            .map(redactor::redact)
            .collect(Collectors.joining(",", "[", "]"));
    }

    private String redactCalls(Map<String, Map<String, Object>> calls) {
        return calls.entrySet().stream()
            .map(e -> redactor.redact(e.getKey()) + "=" + redactor.redact(String.valueOf(e.getValue())))
            .collect(Collectors.joining(",", "{", "}"));
    }
}
