package com.jay.compliance.model;

import java.util.Set;

/**
 * Assembled answer for one profile request. This is also the cached value.
 */
public record ProfileResult(CompanyProfile company,
                            BasicChecks basicChecks,
                            SanctionsSection sanctions,
                            RiskResult risk,
                            AuditRecord audit,
                            boolean cacheHit) {

    /** Same result as served from the cache: sources reduced to "cache", call summaries kept. */
    public ProfileResult asCacheHit() {
        return new ProfileResult(company, basicChecks, sanctions, risk,
            new AuditRecord(Set.of("cache"), audit != null ? audit.rawCalls() : null), true);
    }
}
