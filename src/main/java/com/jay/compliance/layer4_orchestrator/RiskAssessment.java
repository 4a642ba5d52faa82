package com.jay.compliance.layer4_orchestrator;

import com.jay.compliance.model.AuditRecord;
import com.jay.compliance.model.CompanyProfile;
import com.jay.compliance.model.SanctionsMatch;
import com.jay.compliance.model.enums.RiskLevel;

import java.time.Instant;
import java.util.List;

/**
 * Risk for one registered company: its registry profile, sanctions screening on
 * the registered name, and the combined score.
 */
public record RiskAssessment(String registrationNumber,
                             String companyName,
                             CompanyProfile company,
                             double riskScore,
                             RiskLevel riskLevel,
                             List<String> factors,
                             int sanctionsHits,
                             List<SanctionsMatch> matches,
                             AuditRecord audit,
                             Instant checkedAt) {}
