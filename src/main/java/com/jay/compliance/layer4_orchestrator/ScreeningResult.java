package com.jay.compliance.layer4_orchestrator;

import com.jay.compliance.model.SanctionsMatch;
import com.jay.compliance.model.enums.RiskLevel;

import java.time.Instant;
import java.util.List;

public record ScreeningResult(int totalMatches,
                              double riskScore,
                              RiskLevel riskLevel,
                              List<SanctionsMatch> matches,
                              List<String> sources,
                              Instant checkedAt) {}
