package com.jay.compliance.layer5_risk;

import com.jay.compliance.model.CompanyProfile;
import com.jay.compliance.model.RiskResult;
import com.jay.compliance.model.SanctionsSection;

/**
 * Pluggable scoring strategy. Implementations are pure: no I/O, no clock, no
 * randomness. The same input always yields the same score and reasons.
 */
public interface RiskScorer {

    RiskResult score(CompanyProfile profile, SanctionsSection sanctions, AuxiliarySignals signals);
}
