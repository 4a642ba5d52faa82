package com.jay.compliance.model;

import com.jay.compliance.model.enums.RiskLevel;

import java.util.List;
import java.util.Map;

public record RiskResult(double score, RiskLevel level, List<String> reasons, Map<String, String> provenance) {

    public RiskResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        provenance = provenance == null ? Map.of() : Map.copyOf(provenance);
    }
}
