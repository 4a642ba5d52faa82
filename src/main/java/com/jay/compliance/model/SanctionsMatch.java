package com.jay.compliance.model;

import java.util.Map;

public record SanctionsMatch(String source,
                             String entityId,
                             double confidence,
                             String matchedName,
                             Map<String, Object> raw) {}
