package com.jay.compliance.layer6_audit;

import com.jay.compliance.model.AuditRecord;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Accumulates provenance for one orchestrator call. Not thread-safe: the
 * orchestrator records outcomes from the merge step only.
 */
public class AuditTrail {

    private final Set<String> sources = new LinkedHashSet<>();
    private final Map<String, Map<String, Object>> rawCalls = new LinkedHashMap<>();

    public AuditTrail source(String tag) {
        sources.add(tag);
        return this;
    }

    /**
     * Records a call summary. Values must be booleans, numbers or enum names,
     * never response bodies or query text.
     */
    public AuditTrail call(String name, Map<String, Object> summary) {
        for (Object v : summary.values()) {
            if (!(v == null || v instanceof Boolean || v instanceof Number || v instanceof Enum<?>)) {
                throw new IllegalArgumentException("Audit summary for " + name + " may only hold booleans, counts or enum values");
            }
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        summary.forEach((k, v) -> copy.put(k, v instanceof Enum<?> ? ((Enum<?>) v).name() : v));
        rawCalls.put(name, copy);
        return this;
    }

    public AuditRecord toRecord() {
        return new AuditRecord(sources, rawCalls);
    }
}
