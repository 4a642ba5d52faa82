package com.jay.compliance.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Provenance of one profile result: which sources were consulted and a summary of
 * each call. Summaries hold booleans, counts and error-type names only.
 */
public record AuditRecord(
    @JsonDeserialize(as = LinkedHashSet.class) Set<String> sources,
    @JsonDeserialize(as = LinkedHashMap.class) Map<String, Map<String, Object>> rawCalls) {

    public AuditRecord {
        sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources == null ? Set.of() : sources));
        rawCalls = Collections.unmodifiableMap(new LinkedHashMap<>(rawCalls == null ? Map.of() : rawCalls));
    }
}
