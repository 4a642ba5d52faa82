package com.jay.compliance.layer4_orchestrator;

import com.jay.compliance.layer2_sources.RegistryHit;

import java.time.Instant;
import java.util.List;

/** Cached registry search results with the time they were fetched. */
public record SearchPage(List<RegistryHit> hits, Instant pulledAt) {

    public SearchPage {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }
}
