package com.jay.compliance.layer4_orchestrator;

import com.jay.compliance.layer2_sources.RegistryHit;
import com.jay.compliance.model.CompanyProfile;

import java.util.List;

/** What the registry step did and what it found. */
record RegistryLookup(Mode mode, CompanyProfile profile, List<RegistryHit> hits) {

    enum Mode {
        PROFILE,        // direct lookup by registration number
        SEARCH,         // free-text or number-filtered search
        UNSUPPORTED,    // no registry for the requested country
        DISABLED
    }

    static RegistryLookup profile(CompanyProfile profile) {
        return new RegistryLookup(Mode.PROFILE, profile, List.of());
    }

    static RegistryLookup search(List<RegistryHit> hits) {
        return new RegistryLookup(Mode.SEARCH, null, List.copyOf(hits));
    }

    static RegistryLookup of(Mode mode) {
        return new RegistryLookup(mode, null, List.of());
    }
}
