package com.jay.compliance.model;

import java.util.List;

public record SanctionsSection(int hitsCount, List<SanctionsMatch> matches) {

    public SanctionsSection {
        matches = matches == null ? List.of() : List.copyOf(matches);
        if (hitsCount < 0) throw new IllegalArgumentException("hitsCount must be >= 0");
    }

    public static SanctionsSection empty() {
        return new SanctionsSection(0, List.of());
    }

    public static SanctionsSection of(List<SanctionsMatch> matches) {
        return new SanctionsSection(matches.size(), matches);
    }
}
