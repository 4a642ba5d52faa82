package com.jay.compliance.layer2_sources;

import java.util.List;

/**
 * Sanctions / PEP watchlist screening. Zero matches is a successful, empty answer.
 */
public interface SanctionsAdapter {

    /** Source tag recorded on every match, e.g. "opensanctions". */
    String sourceName();

    List<SanctionsEntity> search(String name, String schema, List<String> datasets, int limit);
}
