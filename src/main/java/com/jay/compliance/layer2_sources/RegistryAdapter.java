package com.jay.compliance.layer2_sources;

import com.jay.compliance.model.CompanyProfile;

import java.util.List;

/**
 * National company registry. One implementation per supported country.
 */
public interface RegistryAdapter {

    /** ISO country code this registry is authoritative for, e.g. "NL". */
    String country();

    /**
     * Free-text (or registration-number filtered) search. No hits is an empty list, never NotFound.
     */
    List<RegistryHit> search(String name, SearchFilters filters);

    /**
     * Direct lookup by registration number.
     *
     * @throws NotFoundException if the registry has no company with that id
     */
    CompanyProfile getProfileById(String id);
}
