package com.jay.compliance.layer2_sources;

import com.jay.compliance.model.Address;
import com.jay.compliance.model.enums.CompanyStatus;

public record RegistryHit(String id, String name, CompanyStatus status, Address address, String legalForm) {}
