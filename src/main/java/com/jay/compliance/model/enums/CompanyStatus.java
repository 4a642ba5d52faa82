package com.jay.compliance.model.enums;

public enum CompanyStatus {
    UNKNOWN,
    ACTIVE,
    INACTIVE,
    DISSOLVED
}
