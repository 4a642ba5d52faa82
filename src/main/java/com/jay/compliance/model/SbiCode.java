package com.jay.compliance.model;

/** Standard industrial classification activity as registered with the chamber of commerce. */
public record SbiCode(String code, String description, boolean primary) {}
