package com.jay.compliance.controller;

/** Body of POST /api/v1/profile. Missing flags default to false, missing country to the configured registry. */
public record ProfileRequest(String country, String query, Boolean premium, Boolean includeHistory) {}
