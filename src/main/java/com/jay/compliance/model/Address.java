package com.jay.compliance.model;

public record Address(String street, String houseNumber, String postalCode, String city, String country) {}
