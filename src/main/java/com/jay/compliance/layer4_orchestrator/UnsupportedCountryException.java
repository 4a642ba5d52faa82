package com.jay.compliance.layer4_orchestrator;

public class UnsupportedCountryException extends RuntimeException {

    public UnsupportedCountryException(String country) {
        super("No registry configured for country '" + country + "'");
    }
}
