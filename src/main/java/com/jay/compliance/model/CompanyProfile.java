package com.jay.compliance.model;

import com.jay.compliance.model.enums.CompanyStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Company section of a profile result. Populated incrementally from zero or more
 * registry results; anything the registry did not return stays null / UNKNOWN.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyProfile {
    private String name;
    private String country;
    private String registrationNumber;
    private String vatNumber;
    @Builder.Default
    private CompanyStatus status = CompanyStatus.UNKNOWN;
    private Address registeredAddress;
    private String legalForm;
    @Builder.Default
    private List<SbiCode> sbiCodes = new ArrayList<>();
    @Builder.Default
    private List<String> tradeNames = new ArrayList<>();

    public static CompanyProfile empty(String country) {
        return CompanyProfile.builder().country(country).build();
    }
}
