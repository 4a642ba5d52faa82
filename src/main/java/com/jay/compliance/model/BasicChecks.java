package com.jay.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BasicChecks {
    private Boolean vatValid;       // null = not checked
    private boolean regVerified;
    private Instant lastDataPull;
}
