package com.jay.compliance.controller;

import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.layer1_query.CompanyQuery;
import com.jay.compliance.layer2_sources.RegistryHit;
import com.jay.compliance.layer4_orchestrator.ComplianceOrchestrator;
import com.jay.compliance.layer4_orchestrator.RiskAssessment;
import com.jay.compliance.layer4_orchestrator.ScreeningResult;
import com.jay.compliance.model.CompanyProfile;
import com.jay.compliance.model.ProfileResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API — Company compliance lookups.
 *
 * Endpoints:
 *   POST /api/v1/profile                                 — Full profile: registry + sanctions + risk
 *   GET  /api/v1/search?country&query&city&limit         — Registry search only
 *   GET  /api/v1/companies/{country}/{registrationNumber} — Direct registry profile
 *   GET  /api/v1/risk/{country}/{registrationNumber}      — Registry profile + sanctions on its name + risk
 *   GET  /api/v1/sanctions/screen?name&schema&limit      — Sanctions screening only
 *
 * Source failures on the direct endpoints are mapped to HTTP statuses by
 * {@link ApiExceptionHandler}; the profile endpoint never fails on a source.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ComplianceController {

    private final ComplianceOrchestrator orchestrator;
    private final ComplianceConfig config;

    // ── POST /api/v1/profile ──────────────────────────────────────────────────

    @PostMapping("/profile")
    public ResponseEntity<ProfileResult> profile(@RequestBody ProfileRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        String country = request.country() == null || request.country().isBlank()
            ? config.registry().getCountry()
            : request.country();
        CompanyQuery query = new CompanyQuery(request.query(), country,
            Boolean.TRUE.equals(request.premium()), Boolean.TRUE.equals(request.includeHistory()));
        return ResponseEntity.ok(orchestrator.getCompanyProfile(query));
    }

    // ── GET /api/v1/search ────────────────────────────────────────────────────

    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(
            @RequestParam String query,
            @RequestParam(required = false) String country,
            @RequestParam(required = false) String city,
            @RequestParam(required = false) Integer limit) {
        if (query.isBlank()) throw new IllegalArgumentException("query must not be blank");
        String cc = country == null || country.isBlank() ? config.registry().getCountry() : country;
        List<RegistryHit> hits = orchestrator.searchCompanies(cc, query, city, limit);
        return ResponseEntity.ok(Map.of(
            "country", cc.toUpperCase(Locale.ROOT),
            "totalResults", hits.size(),
            "results", hits
        ));
    }

    // ── GET /api/v1/companies/{country}/{registrationNumber} ──────────────────

    @GetMapping("/companies/{country}/{registrationNumber}")
    public ResponseEntity<CompanyProfile> company(@PathVariable String country,
                                                  @PathVariable String registrationNumber) {
        return ResponseEntity.ok(orchestrator.lookupById(country, registrationNumber));
    }

    // ── GET /api/v1/risk/{country}/{registrationNumber} ───────────────────────

    @GetMapping("/risk/{country}/{registrationNumber}")
    public ResponseEntity<RiskAssessment> risk(@PathVariable String country,
                                               @PathVariable String registrationNumber) {
        return ResponseEntity.ok(orchestrator.assessRisk(country, registrationNumber));
    }

    // ── GET /api/v1/sanctions/screen ──────────────────────────────────────────

    @GetMapping("/sanctions/screen")
    public ResponseEntity<ScreeningResult> screen(
            @RequestParam String name,
            @RequestParam(required = false) String schema,
            @RequestParam(required = false) Integer limit) {
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        return ResponseEntity.ok(orchestrator.screenSanctions(name, schema, limit));
    }
}
