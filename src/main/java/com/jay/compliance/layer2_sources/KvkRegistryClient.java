package com.jay.compliance.layer2_sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.model.Address;
import com.jay.compliance.model.CompanyProfile;
import com.jay.compliance.model.SbiCode;
import com.jay.compliance.model.enums.CompanyStatus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2 — KVK (Dutch Chamber of Commerce) registry client.
 * Search (v2/zoeken) and base profile (v1/basisprofielen) over OkHttp, mapped
 * onto the internal registry shapes. No SDK dependency.
 *
 * API base: https://api.kvk.nl/api (test environment: /test/api)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KvkRegistryClient implements RegistryAdapter {

    static final String SOURCE = "kvk";

    private final ComplianceConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpClient http;

    @PostConstruct
    public void init() {
        ComplianceConfig.Registry registry = config.registry();
        this.http = SourceHttp.client(registry.getConnectTimeoutSeconds(),
            registry.getReadTimeoutSeconds(), registry.getCallTimeoutSeconds());
        log.info("KVK registry client initialised for {} against {}", registry.getCountry(), registry.getBaseUrl());
    }

    @Override
    public String country() {
        return config.registry().getCountry();
    }

    // ── Search ─────────────────────────────────────────────────────────────────

    @Override
    public List<RegistryHit> search(String name, SearchFilters filters) {
        HttpUrl.Builder url = baseUrl().newBuilder()
            .addPathSegments("v2/zoeken")
            .addQueryParameter("resultatenPerPagina", String.valueOf(Math.min(Math.max(filters.maxResults(), 1), 100)));
        if (filters.registrationNumber() != null) {
            url.addQueryParameter("kvkNummer", filters.registrationNumber());
        } else if (name != null && !name.isBlank()) {
            url.addQueryParameter("naam", name.trim());
        }
        if (filters.city() != null && !filters.city().isBlank()) {
            url.addQueryParameter("plaats", filters.city().trim());
        }

        JsonNode root;
        try {
            root = get(url.build());
        } catch (NotFoundException e) {
            // zoeken answers 404 when nothing matches
            return List.of();
        }
        List<RegistryHit> hits = mapSearchHits(root);
        log.info("KVK search returned {} results", hits.size());
        return hits;
    }

    // ── Base profile ───────────────────────────────────────────────────────────

    @Override
    public CompanyProfile getProfileById(String id) {
        HttpUrl url = baseUrl().newBuilder()
            .addPathSegments("v1/basisprofielen")
            .addPathSegment(id)
            .build();
        return mapProfile(get(url), country());
    }

    // ── Mapping ────────────────────────────────────────────────────────────────

    static List<RegistryHit> mapSearchHits(JsonNode root) {
        List<RegistryHit> hits = new ArrayList<>();
        for (JsonNode item : root.path("resultaten")) {
            String name = text(item, "naam");
            if (name == null) name = text(item, "handelsnaam");
            hits.add(new RegistryHit(
                text(item, "kvkNummer"),
                name,
                mapActive(text(item, "actief")),
                mapSearchAddress(item),
                text(item, "rechtsvorm")));
        }
        return hits;
    }

    static CompanyProfile mapProfile(JsonNode root, String country) {
        String name = text(root, "naam");
        if (name == null) name = text(root, "statutaireNaam");

        JsonNode embedded = root.path("_embedded");
        String legalForm = text(embedded.path("eigenaar"), "rechtsvorm");
        if (legalForm == null) legalForm = text(root, "rechtsvorm");

        List<SbiCode> sbiCodes = new ArrayList<>();
        for (JsonNode sbi : root.path("sbiActiviteiten")) {
            JsonNode primary = sbi.path("indHoofdactiviteit");
            sbiCodes.add(new SbiCode(
                text(sbi, "sbiCode"),
                text(sbi, "sbiOmschrijving"),
                primary.isBoolean() ? primary.asBoolean() : "Ja".equalsIgnoreCase(primary.asText(""))));
        }

        List<String> tradeNames = new ArrayList<>();
        for (JsonNode tn : root.path("handelsnamen")) {
            String n = tn.isTextual() ? tn.asText() : text(tn, "naam");
            if (n != null) tradeNames.add(n);
        }

        return CompanyProfile.builder()
            .name(name)
            .country(country)
            .registrationNumber(text(root, "kvkNummer"))
            .status(mapRegistration(root.path("materieleRegistratie")))
            .registeredAddress(mapProfileAddress(embedded.path("hoofdvestiging").path("adressen")))
            .legalForm(legalForm)
            .sbiCodes(sbiCodes)
            .tradeNames(tradeNames)
            .build();
    }

    private static CompanyStatus mapActive(String actief) {
        if (actief == null) return CompanyStatus.UNKNOWN;
        if ("Ja".equalsIgnoreCase(actief)) return CompanyStatus.ACTIVE;
        if ("Nee".equalsIgnoreCase(actief)) return CompanyStatus.INACTIVE;
        return CompanyStatus.UNKNOWN;
    }

    private static CompanyStatus mapRegistration(JsonNode registration) {
        if (text(registration, "datumEinde") != null) return CompanyStatus.DISSOLVED;
        if (text(registration, "datumAanvang") != null) return CompanyStatus.ACTIVE;
        return CompanyStatus.UNKNOWN;
    }

    private static Address mapSearchAddress(JsonNode item) {
        JsonNode addr = item.path("adres").path("binnenlandsAdres");
        if (addr.isMissingNode()) addr = item;   // v1 search results carry flat address fields
        String street = text(addr, "straatnaam");
        String city = text(addr, "plaats");
        if (street == null && city == null) return null;
        return new Address(street, text(addr, "huisnummer"), text(addr, "postcode"), city, "Nederland");
    }

    private static Address mapProfileAddress(JsonNode addresses) {
        if (!addresses.isArray() || addresses.isEmpty()) return null;
        JsonNode addr = addresses.get(0);
        String land = text(addr, "land");
        return new Address(text(addr, "straatnaam"), text(addr, "huisnummer"), text(addr, "postcode"),
            text(addr, "plaats"), land != null ? land : "Nederland");
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.path(field);
        if (v.isMissingNode() || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    // ── HTTP ───────────────────────────────────────────────────────────────────

    private HttpUrl baseUrl() {
        HttpUrl base = HttpUrl.parse(config.registry().getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid registry base URL: " + config.registry().getBaseUrl());
        }
        return base;
    }

    private JsonNode get(HttpUrl url) {
        Request request = new Request.Builder()
            .url(url)
            .header("apikey", config.registry().getApiKey())
            .header("Accept", "application/json")
            .get()
            .build();
        String body = SourceHttp.execute(http, request, SOURCE);
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamException(SOURCE, 200, "KVK returned unreadable JSON", e);
        }
    }
}
