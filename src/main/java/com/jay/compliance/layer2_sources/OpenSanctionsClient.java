package com.jay.compliance.layer2_sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.compliance.config.ComplianceConfig;
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
 * Layer 2 — OpenSanctions screening client.
 * Calls the /search/{dataset} endpoint and maps results onto {@link SanctionsEntity}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenSanctionsClient implements SanctionsAdapter {

    static final String SOURCE = "opensanctions";

    private final ComplianceConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpClient http;

    @PostConstruct
    public void init() {
        ComplianceConfig.Sanctions s = config.sanctions();
        this.http = SourceHttp.client(s.getConnectTimeoutSeconds(), s.getReadTimeoutSeconds(), s.getCallTimeoutSeconds());
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    public List<SanctionsEntity> search(String name, String schema, List<String> datasets, int limit) {
        ComplianceConfig.Sanctions s = config.sanctions();
        HttpUrl base = HttpUrl.parse(s.getBaseUrl());
        if (base == null) {
            throw new IllegalStateException("Invalid sanctions base URL: " + s.getBaseUrl());
        }
        HttpUrl.Builder url = base.newBuilder()
            .addPathSegment("search")
            .addPathSegment(s.getDataset())
            .addQueryParameter("q", name == null ? "" : name)
            .addQueryParameter("schema", schema)
            .addQueryParameter("limit", String.valueOf(limit));
        if (datasets != null && !datasets.isEmpty()) {
            url.addQueryParameter("datasets", String.join(",", datasets));
        }

        Request request = new Request.Builder()
            .url(url.build())
            .header("Authorization", "ApiKey " + s.getApiKey())
            .header("Accept", "application/json")
            .get()
            .build();

        String body = SourceHttp.execute(http, request, SOURCE);
        try {
            List<SanctionsEntity> results = mapResults(objectMapper.readTree(body));
            log.info("OpenSanctions search returned {} results (schema={})", results.size(), schema);
            return results;
        } catch (IOException e) {
            throw new UpstreamException(SOURCE, 200, "OpenSanctions returned unreadable JSON", e);
        }
    }

    static List<SanctionsEntity> mapResults(JsonNode root) {
        List<SanctionsEntity> out = new ArrayList<>();
        for (JsonNode r : root.path("results")) {
            JsonNode props = r.path("properties");
            // datasets sit on the entity, older payloads repeat them under properties
            List<String> datasets = strings(r.path("datasets"));
            if (datasets.isEmpty()) datasets = strings(props.path("datasets"));
            out.add(new SanctionsEntity(
                r.path("id").asText(null),
                r.path("score").asDouble(0),
                r.path("caption").asText(null),
                r.path("schema").asText(null),
                new SanctionsEntity.Properties(
                    strings(props.path("name")),
                    strings(props.path("topics")),
                    strings(props.path("country")),
                    datasets)));
        }
        return out;
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode v : array) {
            if (v.isTextual()) values.add(v.asText());
        }
        return values;
    }
}
