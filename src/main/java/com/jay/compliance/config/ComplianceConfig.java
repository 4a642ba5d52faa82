package com.jay.compliance.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads and exposes all configuration from compliance.yaml.
 * Values are read once at startup and passed down to each component; nothing else
 * in the service reads the process environment. Edit compliance.yaml (or the
 * environment variables it references) and restart to apply changes.
 */
@Slf4j
@Component
public class ComplianceConfig {

    @Value("${compliance.config-file:compliance.yaml}")
    private String configFile = "compliance.yaml";

    @Autowired(required = false)
    private Environment env;

    private static final PropertyPlaceholderHelper PLACEHOLDER_HELPER =
        new PropertyPlaceholderHelper("${", "}", ":", true);

    /** Resolves ${VAR:default} placeholders using Spring Environment (env vars / system props). */
    private String resolve(String value) {
        if (value == null) return null;
        return PLACEHOLDER_HELPER.replacePlaceholders(value,
            key -> env != null ? env.getProperty(key) : null);
    }

    // ── Sections ──────────────────────────────────────────────────────────────
    private Cache cache = new Cache();
    private RateLimit rateLimit = new RateLimit();
    private Security security = new Security();
    private Orchestrator orchestrator = new Orchestrator();
    private Registry registry = new Registry();
    private Sanctions sanctions = new Sanctions();
    private Risk risk = new Risk();
    private Forget forget = new Forget();

    @PostConstruct
    public void load() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(configFile)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath, using defaults", configFile);
            } else {
                ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
                this.cache        = root.getCache();
                this.rateLimit    = root.getRateLimit();
                this.security     = root.getSecurity();
                this.orchestrator = root.getOrchestrator();
                this.registry     = root.getRegistry();
                this.sanctions    = root.getSanctions();
                this.risk         = root.getRisk();
                this.forget       = root.getForget();
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + configFile + ": " + e.getMessage(), e);
        }

        // Resolve ${VAR:default} placeholders that Jackson reads as literal strings
        cache.setBackingStore(resolve(cache.getBackingStore()));
        cache.setRedisUrl(resolve(cache.getRedisUrl()));
        security.setPiiHashKey(resolve(security.getPiiHashKey()));
        security.setApiKeys(resolveList(security.getApiKeys()));
        registry.setBaseUrl(resolve(registry.getBaseUrl()));
        registry.setApiKey(resolve(registry.getApiKey()));
        sanctions.setBaseUrl(resolve(sanctions.getBaseUrl()));
        sanctions.setApiKey(resolve(sanctions.getApiKey()));

        validate();
        log.info("ComplianceConfig loaded from '{}'. Cache store: {}, registry: {}, sanctions enabled: {}",
            configFile, cache.getBackingStore(), registry.getCountry(), sanctions.isEnabled());
    }

    /**
     * Fails startup on missing credentials. Per-request code never sees a half-configured adapter.
     */
    public void validate() {
        if (registry.isEnabled() && isBlank(registry.getApiKey())) {
            throw new ConfigurationException("registry.api_key is required while the registry adapter is enabled");
        }
        if (sanctions.isEnabled() && isBlank(sanctions.getApiKey())) {
            throw new ConfigurationException("sanctions.api_key is required while the sanctions adapter is enabled");
        }
        if (security.isRequireApiKey() && security.getApiKeys().isEmpty()) {
            throw new ConfigurationException("security.require_api_key is set but security.api_keys is empty");
        }
        if (security.isRequirePiiKey() && isBlank(security.getPiiHashKey())) {
            throw new ConfigurationException("security.pii_hash_key is required");
        }
        if (rateLimit.getTokens() < 1 || rateLimit.getWindowSeconds() < 1) {
            throw new ConfigurationException("rate_limit.tokens and rate_limit.window_seconds must be positive");
        }
    }

    private List<String> resolveList(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            String resolved = resolve(v);
            if (resolved == null) continue;
            // A single env var may carry a comma-separated list
            for (String part : resolved.split(",")) {
                if (!part.isBlank()) out.add(part.trim());
            }
        }
        return out;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Cache cache()               { return cache; }
    public RateLimit rateLimit()       { return rateLimit; }
    public Security security()         { return security; }
    public Orchestrator orchestrator() { return orchestrator; }
    public Registry registry()         { return registry; }
    public Sanctions sanctions()       { return sanctions; }
    public Risk risk()                 { return risk; }
    public Forget forget()             { return forget; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Cache cache = new Cache();
        private RateLimit rateLimit = new RateLimit();
        private Security security = new Security();
        private Orchestrator orchestrator = new Orchestrator();
        private Registry registry = new Registry();
        private Sanctions sanctions = new Sanctions();
        private Risk risk = new Risk();
        private Forget forget = new Forget();
    }

    @Data public static class Cache {
        private String backingStore = "local";            // redis | local
        private String redisUrl = "redis://localhost:6379";
        private long profileTtlSeconds = 86400;
        private long searchTtlSeconds = 900;
        private long inflightMarkerTtlSeconds = 30;
        private long inflightWaitMs = 10000;
        private long inflightPollMs = 100;
        private int loaderThreads = 8;
    }

    @Data public static class RateLimit {
        private long tokens = 60;
        private long windowSeconds = 60;
    }

    @Data public static class Security {
        private boolean requireApiKey = false;
        private List<String> apiKeys = new ArrayList<>();
        private String piiHashKey = "local-dev-key";
        private boolean requirePiiKey = true;
    }

    @Data public static class Orchestrator {
        private int sourceThreads = 16;
        private long sourceTimeoutSeconds = 20;
        private int searchMaxResults = 10;
    }

    @Data public static class Registry {
        private boolean enabled = true;
        private String country = "NL";
        private String baseUrl = "https://api.kvk.nl/test/api";
        private String apiKey = "";
        private int connectTimeoutSeconds = 5;
        private int readTimeoutSeconds = 15;
        private int callTimeoutSeconds = 20;
    }

    @Data public static class Sanctions {
        private boolean enabled = true;
        private String baseUrl = "https://api.opensanctions.org";
        private String apiKey = "";
        private String dataset = "default";
        private String schema = "LegalEntity";
        private List<String> datasets = new ArrayList<>();
        private int limit = 10;
        private int connectTimeoutSeconds = 5;
        private int readTimeoutSeconds = 15;
        private int callTimeoutSeconds = 20;
    }

    @Data public static class Risk {
        private double perHitScore = 15;
        private double maxHitScore = 60;
        private double dissolvedPenalty = 20;
        private double inactivePenalty = 10;
        private double unknownStatusPenalty = 5;
        private double perPepHitScore = 10;
        private double uboMissingPenalty = 15;
        private double perNameChangeScore = 5;
    }

    @Data public static class Forget {
        private long processIntervalMs = 30000;
        private int batchSize = 50;
    }
}
