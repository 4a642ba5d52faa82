package com.jay.compliance.layer4_orchestrator;

import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.layer1_query.CompanyQuery;
import com.jay.compliance.layer1_query.NormalizedQuery;
import com.jay.compliance.layer1_query.QueryNormalizer;
import com.jay.compliance.layer2_sources.NotFoundException;
import com.jay.compliance.layer2_sources.RegistryAdapter;
import com.jay.compliance.layer2_sources.RegistryHit;
import com.jay.compliance.layer2_sources.SanctionsAdapter;
import com.jay.compliance.layer2_sources.SanctionsEntity;
import com.jay.compliance.layer2_sources.SearchFilters;
import com.jay.compliance.layer2_sources.SourceErrorType;
import com.jay.compliance.layer2_sources.SourceException;
import com.jay.compliance.layer2_sources.UpstreamException;
import com.jay.compliance.layer3_cache.ForgetTombstones;
import com.jay.compliance.layer3_cache.ProfileCache;
import com.jay.compliance.layer5_risk.AuxiliarySignals;
import com.jay.compliance.layer5_risk.RiskScorer;
import com.jay.compliance.layer5_risk.RuleBasedRiskScorer;
import com.jay.compliance.layer6_audit.AuditLogger;
import com.jay.compliance.layer6_audit.AuditTrail;
import com.jay.compliance.layer6_audit.PiiRedactor;
import com.jay.compliance.model.AuditRecord;
import com.jay.compliance.model.BasicChecks;
import com.jay.compliance.model.CompanyProfile;
import com.jay.compliance.model.ProfileResult;
import com.jay.compliance.model.RiskResult;
import com.jay.compliance.model.SanctionsMatch;
import com.jay.compliance.model.SanctionsSection;
import com.jay.compliance.model.enums.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Layer 4 — Builds a compliance profile for one query.
 *
 * Pipeline per cache miss:
 *   1. Registry lookup (direct by id for premium numeric queries, search otherwise)
 *   2. Sanctions screening on the free-text query, in parallel with step 1
 *   3. Merge whatever succeeded; failed sources become degraded audit entries
 *   4. Risk score over the merged result
 *
 * The assembled result is cached under the profile TTL, degraded or not.
 * Concurrent misses for the same key share one assembly.
 */
@Slf4j
@Service
public class ComplianceOrchestrator {

    private final QueryNormalizer normalizer;
    private final Map<String, RegistryAdapter> registries = new HashMap<>();
    private final SanctionsAdapter sanctions;
    private final ProfileCache cache;
    private final ForgetTombstones tombstones;
    private final RiskScorer scorer;
    private final RuleBasedRiskScorer sanctionsScorer;
    private final AuditLogger auditLogger;
    private final PiiRedactor redactor;
    private final ExecutorService sourcePool;
    private final ComplianceConfig config;
    private final Clock clock;

    public ComplianceOrchestrator(QueryNormalizer normalizer,
                                  List<RegistryAdapter> registryAdapters,
                                  SanctionsAdapter sanctions,
                                  ProfileCache cache,
                                  ForgetTombstones tombstones,
                                  RiskScorer scorer,
                                  RuleBasedRiskScorer sanctionsScorer,
                                  AuditLogger auditLogger,
                                  PiiRedactor redactor,
                                  @Qualifier("sourcePool") ExecutorService sourcePool,
                                  ComplianceConfig config,
                                  Clock clock) {
        this.normalizer = normalizer;
        this.sanctions = sanctions;
        this.cache = cache;
        this.tombstones = tombstones;
        this.scorer = scorer;
        this.sanctionsScorer = sanctionsScorer;
        this.auditLogger = auditLogger;
        this.redactor = redactor;
        this.sourcePool = sourcePool;
        this.config = config;
        this.clock = clock;
        for (RegistryAdapter adapter : registryAdapters) {
            registries.put(adapter.country().toUpperCase(Locale.ROOT), adapter);
        }
        log.info("Orchestrator ready. Registries: {}, sanctions source: {}", registries.keySet(), sanctions.sourceName());
    }

    // ── Profile ───────────────────────────────────────────────────────────────

    public ProfileResult getCompanyProfile(CompanyQuery query) {
        return join(getCompanyProfileAsync(query));
    }

    /**
     * Non-blocking variant. Cancelling the returned future abandons this caller's
     * wait only; the shared assembly still completes and is cached.
     */
    public CompletableFuture<ProfileResult> getCompanyProfileAsync(CompanyQuery query) {
        long started = System.nanoTime();
        String key = normalizer.profileKey(query);

        Optional<ProfileResult> cached = cache.get(key, ProfileResult.class);
        if (cached.isPresent()) {
            if (isForgotten(cached.get())) {
                log.info("Cached profile superseded by a forget request, reloading");
                cache.evict(key);
            } else {
                ProfileResult hit = cached.get().asCacheHit();
                auditLogger.profileServed(query, hit.audit(), true, elapsedMs(started));
                return CompletableFuture.completedFuture(hit);
            }
        }

        Duration ttl = Duration.ofSeconds(config.cache().getProfileTtlSeconds());
        return cache.getOrLoad(key, ProfileResult.class, ttl, () -> assemble(query))
            .thenApply(result -> {
                auditLogger.profileServed(query, result.audit(), result.cacheHit(), elapsedMs(started));
                return result;
            });
    }

    ProfileResult assemble(CompanyQuery query) {
        NormalizedQuery normalized = normalizer.normalize(query.raw());
        String sanctionsName = query.raw().trim();

        CompletableFuture<SourceOutcome<RegistryLookup>> registryFuture =
            CompletableFuture.supplyAsync(() -> lookupRegistry(query, normalized), sourcePool);
        CompletableFuture<SourceOutcome<List<SanctionsEntity>>> sanctionsFuture =
            CompletableFuture.supplyAsync(() -> screen(sanctionsName), sourcePool);

        // One deadline for the whole fan-out, not one per source
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.orchestrator().getSourceTimeoutSeconds());
        SourceOutcome<RegistryLookup> registry = await(registryFuture, "registry", deadline);
        SourceOutcome<List<SanctionsEntity>> screening = await(sanctionsFuture, "sanctions", deadline);

        AuditTrail audit = new AuditTrail();
        CompanyProfile company = CompanyProfile.empty(query.country());
        BasicChecks checks = BasicChecks.builder()
            .regVerified(false)
            .lastDataPull(clock.instant())
            .build();

        mergeRegistry(registry, company, checks, audit);
        SanctionsSection section = mergeSanctions(screening, audit);

        RiskResult risk = scorer.score(company, section, AuxiliarySignals.placeholders());
        return new ProfileResult(company, checks, section, risk, audit.toRecord(), false);
    }

    // ── Source calls ──────────────────────────────────────────────────────────

    private SourceOutcome<RegistryLookup> lookupRegistry(CompanyQuery query, NormalizedQuery normalized) {
        if (!config.registry().isEnabled()) {
            return SourceOutcome.ok(RegistryLookup.of(RegistryLookup.Mode.DISABLED));
        }
        RegistryAdapter adapter = registries.get(query.country());
        if (adapter == null) {
            return SourceOutcome.ok(RegistryLookup.of(RegistryLookup.Mode.UNSUPPORTED));
        }
        int maxResults = config.orchestrator().getSearchMaxResults();
        try {
            if (normalized.registrationNumber()) {
                String digits = normalizer.registrationDigits(query.raw());
                if (query.premium()) {
                    try {
                        return SourceOutcome.ok(RegistryLookup.profile(adapter.getProfileById(digits)));
                    } catch (NotFoundException e) {
                        return SourceOutcome.ok(RegistryLookup.profile(null));
                    }
                }
                return SourceOutcome.ok(RegistryLookup.search(
                    adapter.search("", SearchFilters.byRegistrationNumber(digits, maxResults))));
            }
            return SourceOutcome.ok(RegistryLookup.search(
                adapter.search(query.raw().trim(), SearchFilters.limit(maxResults))));
        } catch (SourceException e) {
            log.warn("Registry {} degraded ({}): {}", e.getSource(), e.getType(), e.getMessage());
            return SourceOutcome.degraded(e.getType());
        } catch (RuntimeException e) {
            log.error("Registry adapter for {} failed unexpectedly: {}", query.country(), e.getMessage(), e);
            return SourceOutcome.degraded(SourceErrorType.UPSTREAM_ERROR);
        }
    }

    private SourceOutcome<List<SanctionsEntity>> screen(String name) {
        if (!config.sanctions().isEnabled()) return SourceOutcome.ok(null);
        ComplianceConfig.Sanctions cfg = config.sanctions();
        try {
            return SourceOutcome.ok(sanctions.search(name, cfg.getSchema(), cfg.getDatasets(), cfg.getLimit()));
        } catch (SourceException e) {
            log.warn("Sanctions source {} degraded ({}): {}", e.getSource(), e.getType(), e.getMessage());
            return SourceOutcome.degraded(e.getType());
        } catch (RuntimeException e) {
            log.error("Sanctions adapter failed unexpectedly: {}", e.getMessage(), e);
            return SourceOutcome.degraded(SourceErrorType.UPSTREAM_ERROR);
        }
    }

    private <T> SourceOutcome<T> await(Future<SourceOutcome<T>> future, String label, long deadlineNanos) {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} call missed the {}s deadline, continuing without it",
                label, config.orchestrator().getSourceTimeoutSeconds());
            return SourceOutcome.degraded(SourceErrorType.TIMEOUT);
        } catch (ExecutionException e) {
            log.error("{} call failed: {}", label, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return SourceOutcome.degraded(SourceErrorType.UPSTREAM_ERROR);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + label, e);
        }
    }

    // ── Merge ─────────────────────────────────────────────────────────────────

    private void mergeRegistry(SourceOutcome<RegistryLookup> outcome, CompanyProfile company,
                               BasicChecks checks, AuditTrail audit) {
        if (outcome.isDegraded()) {
            audit.call("registry_error", degraded(outcome.errorType()));
            return;
        }
        RegistryLookup lookup = outcome.value();
        switch (lookup.mode()) {
            case DISABLED -> audit.source("registry:disabled");
            case UNSUPPORTED -> audit.source("registry:unsupported_country");
            case PROFILE -> {
                CompanyProfile found = lookup.profile();
                audit.call("registry_profile", summary("fetched", found != null));
                if (found != null) {
                    copyProfile(found, company);
                    checks.setRegVerified(true);
                    audit.source("registry:profile:" + found.getRegistrationNumber());
                }
            }
            case SEARCH -> {
                int n = lookup.hits().size();
                audit.call("registry_search", summary("resultCount", n, "ambiguous", n > 1));
                if (n == 1) {
                    RegistryHit hit = lookup.hits().get(0);
                    company.setName(hit.name());
                    company.setRegistrationNumber(hit.id());
                    company.setStatus(hit.status());
                    company.setRegisteredAddress(hit.address());
                    company.setLegalForm(hit.legalForm());
                    checks.setRegVerified(true);
                    audit.source("registry:search:" + hit.id());
                } else {
                    audit.source("registry:search:multiple_or_none:" + n);
                }
            }
        }
    }

    private static void copyProfile(CompanyProfile from, CompanyProfile into) {
        into.setName(from.getName());
        into.setRegistrationNumber(from.getRegistrationNumber());
        into.setVatNumber(from.getVatNumber());
        into.setStatus(from.getStatus());
        into.setRegisteredAddress(from.getRegisteredAddress());
        into.setLegalForm(from.getLegalForm());
        into.setSbiCodes(from.getSbiCodes());
        into.setTradeNames(from.getTradeNames());
    }

    private SanctionsSection mergeSanctions(SourceOutcome<List<SanctionsEntity>> outcome, AuditTrail audit) {
        if (outcome.isDegraded()) {
            audit.call("sanctions_error", degraded(outcome.errorType()));
            return SanctionsSection.empty();
        }
        if (outcome.value() == null) {
            audit.source("sanctions:disabled");
            return SanctionsSection.empty();
        }
        List<SanctionsMatch> matches = outcome.value().stream().map(this::toMatch).toList();
        audit.source("sanctions");
        audit.call("sanctions", summary("resultCount", matches.size()));
        return SanctionsSection.of(matches);
    }

    private SanctionsMatch toMatch(SanctionsEntity entity) {
        SanctionsEntity.Properties props = entity.properties() != null
            ? entity.properties()
            : new SanctionsEntity.Properties(null, null, null, null);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("schema", entity.schema());
        raw.put("caption", entity.caption());
        raw.put("topics", props.topics());
        raw.put("countries", props.country());
        raw.put("datasets", props.datasets());
        double confidence = Math.max(0.0, Math.min(1.0, entity.score()));
        return new SanctionsMatch(sanctions.sourceName(), entity.id(), confidence, entity.primaryName(), raw);
    }

    private static Map<String, Object> degraded(SourceErrorType type) {
        return summary("degraded", true, "errorType", type);
    }

    private static Map<String, Object> summary(Object... keyValues) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            out.put((String) keyValues[i], keyValues[i + 1]);
        }
        return out;
    }

    // ── Direct operations ─────────────────────────────────────────────────────

    /**
     * Registry search without sanctions or scoring. Results are cached under the
     * search TTL. A cached page holding a company forgotten after it was fetched
     * is dropped and fetched again. Source errors propagate to the caller.
     */
    public List<RegistryHit> searchCompanies(String country, String query, String city, Integer limit) {
        RegistryAdapter adapter = registryFor(country);
        int max = limit == null || limit < 1
            ? config.orchestrator().getSearchMaxResults()
            : Math.min(limit, 100);
        String cityKey = city == null ? "" : city.trim().toLowerCase(Locale.ROOT);
        String key = normalizer.searchKey(adapter.country(), query) + ":" + cityKey + ":" + max;
        NormalizedQuery normalized = normalizer.normalize(query);
        SearchFilters filters = normalized.registrationNumber()
            ? new SearchFilters(normalizer.registrationDigits(query), blankToNull(city), max)
            : new SearchFilters(null, blankToNull(city), max);
        String name = normalized.registrationNumber() ? "" : (query == null ? "" : query.trim());

        Duration ttl = Duration.ofSeconds(config.cache().getSearchTtlSeconds());
        Supplier<SearchPage> loader = () -> new SearchPage(adapter.search(name, filters), clock.instant());
        SearchPage page = join(cache.getOrLoad(key, SearchPage.class, ttl, loader));
        if (isForgotten(page)) {
            log.info("Cached search superseded by a forget request, reloading");
            cache.evict(key);
            page = join(cache.getOrLoad(key, SearchPage.class, ttl, loader));
        }
        return page.hits();
    }

    /**
     * Direct registry profile, always fetched from the registry and never cached,
     * so forget tombstones do not apply. {@link NotFoundException} propagates.
     */
    public CompanyProfile lookupById(String country, String registrationNumber) {
        RegistryAdapter adapter = registryFor(country);
        String digits = normalizer.registrationDigits(registrationNumber);
        if (digits.isEmpty() || !normalizer.normalize(digits).registrationNumber()) {
            throw new IllegalArgumentException("Registration number must be numeric");
        }
        return adapter.getProfileById(digits);
    }

    /**
     * Risk for a registered company: the registry profile by number, then sanctions
     * screening on the registered name. Registry errors propagate; a sanctions
     * failure leaves the sanctions section empty and is recorded in the audit.
     */
    public RiskAssessment assessRisk(String country, String registrationNumber) {
        CompanyProfile company = lookupById(country, registrationNumber);
        AuditTrail audit = new AuditTrail()
            .source("registry:profile:" + company.getRegistrationNumber())
            .call("registry_profile", summary("fetched", true));

        String name = company.getName();
        SanctionsSection section;
        if (name == null || name.isBlank()) {
            audit.source("sanctions:no_name");
            section = SanctionsSection.empty();
        } else {
            section = mergeSanctions(screen(name.trim()), audit);
        }

        RiskResult risk = scorer.score(company, section, AuxiliarySignals.placeholders());
        AuditRecord record = audit.toRecord();
        auditLogger.riskAssessed(country.trim().toUpperCase(Locale.ROOT), company.getRegistrationNumber(),
            record, risk.level());
        return new RiskAssessment(company.getRegistrationNumber(), name, company, risk.score(), risk.level(),
            risk.reasons(), section.hitsCount(), section.matches(), record, clock.instant());
    }

    /** Sanctions screening on a name, scored on sanctions evidence alone. */
    public ScreeningResult screenSanctions(String name, String schema, Integer limit) {
        if (!config.sanctions().isEnabled()) {
            throw new UpstreamException(sanctions.sourceName(), 503, "Sanctions screening is disabled");
        }
        ComplianceConfig.Sanctions cfg = config.sanctions();
        String effectiveSchema = schema == null || schema.isBlank() ? cfg.getSchema() : schema;
        int max = limit == null || limit < 1 ? cfg.getLimit() : Math.min(limit, 100);

        List<SanctionsMatch> matches = sanctions.search(name.trim(), effectiveSchema, cfg.getDatasets(), max)
            .stream().map(this::toMatch).toList();
        SanctionsSection section = SanctionsSection.of(matches);
        double score = sanctionsScorer.sanctionsPoints(section) / 100.0;
        return new ScreeningResult(section.hitsCount(), score, RiskLevel.fromScore(score),
            section.matches(), List.of(sanctions.sourceName()), clock.instant());
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private RegistryAdapter registryFor(String country) {
        String code = country == null ? "" : country.trim().toUpperCase(Locale.ROOT);
        RegistryAdapter adapter = config.registry().isEnabled() ? registries.get(code) : null;
        if (adapter == null) throw new UnsupportedCountryException(code);
        return adapter;
    }

    private boolean isForgotten(ProfileResult result) {
        if (result.company() == null) return false;
        return isForgotten(result.company().getRegistrationNumber(),
            result.basicChecks() != null ? result.basicChecks().getLastDataPull() : null);
    }

    private boolean isForgotten(SearchPage page) {
        return page.hits().stream().anyMatch(hit -> isForgotten(hit.id(), page.pulledAt()));
    }

    private boolean isForgotten(String registrationNumber, Instant pulledAt) {
        if (registrationNumber == null || registrationNumber.isBlank()) return false;
        return tombstones.covers(redactor.hashIdentifier(registrationNumber), pulledAt);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    /** Blocks for a cache future, rethrowing the loader's own exception. */
    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for result", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException(cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new IllegalStateException("Result load was cancelled", e);
        }
    }
}
