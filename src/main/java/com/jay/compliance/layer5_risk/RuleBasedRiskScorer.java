package com.jay.compliance.layer5_risk;

import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.model.CompanyProfile;
import com.jay.compliance.model.RiskResult;
import com.jay.compliance.model.SanctionsMatch;
import com.jay.compliance.model.SanctionsSection;
import com.jay.compliance.model.enums.CompanyStatus;
import com.jay.compliance.model.enums.RiskLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Layer 5 — Rule-based risk scorer.
 * Sums penalty points (0 – 100) from sanctions hits and their topics, company
 * status and auxiliary signals, then reports the total as a 0 – 1 score.
 */
@Component
@RequiredArgsConstructor
public class RuleBasedRiskScorer implements RiskScorer {

    public static final String VERSION = "rules-v1";

    // Highest matching topic weight counts once, across all matches
    private static final Map<String, Double> TOPIC_WEIGHTS = topicWeights();

    private final ComplianceConfig config;

    @Override
    public RiskResult score(CompanyProfile profile, SanctionsSection sanctions, AuxiliarySignals signals) {
        ComplianceConfig.Risk weights = config.risk();
        List<String> reasons = new ArrayList<>();
        double points = 0;

        // ── Sanctions ─────────────────────────────────────────────────────────
        double sanctionsPoints = sanctionsPoints(sanctions);
        if (sanctions.hitsCount() == 0) {
            reasons.add("No sanctions matches");
        } else {
            reasons.add(String.format(Locale.ROOT, "%d sanctions/PEP list match(es)", sanctions.hitsCount()));
            String topic = highestTopic(sanctions);
            if (topic != null) reasons.add("Match topic: " + topic);
        }
        points += sanctionsPoints;

        // ── Company status ────────────────────────────────────────────────────
        CompanyStatus status = profile.getStatus() != null ? profile.getStatus() : CompanyStatus.UNKNOWN;
        switch (status) {
            case DISSOLVED -> { points += weights.getDissolvedPenalty(); reasons.add("Company dissolved"); }
            case INACTIVE  -> { points += weights.getInactivePenalty();  reasons.add("Company inactive"); }
            case UNKNOWN   -> { points += weights.getUnknownStatusPenalty(); reasons.add("Registry status unknown"); }
            case ACTIVE    -> reasons.add("Active company status");
        }

        // ── Auxiliary signals ─────────────────────────────────────────────────
        if (signals.pepHits() > 0) {
            points += signals.pepHits() * weights.getPerPepHitScore();
            reasons.add(signals.pepHits() + " PEP hit(s)");
        }
        if (signals.uboMissingAndRequired()) {
            points += weights.getUboMissingPenalty();
            reasons.add("UBO information missing");
        }
        if (signals.recentNameChanges() > 0) {
            points += signals.recentNameChanges() * weights.getPerNameChangeScore();
            reasons.add(signals.recentNameChanges() + " recent name change(s)");
        }

        double score = Math.min(points, 100) / 100.0;
        RiskLevel level = RiskLevel.fromScore(score);

        Map<String, String> provenance = new LinkedHashMap<>();
        provenance.put("scorer", VERSION);
        provenance.put("sanctionsPoints", String.format(Locale.ROOT, "%.1f", sanctionsPoints));
        provenance.put("status", status.name());
        provenance.put("auxiliarySignals", "placeholder");
        return new RiskResult(score, level, reasons, provenance);
    }

    /**
     * Sanctions-only points: {@code min(hits × perHit, maxHit)} plus the highest topic weight, capped at 100.
     */
    public double sanctionsPoints(SanctionsSection sanctions) {
        if (sanctions.hitsCount() == 0) return 0;
        ComplianceConfig.Risk weights = config.risk();
        double base = Math.min(sanctions.hitsCount() * weights.getPerHitScore(), weights.getMaxHitScore());
        String topic = highestTopic(sanctions);
        double topicScore = topic == null ? 0 : TOPIC_WEIGHTS.get(topic);
        return Math.min(base + topicScore, 100);
    }

    private String highestTopic(SanctionsSection sanctions) {
        String best = null;
        double bestScore = 0;
        for (SanctionsMatch m : sanctions.matches()) {
            for (String topic : topics(m)) {
                String t = topic.toLowerCase(Locale.ROOT);
                for (Map.Entry<String, Double> w : TOPIC_WEIGHTS.entrySet()) {
                    if (t.contains(w.getKey()) && w.getValue() > bestScore) {
                        best = w.getKey();
                        bestScore = w.getValue();
                    }
                }
            }
        }
        return best;
    }

    private static List<String> topics(SanctionsMatch match) {
        if (match.raw() == null) return List.of();
        Object topics = match.raw().get("topics");
        if (!(topics instanceof List<?>)) return List.of();
        List<String> out = new ArrayList<>();
        for (Object o : (List<?>) topics) {
            if (o != null) out.add(o.toString());
        }
        return out;
    }

    private static Map<String, Double> topicWeights() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("sanction", 40.0);
        m.put("crime", 30.0);
        m.put("role.pep", 25.0);
        m.put("poi", 20.0);
        m.put("fin", 15.0);
        return m;
    }
}
