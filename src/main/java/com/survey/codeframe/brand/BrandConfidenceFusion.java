package com.survey.codeframe.brand;

import com.survey.codeframe.config.BrandValidationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines tier results into one confidence score, issue list and recommendation.
 * <p>
 * {@code confidence = 100 × max(0, Σ w·positive − Σ w·negative) / Σ w} over attempted tiers.
 * Skipped tiers are left out of the denominator; tiers that failed stay in it with no evidence.
 * A knowledge-graph ERROR caps the result at {@code kgErrorCeiling − 1} whatever the other tiers say.
 */
@Component
@RequiredArgsConstructor
public class BrandConfidenceFusion {

    static final double LOW_WEB_PRESENCE = 0.3;
    static final double LOW_VISION_MATCH = 0.5;

    private final BrandValidationProperties properties;

    public BrandAssessment fuse(String candidate, Map<EvidenceTier, TierResult> results) {
        double attemptedWeight = 0.0;
        double signal = 0.0;
        List<ValidationIssue> issues = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        boolean kgError = false;
        String kgCanonicalName = null;

        for (EvidenceTier tier : EvidenceTier.values()) {
            TierResult result = results.get(tier);
            if (result == null || !result.attempted()) {
                reasons.add(label(tier) + ": skipped");
                continue;
            }
            double weight = properties.weightOf(tier);
            attemptedWeight += weight;

            if (result.status() == TierStatus.INSUFFICIENT_DATA || result.evidence() == null) {
                issues.add(new ValidationIssue(tier, IssueSeverity.WARNING, ValidationIssue.INSUFFICIENT_DATA,
                        label(tier) + " unavailable: " + result.error()));
                reasons.add(label(tier) + ": no data");
                continue;
            }

            TierEvidence evidence = result.evidence();
            signal += weight * clamp(evidence.positive()) - weight * clamp(evidence.negative());
            reasons.add(label(tier) + ": " + evidence.summary());

            if (evidence instanceof KnowledgeGraphEvidence) {
                KnowledgeGraphVerdict verdict = ((KnowledgeGraphEvidence) evidence).verdict();
                kgError = verdict.isError();
                issues.add(new ValidationIssue(tier, verdict.severity(), verdict.code(), verdict.message()));
                if (verdict.matchedEntity() != null) {
                    kgCanonicalName = verdict.matchedEntity();
                }
            } else {
                issues.add(tierIssue(evidence));
            }
        }

        int confidence = attemptedWeight <= 0.0
                ? 0
                : (int) Math.round(100.0 * Math.max(0.0, signal) / attemptedWeight);
        confidence = Math.max(0, Math.min(100, confidence));
        if (kgError) {
            confidence = Math.min(confidence, properties.getKgErrorCeiling() - 1);
        }

        String recommendation = recommend(confidence, issues);
        List<String> suggested = suggestedCodes(candidate, kgCanonicalName, kgError);

        String reasoning = String.format("%s. Confidence %d%%%s, recommendation: %s.",
                String.join("; ", reasons),
                confidence,
                kgError ? " (capped by knowledge-graph error)" : "",
                recommendation);

        return new BrandAssessment(confidence, issues, suggested, reasoning, recommendation);
    }

    String recommend(int confidence, List<ValidationIssue> issues) {
        long risks = issues.stream().filter(ValidationIssue::isRisk).count();
        boolean hasError = issues.stream().anyMatch(i -> i.severity() == IssueSeverity.ERROR);

        if (confidence >= properties.getApproveThreshold() && !hasError && risks < properties.getMaxIssuesBeforeReject()) {
            return BrandAssessment.APPROVE;
        }
        if (confidence < properties.getRejectThreshold() || risks >= properties.getMaxIssuesBeforeReject()) {
            return BrandAssessment.REJECT;
        }
        return BrandAssessment.REVIEW;
    }

    private ValidationIssue tierIssue(TierEvidence evidence) {
        EvidenceTier tier = evidence.tier();
        if (evidence instanceof WebSearchEvidence && ((WebSearchEvidence) evidence).mentionRate() < LOW_WEB_PRESENCE) {
            return new ValidationIssue(tier, IssueSeverity.WARNING, "LOW_WEB_PRESENCE", evidence.summary());
        }
        if (evidence instanceof VisionEvidence && ((VisionEvidence) evidence).matchRate() < LOW_VISION_MATCH) {
            return new ValidationIssue(tier, IssueSeverity.WARNING, "LOW_VISION_MATCH", evidence.summary());
        }
        if (evidence instanceof TranslationEvidence && !((TranslationEvidence) evidence).nameStable()) {
            return new ValidationIssue(tier, IssueSeverity.WARNING, "GENERIC_TERM", evidence.summary());
        }
        return new ValidationIssue(tier, IssueSeverity.OK, "CONFIRMED", evidence.summary());
    }

    private List<String> suggestedCodes(String candidate, String kgCanonicalName, boolean kgError) {
        Set<String> suggested = new LinkedHashSet<>();
        if (kgCanonicalName != null && !kgError) {
            suggested.add(kgCanonicalName);
        }
        if (!kgError) {
            suggested.add(candidate);
        } else if (kgCanonicalName != null && !kgCanonicalName.equalsIgnoreCase(candidate)) {
            // the graph pointed at another entity; offer it for the reviewer to consider
            suggested.add(kgCanonicalName);
        }
        return new ArrayList<>(suggested);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String label(EvidenceTier tier) {
        return switch (tier) {
            case WEB_SEARCH -> "Web search";
            case KNOWLEDGE_GRAPH -> "Knowledge graph";
            case VISION -> "Vision";
            case TRANSLATION -> "Translation";
        };
    }

    public record BrandAssessment(
            int confidence,
            List<ValidationIssue> issues,
            List<String> suggestedCodes,
            String reasoning,
            String recommendation
    ) {
        public static final String APPROVE = "approve";
        public static final String REVIEW = "review";
        public static final String REJECT = "reject";
    }
}
