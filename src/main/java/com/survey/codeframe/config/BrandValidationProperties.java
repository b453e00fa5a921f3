package com.survey.codeframe.config;

import com.survey.codeframe.brand.EvidenceTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

@Data
@Configuration
@ConfigurationProperties(prefix = "codeframe.brand")
public class BrandValidationProperties {

    private Map<EvidenceTier, Double> weights = defaultWeights();

    // Tier-2 ERROR caps confidence strictly below this value
    private int kgErrorCeiling = 20;

    private int approveThreshold = 70;
    private int rejectThreshold = 40;
    private int maxIssuesBeforeReject = 3;

    private long tierTimeoutMs = 15000;
    private int retryAttempts = 3;
    private long retryBackoffMs = 500;
    private double retryBackoffMultiplier = 2.0;

    private Set<EvidenceTier> enabledOptionalTiers = EnumSet.of(EvidenceTier.VISION);

    private int webResultCount = 10;
    private int kgResultCount = 5;

    public double weightOf(EvidenceTier tier) {
        return weights.getOrDefault(tier, 0.0);
    }

    public boolean isEnabled(EvidenceTier tier) {
        return !tier.isOptional() || enabledOptionalTiers.contains(tier);
    }

    private static Map<EvidenceTier, Double> defaultWeights() {
        Map<EvidenceTier, Double> weights = new EnumMap<>(EvidenceTier.class);
        weights.put(EvidenceTier.WEB_SEARCH, 35.0);
        weights.put(EvidenceTier.KNOWLEDGE_GRAPH, 25.0);
        weights.put(EvidenceTier.VISION, 30.0);
        weights.put(EvidenceTier.TRANSLATION, 10.0);
        return weights;
    }
}
