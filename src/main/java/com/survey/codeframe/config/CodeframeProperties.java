package com.survey.codeframe.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pipeline defaults. Per-request overrides are merged on top of these into an {@link AlgorithmConfig}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "codeframe")
public class CodeframeProperties {

    private Clustering clustering = new Clustering();
    private Mece mece = new Mece();
    private Generation generation = new Generation();
    private Cost cost = new Cost();

    // USD per 1M tokens, keyed by model name
    private Map<String, ModelPrice> pricing = new LinkedHashMap<>();

    @Data
    public static class Clustering {
        private int minClusterSize = 5;
        private int minSamples = 3;
        private int representativeCount = 5;
        private int themeMinClusterSize = 2;
        private int themeMinSamples = 1;
    }

    @Data
    public static class Mece {
        private double coverageThreshold = 0.30;
        private double overlapThreshold = 0.85;
        private double overlapWarningThreshold = 0.70;
        private double gapThreshold = 0.10;
    }

    @Data
    public static class Generation {
        private int minAnswers = 10;
        private String embeddingModel = "text-embedding-3-small";
        private String labelingModel = "gpt-4o-mini";
        private int labelingExampleCount = 10;
    }

    @Data
    public static class Cost {
        private double dailyLimit = 25.00;
        private double alertRatio = 0.9;
    }

    @Data
    public static class ModelPrice {
        private double inputPerMillion;
        private double outputPerMillion;
    }
}
