package com.survey.codeframe.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.survey.codeframe.exception.InputException;

import java.util.Map;

/**
 * Effective parameters of one generation: configured defaults with request overrides applied.
 * Stored on the generation as algorithm_config.
 */
public record AlgorithmConfig(
        @JsonProperty("min_cluster_size") int minClusterSize,
        @JsonProperty("min_samples") int minSamples,
        @JsonProperty("representative_count") int representativeCount,
        @JsonProperty("theme_min_cluster_size") int themeMinClusterSize,
        @JsonProperty("theme_min_samples") int themeMinSamples,
        @JsonProperty("coverage_threshold") double coverageThreshold,
        @JsonProperty("overlap_threshold") double overlapThreshold,
        @JsonProperty("overlap_warning_threshold") double overlapWarningThreshold,
        @JsonProperty("gap_threshold") double gapThreshold,
        @JsonProperty("embedding_model") String embeddingModel,
        @JsonProperty("labeling_model") String labelingModel
) {

    public static AlgorithmConfig defaults(CodeframeProperties properties) {
        return merge(properties, Map.of());
    }

    public static AlgorithmConfig merge(CodeframeProperties properties, Map<String, Object> overrides) {
        CodeframeProperties.Clustering c = properties.getClustering();
        CodeframeProperties.Mece m = properties.getMece();
        CodeframeProperties.Generation g = properties.getGeneration();
        Map<String, Object> o = overrides == null ? Map.of() : overrides;

        AlgorithmConfig config = new AlgorithmConfig(
                intValue(o, "min_cluster_size", c.getMinClusterSize()),
                intValue(o, "min_samples", c.getMinSamples()),
                intValue(o, "representative_count", c.getRepresentativeCount()),
                intValue(o, "theme_min_cluster_size", c.getThemeMinClusterSize()),
                intValue(o, "theme_min_samples", c.getThemeMinSamples()),
                doubleValue(o, "coverage_threshold", m.getCoverageThreshold()),
                doubleValue(o, "overlap_threshold", m.getOverlapThreshold()),
                overlapWarningValue(o, m),
                doubleValue(o, "gap_threshold", m.getGapThreshold()),
                stringValue(o, "embedding_model", g.getEmbeddingModel()),
                stringValue(o, "labeling_model", g.getLabelingModel())
        );
        config.validate();
        return config;
    }

    private void validate() {
        if (minClusterSize < 2 || themeMinClusterSize < 2) {
            throw new InputException("min_cluster_size must be at least 2");
        }
        if (minSamples < 1 || themeMinSamples < 1) {
            throw new InputException("min_samples must be at least 1");
        }
        if (representativeCount < 1) {
            throw new InputException("representative_count must be at least 1");
        }
        if (outOfUnitRange(coverageThreshold) || outOfUnitRange(overlapThreshold)
                || outOfUnitRange(overlapWarningThreshold) || outOfUnitRange(gapThreshold)) {
            throw new InputException("MECE thresholds must be between 0 and 1");
        }
        if (overlapWarningThreshold > overlapThreshold) {
            throw new InputException("overlap_warning_threshold must not exceed overlap_threshold");
        }
    }

    /**
     * A lowered overlap_threshold pulls the configured warning level down with it unless the
     * request sets the warning level itself.
     */
    private static double overlapWarningValue(Map<String, Object> overrides, CodeframeProperties.Mece mece) {
        if (overrides.get("overlap_warning_threshold") != null) {
            return doubleValue(overrides, "overlap_warning_threshold", mece.getOverlapWarningThreshold());
        }
        double overlap = doubleValue(overrides, "overlap_threshold", mece.getOverlapThreshold());
        return Math.min(mece.getOverlapWarningThreshold(), overlap);
    }

    private static boolean outOfUnitRange(double value) {
        return value < 0.0 || value > 1.0;
    }

    private static int intValue(Map<String, Object> overrides, String key, int fallback) {
        Object value = overrides.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InputException("algorithm_config." + key + " is not an integer: " + value, e);
        }
    }

    private static double doubleValue(Map<String, Object> overrides, String key, double fallback) {
        Object value = overrides.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InputException("algorithm_config." + key + " is not a number: " + value, e);
        }
    }

    private static String stringValue(Map<String, Object> overrides, String key, String fallback) {
        Object value = overrides.get(key);
        return value == null || value.toString().isBlank() ? fallback : value.toString();
    }
}
