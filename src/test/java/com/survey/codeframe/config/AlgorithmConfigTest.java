package com.survey.codeframe.config;

import com.survey.codeframe.exception.InputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AlgorithmConfigTest {

    private CodeframeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CodeframeProperties();
    }

    @Test
    void testDefaultsComeFromProperties() {
        AlgorithmConfig config = AlgorithmConfig.defaults(properties);

        assertEquals(properties.getClustering().getMinClusterSize(), config.minClusterSize());
        assertEquals(0.30, config.coverageThreshold());
        assertEquals(0.85, config.overlapThreshold());
        assertEquals(0.70, config.overlapWarningThreshold());
        assertEquals(0.10, config.gapThreshold());
        assertEquals(properties.getGeneration().getEmbeddingModel(), config.embeddingModel());
    }

    @Test
    void testOverridesWin() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("min_cluster_size", 8);
        overrides.put("min_samples", "2");
        overrides.put("overlap_threshold", 0.9);
        overrides.put("labeling_model", "gpt-4o");

        AlgorithmConfig config = AlgorithmConfig.merge(properties, overrides);

        assertEquals(8, config.minClusterSize());
        assertEquals(2, config.minSamples());
        assertEquals(0.9, config.overlapThreshold());
        assertEquals("gpt-4o", config.labelingModel());
        assertEquals(0.30, config.coverageThreshold());
    }

    @Test
    void testNullOverridesMeanDefaults() {
        assertEquals(AlgorithmConfig.defaults(properties), AlgorithmConfig.merge(properties, null));
    }

    @Test
    void testInvalidValuesAreInputErrors() {
        assertThrows(InputException.class, () -> AlgorithmConfig.merge(properties, Map.of("min_cluster_size", 1)));
        assertThrows(InputException.class, () -> AlgorithmConfig.merge(properties, Map.of("min_samples", 0)));
        assertThrows(InputException.class, () -> AlgorithmConfig.merge(properties, Map.of("gap_threshold", 1.5)));
        assertThrows(InputException.class, () -> AlgorithmConfig.merge(properties, Map.of("min_cluster_size", "five")));
        assertThrows(InputException.class, () -> AlgorithmConfig.merge(properties, Map.of("coverage_threshold", "high")));
        assertThrows(InputException.class,
                () -> AlgorithmConfig.merge(properties, Map.of("overlap_warning_threshold", 0.9)));
    }

    @Test
    void testLowerOverlapThresholdPullsWarningLevelDown() {
        AlgorithmConfig config = AlgorithmConfig.merge(properties, Map.of("overlap_threshold", 0.6));

        assertEquals(0.6, config.overlapThreshold());
        assertEquals(0.6, config.overlapWarningThreshold());
    }
}
