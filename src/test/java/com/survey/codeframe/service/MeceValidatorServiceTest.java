package com.survey.codeframe.service;

import com.survey.codeframe.config.AlgorithmConfig;
import com.survey.codeframe.config.CodeframeProperties;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.entity.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MeceValidatorServiceTest {

    private MeceValidatorService validator;
    private AlgorithmConfig config;

    @BeforeEach
    void setUp() {
        validator = new MeceValidatorService();
        config = AlgorithmConfig.defaults(new CodeframeProperties());
    }

    private HierarchyNode code(String name, float... embedding) {
        return HierarchyNode.builder()
                .id(UUID.randomUUID())
                .nodeType(NodeType.CODE)
                .level(2)
                .name(name)
                .embedding(embedding)
                .build();
    }

    private List<MeceValidatorService.MeceWarning> ofType(MeceValidatorService.MeceReport report, String type) {
        return report.warnings().stream().filter(w -> w.type().equals(type)).collect(Collectors.toList());
    }

    @Test
    void testOverlappingCodesAreReported() {
        HierarchyNode whitening = code("Whitening", 1f, 0f);
        HierarchyNode brightSmile = code("Bright smile", 0.95f, 0.31225f);
        Map<Long, float[]> answers = Map.of(1L, new float[]{1f, 0f}, 2L, new float[]{0.95f, 0.31225f});

        MeceValidatorService.MeceReport report = validator.validate(answers, List.of(whitening, brightSmile), config);

        List<MeceValidatorService.MeceWarning> overlaps = ofType(report, "OVERLAP");
        assertEquals(1, overlaps.size());
        assertTrue(overlaps.get(0).nodeNames().containsAll(List.of("Whitening", "Bright smile")));
        assertTrue(overlaps.get(0).nodeIds().contains(whitening.getId().toString()));
        assertTrue(overlaps.get(0).nodeIds().contains(brightSmile.getId().toString()));
        assertEquals(0.95, overlaps.get(0).similarity(), 0.001);
        assertEquals(1.0, report.overlapFraction());
    }

    @Test
    void testCloseCodesGetInformationalWarningWithoutLoweringScore() {
        // similarity 0.8: above the 0.70 warning level, below the 0.85 overlap level
        HierarchyNode whitening = code("Whitening", 1f, 0f);
        HierarchyNode stainRemoval = code("Stain removal", 0.8f, 0.6f);
        Map<Long, float[]> answers = Map.of(1L, new float[]{1f, 0f}, 2L, new float[]{0.8f, 0.6f});

        MeceValidatorService.MeceReport report = validator.validate(answers, List.of(whitening, stainRemoval), config);

        assertTrue(ofType(report, "OVERLAP").isEmpty());
        List<MeceValidatorService.MeceWarning> near = ofType(report, "NEAR_OVERLAP");
        assertEquals(1, near.size());
        assertEquals("info", near.get(0).severity());
        assertEquals(0.8, near.get(0).similarity(), 0.001);
        assertEquals(0.0, report.overlapFraction());
        assertEquals(100.0, report.score());
    }

    @Test
    void testAnswerFarFromEveryCodeIsUncovered() {
        HierarchyNode a = code("Price", 1f, 0f, 0f);
        HierarchyNode b = code("Taste", 0f, 1f, 0f);
        Map<Long, float[]> answers = new LinkedHashMap<>();
        for (long id = 1; id <= 9; id++) {
            answers.put(id, id % 2 == 0 ? new float[]{1f, 0.1f, 0f} : new float[]{0.1f, 1f, 0f});
        }
        // maximum similarity 0.1
        answers.put(10L, new float[]{0.1f, 0f, (float) Math.sqrt(0.99)});

        MeceValidatorService.MeceReport report = validator.validate(answers, List.of(a, b), config);

        assertEquals(List.of(10L), report.uncoveredAnswerIds());
        List<MeceValidatorService.MeceWarning> uncovered = ofType(report, "UNCOVERED");
        assertEquals(1, uncovered.size());
        assertEquals(List.of(10L), uncovered.get(0).answerIds());
        assertEquals(0.1, report.minCoverageSimilarity(), 0.001);
        // 10% uncovered does not exceed the 10% gap threshold
        assertTrue(ofType(report, "GAP").isEmpty());
        assertEquals(94.0, report.score(), 0.001);
    }

    @Test
    void testLargeUncoveredShareRaisesGapWarning() {
        HierarchyNode a = code("Price", 1f, 0f);
        Map<Long, float[]> answers = Map.of(
                1L, new float[]{1f, 0f},
                2L, new float[]{0f, 1f},
                3L, new float[]{0f, 1f});

        MeceValidatorService.MeceReport report = validator.validate(answers, List.of(a), config);

        assertEquals(1, ofType(report, "GAP").size());
        assertEquals(List.of(2L, 3L), report.uncoveredAnswerIds());
    }

    @Test
    void testScoreIsDeterministicAndInRange() {
        HierarchyNode a = code("A", 1f, 0f, 0f);
        HierarchyNode b = code("B", 0.9f, 0.1f, 0f);
        HierarchyNode c = code("C", 0f, 0f, 1f);
        Map<Long, float[]> answers = new LinkedHashMap<>();
        answers.put(1L, new float[]{1f, 0f, 0f});
        answers.put(2L, new float[]{0f, 1f, 0f});
        answers.put(3L, new float[]{0f, 0.2f, 1f});

        MeceValidatorService.MeceReport first = validator.validate(answers, List.of(a, b, c), config);
        MeceValidatorService.MeceReport second = validator.validate(answers, List.of(c, b, a), config);

        assertEquals(first, second);
        assertTrue(first.score() >= 0.0 && first.score() <= 100.0);
    }

    @Test
    void testPerfectHierarchyScoresHundred() {
        HierarchyNode a = code("A", 1f, 0f);
        HierarchyNode b = code("B", 0f, 1f);
        Map<Long, float[]> answers = Map.of(1L, new float[]{1f, 0f}, 2L, new float[]{0f, 1f});

        MeceValidatorService.MeceReport report = validator.validate(answers, List.of(a, b), config);

        assertEquals(100.0, report.score());
        assertTrue(report.warnings().isEmpty());
    }
}
