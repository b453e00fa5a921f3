package com.survey.codeframe.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.clustering.AnswerCluster;
import com.survey.codeframe.clustering.ClusteringResult;
import com.survey.codeframe.config.AlgorithmConfig;
import com.survey.codeframe.config.CodeframeProperties;
import com.survey.codeframe.entity.Category;
import com.survey.codeframe.entity.CodingType;
import com.survey.codeframe.entity.ConfidenceLevel;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.entity.NodeType;
import com.survey.codeframe.exception.LabelingException;
import com.survey.codeframe.hierarchy.ClusterLabel;
import com.survey.codeframe.hierarchy.ClusterLabeler;
import com.survey.codeframe.hierarchy.HierarchyTree;
import com.survey.codeframe.hierarchy.LabelingRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HierarchyBuilderServiceTest {

    @Mock
    private ClusterLabeler labeler;

    private HierarchyBuilderService builder;
    private Category category;
    private Map<Long, String> texts;
    private AlgorithmConfig config;

    @BeforeEach
    void setUp() {
        CodeframeProperties properties = new CodeframeProperties();
        builder = new HierarchyBuilderService(labeler, properties, new ObjectMapper());
        config = AlgorithmConfig.defaults(properties);
        category = Category.builder().id(7L).name("Favourite toothpaste brand").description("Q3").build();

        texts = new LinkedHashMap<>();
        for (long id = 1; id <= 5; id++) {
            texts.put(id, id % 2 == 0 ? "colgate" : "Colgate");
        }
        for (long id = 6; id <= 10; id++) {
            texts.put(id, "Sensodyne");
        }
        for (long id = 11; id <= 15; id++) {
            texts.put(id, "Aquafresh");
        }
    }

    private ClusteringResult threeClusters() {
        return new ClusteringResult(List.of(
                new AnswerCluster(0, List.of(1L, 2L, 3L, 4L, 5L), List.of(3L, 1L), new float[]{1f, 0f, 0f}),
                new AnswerCluster(1, List.of(6L, 7L, 8L, 9L, 10L), List.of(6L), new float[]{0.9f, 0.1f, 0f}),
                new AnswerCluster(2, List.of(11L, 12L, 13L, 14L, 15L), List.of(11L), new float[]{0f, 0f, 1f})),
                List.of(16L));
    }

    private HierarchyBuilderService.BuildInput input(CodingType codingType) {
        return new HierarchyBuilderService.BuildInput(UUID.randomUUID(), category, codingType,
                threeClusters(), texts, config, UsageContext.forGeneration(UUID.randomUUID(), 7L));
    }

    private void labelCodesByFirstExample() {
        when(labeler.label(any(), any())).thenAnswer(invocation -> {
            LabelingRequest request = invocation.getArgument(0);
            if (request.target() == LabelingRequest.Target.THEME) {
                return new ClusterLabel("Brands: " + String.join(", ", request.examples()),
                        "theme", "medium", "high", List.of());
            }
            return new ClusterLabel(request.examples().get(0), "code", "high", "medium", List.of());
        });
    }

    @Test
    void testBuildsFourLevelStructure() {
        labelCodesByFirstExample();

        HierarchyTree tree = builder.build(input(CodingType.OPEN_ENDED));

        HierarchyNode root = tree.root();
        assertEquals("Favourite toothpaste brand", root.getName());
        assertEquals(NodeType.CATEGORY, root.getNodeType());
        assertEquals(15, root.getClusterSize());

        List<HierarchyNode> codes = tree.nodesAtLevel(2);
        assertEquals(3, codes.size());
        for (HierarchyNode code : codes) {
            HierarchyNode parent = tree.get(code.getParentId()).orElseThrow();
            assertEquals(NodeType.THEME, parent.getNodeType());
            assertEquals(root.getId(), parent.getParentId());
            assertEquals(ConfidenceLevel.HIGH, code.getConfidence());
            assertNotNull(code.getEmbedding());
        }
        assertFalse(tree.nodesAtLevel(1).isEmpty());
        tree.validate();
    }

    @Test
    void testCodeCarriesClusterData() {
        labelCodesByFirstExample();

        HierarchyTree tree = builder.build(input(CodingType.OPEN_ENDED));

        HierarchyNode colgate = tree.nodesAtLevel(2).stream()
                .filter(n -> n.getClusterId() == 0)
                .findFirst()
                .orElseThrow();
        // representatives come first in the examples sent to the labeler
        assertEquals("Colgate", colgate.getName());
        assertEquals(5, colgate.getClusterSize());
        assertEquals(List.of(3L, 1L), colgate.getRepresentativeAnswerIds());
        assertTrue(colgate.getExampleTexts().contains("\"id\":\"3\""));
        assertTrue(colgate.getAutoGenerated());
        assertTrue(colgate.getVariants().isEmpty());
    }

    @Test
    void testBrandModeCollectsVariants() {
        labelCodesByFirstExample();

        HierarchyTree tree = builder.build(input(CodingType.BRAND));

        HierarchyNode colgate = tree.nodesAtLevel(2).stream()
                .filter(n -> n.getClusterId() == 0)
                .findFirst()
                .orElseThrow();
        assertEquals(List.of("Colgate"), colgate.getVariants());
    }

    @Test
    void testSubcodesHangUnderTheirCode() {
        when(labeler.label(any(), any())).thenAnswer(invocation -> {
            LabelingRequest request = invocation.getArgument(0);
            if (request.target() == LabelingRequest.Target.THEME) {
                return new ClusterLabel("Toothpaste", null, "high", "high", List.of());
            }
            return new ClusterLabel(request.examples().get(0), null, "high", "high",
                    List.of(new ClusterLabel.SubcodeLabel("Variant of " + request.examples().get(0), null, "low")));
        });

        HierarchyTree tree = builder.build(input(CodingType.OPEN_ENDED));

        List<HierarchyNode> subcodes = tree.nodesAtLevel(3);
        assertEquals(3, subcodes.size());
        for (HierarchyNode sub : subcodes) {
            assertEquals(NodeType.CODE, tree.get(sub.getParentId()).orElseThrow().getNodeType());
            assertEquals(ConfidenceLevel.LOW, sub.getConfidence());
        }
    }

    @Test
    void testProgressCallbackPerCode() {
        labelCodesByFirstExample();
        List<Integer> progress = new ArrayList<>();

        builder.build(input(CodingType.OPEN_ENDED), progress::add);

        assertEquals(List.of(1, 2, 3), progress);
    }

    @Test
    void testInvalidConfidenceFailsLabeling() {
        when(labeler.label(any(), any()))
                .thenReturn(new ClusterLabel("Colgate", null, "very sure", "high", List.of()));

        LabelingException e = assertThrows(LabelingException.class,
                () -> builder.build(input(CodingType.OPEN_ENDED)));
        assertTrue(e.getMessage().contains("very sure"));
    }

    @Test
    void testMissingNameFailsLabeling() {
        when(labeler.label(any(), any()))
                .thenReturn(new ClusterLabel("  ", null, "high", "high", List.of()));

        assertThrows(LabelingException.class, () -> builder.build(input(CodingType.OPEN_ENDED)));
        verify(labeler, times(1)).label(any(), any());
    }
}
