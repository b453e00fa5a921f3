package com.survey.codeframe.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.entity.CodeframeGeneration;
import com.survey.codeframe.entity.GenerationStatus;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.entity.NodeType;
import com.survey.codeframe.exception.ErrorKind;
import com.survey.codeframe.exception.GenerationConflictException;
import com.survey.codeframe.exception.ResourceNotFoundException;
import com.survey.codeframe.hierarchy.HierarchyTree;
import com.survey.codeframe.repository.CodeframeGenerationRepository;
import com.survey.codeframe.repository.HierarchyNodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GenerationStateServiceTest {

    private CodeframeGenerationRepository generationRepository;
    private HierarchyNodeRepository nodeRepository;
    private UsageLedgerService usageLedger;
    private GenerationStateService stateService;
    private UUID generationId;

    @BeforeEach
    void setUp() {
        generationRepository = mock(CodeframeGenerationRepository.class);
        nodeRepository = mock(HierarchyNodeRepository.class);
        usageLedger = mock(UsageLedgerService.class);
        stateService = new GenerationStateService(generationRepository, nodeRepository, usageLedger, new ObjectMapper());
        generationId = UUID.randomUUID();
        when(generationRepository.save(any(CodeframeGeneration.class))).thenAnswer(inv -> inv.getArgument(0));
        when(generationRepository.saveAndFlush(any(CodeframeGeneration.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private CodeframeGeneration stored(GenerationStatus status, int progress) {
        CodeframeGeneration generation = CodeframeGeneration.builder()
                .id(generationId)
                .categoryId(7L)
                .status(status)
                .progressPercent(progress)
                .currentStep("clustering")
                .build();
        when(generationRepository.findById(generationId)).thenReturn(Optional.of(generation));
        return generation;
    }

    private HierarchyTree smallTree() {
        HierarchyTree tree = new HierarchyTree();
        HierarchyNode root = tree.add(HierarchyNode.builder()
                .id(UUID.randomUUID()).generationId(generationId).level(NodeType.CATEGORY.getLevel())
                .nodeType(NodeType.CATEGORY).name("Toothpaste").clusterSize(20).build());
        HierarchyNode theme = tree.add(HierarchyNode.builder()
                .id(UUID.randomUUID()).generationId(generationId).parentId(root.getId())
                .level(NodeType.THEME.getLevel()).nodeType(NodeType.THEME).name("Whitening").clusterSize(20).build());
        tree.add(HierarchyNode.builder()
                .id(UUID.randomUUID()).generationId(generationId).parentId(theme.getId())
                .level(NodeType.CODE.getLevel()).nodeType(NodeType.CODE).name("Whiter teeth").clusterSize(20).build());
        return tree;
    }

    private GenerationStateService.GenerationResult result() {
        return new GenerationStateService.GenerationResult(1, 1, 1, 3, 88.5, List.of(), 1200L);
    }

    @Test
    void testCreateProcessingStartsQueued() {
        CodeframeGeneration generation = CodeframeGeneration.builder().categoryId(7L).progressPercent(40).build();

        CodeframeGeneration created = stateService.createProcessing(generation);

        assertEquals(GenerationStatus.PROCESSING, created.getStatus());
        assertEquals(0, created.getProgressPercent());
        assertEquals("queued", created.getCurrentStep());
    }

    @Test
    void testCreateProcessingRejectsSecondActiveGeneration() {
        when(generationRepository.existsByCategoryIdAndStatus(7L, GenerationStatus.PROCESSING)).thenReturn(true);

        assertThrows(GenerationConflictException.class,
                () -> stateService.createProcessing(CodeframeGeneration.builder().categoryId(7L).build()));
        verify(generationRepository, never()).saveAndFlush(any(CodeframeGeneration.class));
    }

    @Test
    void testUniqueIndexViolationIsConflict() {
        when(generationRepository.saveAndFlush(any(CodeframeGeneration.class)))
                .thenThrow(new DataIntegrityViolationException("uq_codeframe_generations_processing"));

        GenerationConflictException e = assertThrows(GenerationConflictException.class,
                () -> stateService.createProcessing(CodeframeGeneration.builder().categoryId(7L).build()));

        assertEquals(ErrorKind.GENERATION_CONFLICT, e.getKind());
        assertInstanceOf(DataIntegrityViolationException.class, e.getCause());
    }

    @Test
    void testAdvanceMovesForward() {
        CodeframeGeneration generation = stored(GenerationStatus.PROCESSING, 25);

        stateService.advance(generationId, "labeling", 40);

        assertEquals(40, generation.getProgressPercent());
        assertEquals("labeling", generation.getCurrentStep());
        verify(generationRepository).save(generation);
    }

    @Test
    void testAdvanceIgnoresLowerPercent() {
        CodeframeGeneration generation = stored(GenerationStatus.PROCESSING, 70);

        stateService.advance(generationId, "labeling", 55);

        assertEquals(70, generation.getProgressPercent());
        assertEquals("clustering", generation.getCurrentStep());
        verify(generationRepository, never()).save(any(CodeframeGeneration.class));
    }

    @Test
    void testAdvanceIgnoresFinishedGeneration() {
        CodeframeGeneration generation = stored(GenerationStatus.FAILED, 25);

        stateService.advance(generationId, "mece", 70);

        assertEquals(25, generation.getProgressPercent());
        verify(generationRepository, never()).save(any(CodeframeGeneration.class));
    }

    @Test
    void testFailRecordsKindAndMessage() {
        CodeframeGeneration generation = stored(GenerationStatus.PROCESSING, 25);

        stateService.fail(generationId, ErrorKind.CLUSTERING_ERROR, "Not enough answers to cluster", 900L);

        assertEquals(GenerationStatus.FAILED, generation.getStatus());
        assertEquals(ErrorKind.CLUSTERING_ERROR, generation.getErrorKind());
        assertEquals("Not enough answers to cluster", generation.getErrorMessage());
        assertEquals(900L, generation.getProcessingTimeMs());
    }

    @Test
    void testFailDoesNothingOnCompletedOrAppliedGeneration() {
        for (GenerationStatus status : List.of(GenerationStatus.COMPLETED, GenerationStatus.APPLIED)) {
            CodeframeGeneration generation = stored(status, 100);

            stateService.fail(generationId, ErrorKind.INTERNAL_ERROR, "late failure", 10L);

            assertEquals(status, generation.getStatus());
            assertNull(generation.getErrorKind());
        }
        verify(generationRepository, never()).save(any(CodeframeGeneration.class));
    }

    @Test
    void testPublishSavesNodesThenCompletes() {
        CodeframeGeneration generation = stored(GenerationStatus.PROCESSING, 95);
        when(usageLedger.totalsForGeneration(generationId)).thenReturn(
                new UsageLedgerService.UsageTotals("gpt-4o-mini", 6000, 600, new BigDecimal("0.000870"), 4));
        HierarchyTree tree = smallTree();

        CodeframeGeneration published = stateService.publish(generationId, tree, result());

        InOrder order = inOrder(nodeRepository, generationRepository);
        order.verify(nodeRepository).saveAll(tree.nodes());
        order.verify(generationRepository).save(generation);

        assertEquals(GenerationStatus.COMPLETED, published.getStatus());
        assertEquals(100, published.getProgressPercent());
        assertEquals("completed", published.getCurrentStep());
        assertEquals(1, published.getCodeCount());
        assertEquals(3, published.getNoiseCount());
        assertEquals(88.5, published.getMeceScore());
        assertEquals("[]", published.getMeceWarnings());
        assertEquals("gpt-4o-mini", published.getAiModel());
        assertEquals(6000, published.getAiInputTokens());
        assertEquals(new BigDecimal("0.000870"), published.getAiCostUsd());
    }

    @Test
    void testPublishRefusesGenerationThatIsNotProcessing() {
        stored(GenerationStatus.FAILED, 40);

        assertThrows(IllegalStateException.class, () -> stateService.publish(generationId, smallTree(), result()));
        verify(nodeRepository, never()).saveAll(anyList());
        verify(generationRepository, never()).save(any(CodeframeGeneration.class));
    }

    @Test
    void testUnknownGenerationIsNotFound() {
        when(generationRepository.findById(generationId)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> stateService.advance(generationId, "mece", 70));
    }
}
