package com.survey.codeframe.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.brand.SearchCredentials;
import com.survey.codeframe.clustering.AnswerCluster;
import com.survey.codeframe.clustering.ClusteringResult;
import com.survey.codeframe.config.AlgorithmConfig;
import com.survey.codeframe.config.CodeframeProperties;
import com.survey.codeframe.config.GoogleProperties;
import com.survey.codeframe.dto.GenerationRequest;
import com.survey.codeframe.dto.GenerationStartResponse;
import com.survey.codeframe.entity.Answer;
import com.survey.codeframe.entity.Category;
import com.survey.codeframe.entity.CodeframeGeneration;
import com.survey.codeframe.entity.CodingType;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.entity.NodeType;
import com.survey.codeframe.exception.ClusteringException;
import com.survey.codeframe.exception.EmbeddingServiceException;
import com.survey.codeframe.exception.ErrorKind;
import com.survey.codeframe.exception.GenerationConflictException;
import com.survey.codeframe.exception.InputException;
import com.survey.codeframe.hierarchy.HierarchyTree;
import com.survey.codeframe.repository.AnswerRepository;
import com.survey.codeframe.repository.CategoryRepository;
import com.survey.codeframe.repository.CodeframeGenerationRepository;
import com.survey.codeframe.repository.HierarchyNodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CodeframeGenerationServiceTest {

    private CategoryRepository categoryRepository;
    private AnswerRepository answerRepository;
    private EmbeddingCacheService embeddingCache;
    private ClusteringService clusteringService;
    private HierarchyBuilderService hierarchyBuilder;
    private MeceValidatorService meceValidator;
    private BrandValidationService brandValidation;
    private GenerationStateService stateService;
    private UsageLedgerService usageLedger;
    private GoogleProperties googleProperties;
    private List<Runnable> queued;
    private CodeframeGenerationService service;

    private final Category toothpaste = Category.builder().id(7L).name("Toothpaste").language("en").build();

    @BeforeEach
    void setUp() {
        categoryRepository = mock(CategoryRepository.class);
        answerRepository = mock(AnswerRepository.class);
        embeddingCache = mock(EmbeddingCacheService.class);
        clusteringService = mock(ClusteringService.class);
        hierarchyBuilder = mock(HierarchyBuilderService.class);
        meceValidator = mock(MeceValidatorService.class);
        brandValidation = mock(BrandValidationService.class);
        stateService = mock(GenerationStateService.class);
        usageLedger = mock(UsageLedgerService.class);
        googleProperties = new GoogleProperties();
        queued = new ArrayList<>();

        when(categoryRepository.findById(7L)).thenReturn(Optional.of(toothpaste));
        when(answerRepository.findByCategoryIdOrderByIdAsc(7L)).thenReturn(answers(12));
        when(stateService.createProcessing(any())).thenAnswer(invocation -> {
            CodeframeGeneration generation = invocation.getArgument(0);
            generation.setId(UUID.randomUUID());
            return generation;
        });

        service = new CodeframeGenerationService(categoryRepository, answerRepository,
                mock(CodeframeGenerationRepository.class), mock(HierarchyNodeRepository.class),
                embeddingCache, clusteringService, hierarchyBuilder, meceValidator, brandValidation,
                stateService, usageLedger, new CodeframeProperties(), googleProperties, new ObjectMapper(),
                queued::add);
    }

    private List<Answer> answers(int count) {
        List<Answer> answers = new ArrayList<>();
        for (long id = 1; id <= count; id++) {
            answers.add(Answer.builder().id(id).categoryId(7L).answerText("answer " + id).build());
        }
        return answers;
    }

    private GenerationRequest request(String codingType) {
        return GenerationRequest.builder().categoryId(7L).codingType(codingType).createdBy("analyst").build();
    }

    @Test
    void testStartCreatesProcessingGenerationAndQueuesPipeline() {
        GenerationStartResponse response = service.start(request("open-ended"));

        assertNotNull(response.generationId());
        assertEquals("processing", response.status());
        assertEquals(1, queued.size());

        ArgumentCaptor<CodeframeGeneration> captor = ArgumentCaptor.forClass(CodeframeGeneration.class);
        verify(stateService).createProcessing(captor.capture());
        assertEquals(12, captor.getValue().getAnswerCount());
        assertEquals(CodingType.OPEN_ENDED, captor.getValue().getCodingType());
        assertTrue(captor.getValue().getAlgorithmConfig().contains("\"min_cluster_size\""));
    }

    @Test
    void testSecondStartForSameCategoryConflicts() {
        service.start(request("open-ended"));

        assertThrows(GenerationConflictException.class, () -> service.start(request("open-ended")));
        verify(stateService, times(1)).createProcessing(any());
    }

    @Test
    void testMissingCategoryIdIsRejected() {
        GenerationRequest request = GenerationRequest.builder().codingType("open-ended").build();

        assertThrows(InputException.class, () -> service.start(request));
    }

    @Test
    void testUnknownCodingTypeIsRejected() {
        InputException e = assertThrows(InputException.class, () -> service.start(request("emotion")));

        assertTrue(e.getMessage().contains("emotion"));
    }

    @Test
    void testUnknownCategoryIsRejected() {
        GenerationRequest request = GenerationRequest.builder().categoryId(99L).build();
        when(categoryRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(InputException.class, () -> service.start(request));
    }

    @Test
    void testTooFewAnswersIsRejected() {
        List<Answer> answers = answers(9);
        answers.add(Answer.builder().id(10L).categoryId(7L).answerText("   ").build());
        when(answerRepository.findByCategoryIdOrderByIdAsc(7L)).thenReturn(answers);

        InputException e = assertThrows(InputException.class, () -> service.start(request("open-ended")));

        assertTrue(e.getMessage().contains("9 answers"));
        verify(stateService, never()).createProcessing(any());
    }

    @Test
    void testBrandCodingNeedsSearchCredentials() {
        assertThrows(InputException.class, () -> service.start(request("brand")));

        GenerationRequest withKeys = request("brand");
        withKeys.setApiKeys(Map.of(SearchCredentials.API_KEY, "key", SearchCredentials.ENGINE_ID, "cx"));
        assertEquals("processing", service.start(withKeys).status());
    }

    @Test
    void testInvalidAlgorithmConfigIsRejected() {
        GenerationRequest request = request("open-ended");
        request.setAlgorithmConfig(Map.of("min_cluster_size", 1));

        assertThrows(InputException.class, () -> service.start(request));
    }

    @Test
    void testExhaustedBudgetIsRejected() {
        when(usageLedger.isOverBudget()).thenReturn(true);

        assertThrows(InputException.class, () -> service.start(request("open-ended")));
    }

    private CodeframeGenerationService.PipelineInput input(UUID generationId, CodingType codingType) {
        SearchCredentials credentials = codingType == CodingType.BRAND ? new SearchCredentials("key", "cx") : null;
        return new CodeframeGenerationService.PipelineInput(generationId, toothpaste, codingType, answers(12),
                AlgorithmConfig.defaults(new CodeframeProperties()), credentials);
    }

    private HierarchyTree tree(UUID generationId) {
        HierarchyTree tree = new HierarchyTree();
        HierarchyNode root = tree.add(HierarchyNode.builder().generationId(generationId)
                .nodeType(NodeType.CATEGORY).name("Toothpaste").build());
        HierarchyNode theme = tree.add(HierarchyNode.builder().generationId(generationId)
                .nodeType(NodeType.THEME).parentId(root.getId()).name("Brands").build());
        tree.add(HierarchyNode.builder().generationId(generationId)
                .nodeType(NodeType.CODE).parentId(theme.getId()).name("Colgate").clusterSize(6).build());
        tree.add(HierarchyNode.builder().generationId(generationId)
                .nodeType(NodeType.CODE).parentId(theme.getId()).name("Sensodyne").clusterSize(5).build());
        return tree;
    }

    private void stubPipeline(UUID generationId) {
        Map<Long, float[]> embeddings = new LinkedHashMap<>();
        for (long id = 1; id <= 12; id++) {
            embeddings.put(id, new float[]{id, 1f});
        }
        when(embeddingCache.getOrComputeAll(any(), anyString(), any())).thenReturn(embeddings);
        when(clusteringService.cluster(any(), any())).thenReturn(new ClusteringResult(List.of(
                new AnswerCluster(0, List.of(1L, 2L, 3L, 4L, 5L, 6L), List.of(1L), new float[]{1f, 0f}),
                new AnswerCluster(1, List.of(7L, 8L, 9L, 10L, 11L), List.of(7L), new float[]{0f, 1f})),
                List.of(12L)));
        when(hierarchyBuilder.build(any(), any())).thenReturn(tree(generationId));
        when(meceValidator.validate(any(), any(), any())).thenReturn(
                new MeceValidatorService.MeceReport(91.5, 0.92, 0.0, 0.8, 0.2, List.of(12L), List.of()));
    }

    @Test
    void testPipelinePublishesResultInStepOrder() {
        UUID generationId = UUID.randomUUID();
        stubPipeline(generationId);

        service.runPipeline(input(generationId, CodingType.OPEN_ENDED));

        InOrder order = inOrder(stateService);
        order.verify(stateService).advance(generationId, "embedding", 5);
        order.verify(stateService).advance(generationId, "clustering", 25);
        order.verify(stateService).advance(generationId, "labeling", 40);
        order.verify(stateService).advance(generationId, "mece", 70);
        order.verify(stateService).advance(generationId, "publishing", 95);

        ArgumentCaptor<GenerationStateService.GenerationResult> result =
                ArgumentCaptor.forClass(GenerationStateService.GenerationResult.class);
        order.verify(stateService).publish(eq(generationId), any(), result.capture());
        assertEquals(2, result.getValue().clusterCount());
        assertEquals(1, result.getValue().themeCount());
        assertEquals(2, result.getValue().codeCount());
        assertEquals(1, result.getValue().noiseCount());
        assertEquals(91.5, result.getValue().meceScore());

        verify(brandValidation, never()).validateAll(any(), any(), any(), any());
        verify(stateService, never()).fail(any(), any(), any(), anyLong());
    }

    @Test
    void testBrandPipelineValidatesEveryCode() {
        UUID generationId = UUID.randomUUID();
        stubPipeline(generationId);

        service.runPipeline(input(generationId, CodingType.BRAND));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<HierarchyNode>> codes = ArgumentCaptor.forClass(List.class);
        verify(stateService).advance(generationId, "brand_validation", 85);
        verify(brandValidation).validateAll(codes.capture(), eq(toothpaste), any(), any());
        assertEquals(2, codes.getValue().size());
    }

    @Test
    void testEmbeddingFailureFailsGenerationWithItsKind() {
        UUID generationId = UUID.randomUUID();
        when(embeddingCache.getOrComputeAll(any(), anyString(), any()))
                .thenThrow(new EmbeddingServiceException("OpenAI returned 500"));

        service.runPipeline(input(generationId, CodingType.OPEN_ENDED));

        verify(stateService).fail(eq(generationId), eq(ErrorKind.EMBEDDING_SERVICE_ERROR),
                eq("OpenAI returned 500"), anyLong());
        verify(stateService, never()).publish(any(), any(), any());
    }

    @Test
    void testClusteringFailureFailsGeneration() {
        UUID generationId = UUID.randomUUID();
        when(embeddingCache.getOrComputeAll(any(), anyString(), any())).thenReturn(Map.of());
        when(clusteringService.cluster(any(), any()))
                .thenThrow(new ClusteringException("Insufficient data: 0 answers"));

        service.runPipeline(input(generationId, CodingType.OPEN_ENDED));

        verify(stateService).fail(eq(generationId), eq(ErrorKind.CLUSTERING_ERROR), anyString(), anyLong());
    }

    @Test
    void testUnexpectedFailureIsInternalError() {
        UUID generationId = UUID.randomUUID();
        when(embeddingCache.getOrComputeAll(any(), anyString(), any())).thenThrow(new IllegalStateException("boom"));

        service.runPipeline(input(generationId, CodingType.OPEN_ENDED));

        verify(stateService).fail(eq(generationId), eq(ErrorKind.INTERNAL_ERROR), eq("boom"), anyLong());
    }

    @Test
    void testCategoryIsReleasedAfterPipelineRuns() {
        service.start(request("open-ended"));
        queued.get(0).run();

        assertEquals("processing", service.start(request("open-ended")).status());
        verify(stateService).fail(any(), eq(ErrorKind.INTERNAL_ERROR), any(), anyLong());
    }
}
