package com.survey.codeframe.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.brand.SearchCredentials;
import com.survey.codeframe.clustering.ClusteringResult;
import com.survey.codeframe.config.AlgorithmConfig;
import com.survey.codeframe.config.CodeframeProperties;
import com.survey.codeframe.config.GoogleProperties;
import com.survey.codeframe.dto.GenerationRequest;
import com.survey.codeframe.dto.GenerationStartResponse;
import com.survey.codeframe.dto.GenerationStatusResponse;
import com.survey.codeframe.dto.HierarchyNodeView;
import com.survey.codeframe.entity.Answer;
import com.survey.codeframe.entity.Category;
import com.survey.codeframe.entity.CodeframeGeneration;
import com.survey.codeframe.entity.CodingType;
import com.survey.codeframe.entity.GenerationStatus;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.entity.NodeType;
import com.survey.codeframe.exception.CodeframeException;
import com.survey.codeframe.exception.ErrorKind;
import com.survey.codeframe.exception.GenerationConflictException;
import com.survey.codeframe.exception.InputException;
import com.survey.codeframe.hierarchy.HierarchyTree;
import com.survey.codeframe.repository.AnswerRepository;
import com.survey.codeframe.repository.CategoryRepository;
import com.survey.codeframe.repository.CodeframeGenerationRepository;
import com.survey.codeframe.repository.HierarchyNodeRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs a generation end to end: embed, cluster, label, MECE check, brand validation,
 * publish. The request thread only validates and creates the row; the pipeline runs on
 * {@code generationExecutor} and reports progress through {@link GenerationStateService}.
 */
@Service
@Slf4j
public class CodeframeGenerationService {

    static final String STEP_EMBEDDING = "embedding";
    static final String STEP_CLUSTERING = "clustering";
    static final String STEP_LABELING = "labeling";
    static final String STEP_MECE = "mece";
    static final String STEP_BRAND_VALIDATION = "brand_validation";
    static final String STEP_PUBLISHING = "publishing";

    private final CategoryRepository categoryRepository;
    private final AnswerRepository answerRepository;
    private final CodeframeGenerationRepository generationRepository;
    private final HierarchyNodeRepository nodeRepository;
    private final EmbeddingCacheService embeddingCache;
    private final ClusteringService clusteringService;
    private final HierarchyBuilderService hierarchyBuilder;
    private final MeceValidatorService meceValidator;
    private final BrandValidationService brandValidation;
    private final GenerationStateService stateService;
    private final UsageLedgerService usageLedger;
    private final CodeframeProperties properties;
    private final GoogleProperties googleProperties;
    private final ObjectMapper objectMapper;
    private final Executor generationExecutor;

    // categories with a pipeline running in this instance
    private final Set<Long> activeCategories = ConcurrentHashMap.newKeySet();

    public CodeframeGenerationService(CategoryRepository categoryRepository,
                                      AnswerRepository answerRepository,
                                      CodeframeGenerationRepository generationRepository,
                                      HierarchyNodeRepository nodeRepository,
                                      EmbeddingCacheService embeddingCache,
                                      ClusteringService clusteringService,
                                      HierarchyBuilderService hierarchyBuilder,
                                      MeceValidatorService meceValidator,
                                      BrandValidationService brandValidation,
                                      GenerationStateService stateService,
                                      UsageLedgerService usageLedger,
                                      CodeframeProperties properties,
                                      GoogleProperties googleProperties,
                                      ObjectMapper objectMapper,
                                      @Qualifier("generationExecutor") Executor generationExecutor) {
        this.categoryRepository = categoryRepository;
        this.answerRepository = answerRepository;
        this.generationRepository = generationRepository;
        this.nodeRepository = nodeRepository;
        this.embeddingCache = embeddingCache;
        this.clusteringService = clusteringService;
        this.hierarchyBuilder = hierarchyBuilder;
        this.meceValidator = meceValidator;
        this.brandValidation = brandValidation;
        this.stateService = stateService;
        this.usageLedger = usageLedger;
        this.properties = properties;
        this.googleProperties = googleProperties;
        this.objectMapper = objectMapper;
        this.generationExecutor = generationExecutor;
    }

    /**
     * Validates the request, creates the generation in {@code processing} and schedules the pipeline.
     *
     * @throws InputException              invalid request
     * @throws GenerationConflictException another generation of the category is still processing
     */
    public GenerationStartResponse start(GenerationRequest request) {
        if (request.getCategoryId() == null) {
            throw new InputException("category_id is required");
        }
        CodingType codingType;
        try {
            codingType = CodingType.fromValue(request.getCodingType());
        } catch (IllegalArgumentException e) {
            throw new InputException(e.getMessage(), e);
        }

        Category category = categoryRepository.findById(request.getCategoryId())
                .orElseThrow(() -> new InputException("Category not found: " + request.getCategoryId()));
        List<Answer> answers = loadAnswers(category.getId(), request.getAnswerIds());
        int minAnswers = properties.getGeneration().getMinAnswers();
        if (answers.size() < minAnswers) {
            throw new InputException(String.format(
                    "Category '%s' has %d answers with text, at least %d are needed",
                    category.getName(), answers.size(), minAnswers));
        }

        AlgorithmConfig config = AlgorithmConfig.merge(properties, request.getAlgorithmConfig());

        SearchCredentials credentials = null;
        if (codingType == CodingType.BRAND) {
            credentials = SearchCredentials.resolve(request.getApiKeys(), googleProperties);
            if (!credentials.isComplete()) {
                throw new InputException("Brand coding needs Google search credentials ("
                        + SearchCredentials.API_KEY + ", " + SearchCredentials.ENGINE_ID + ")");
            }
        }

        if (usageLedger.isOverBudget()) {
            throw new InputException(String.format("Daily AI budget of $%.2f is exhausted",
                    properties.getCost().getDailyLimit()));
        }

        if (!activeCategories.add(category.getId())) {
            throw new GenerationConflictException("A generation is already processing for category " + category.getId());
        }

        CodeframeGeneration generation;
        try {
            generation = stateService.createProcessing(CodeframeGeneration.builder()
                    .categoryId(category.getId())
                    .codingType(codingType)
                    .answerIds(answers.stream().map(Answer::getId).collect(Collectors.toList()))
                    .answerCount(answers.size())
                    .algorithmConfig(toJson(config))
                    .createdBy(request.getCreatedBy())
                    .build());
        } catch (RuntimeException e) {
            activeCategories.remove(category.getId());
            throw e;
        }

        UUID generationId = generation.getId();
        PipelineInput input = new PipelineInput(generationId, category, codingType, answers, config, credentials);
        log.info("Generation {} started: category '{}', {} answers, coding type {}",
                generationId, category.getName(), answers.size(), codingType.getValue());

        try {
            CompletableFuture.runAsync(() -> runPipeline(input), generationExecutor)
                    .whenComplete((ignored, error) -> activeCategories.remove(category.getId()));
        } catch (RejectedExecutionException e) {
            activeCategories.remove(category.getId());
            stateService.fail(generationId, ErrorKind.INTERNAL_ERROR, "Generation queue is full", 0L);
            throw new GenerationConflictException("Too many generations queued, try again later", e);
        }

        return new GenerationStartResponse(generationId, GenerationStatus.PROCESSING.getValue());
    }

    /**
     * Runs every stage; never throws. Errors end the generation in {@code failed}.
     */
    void runPipeline(PipelineInput input) {
        UUID generationId = input.generationId();
        long startTime = System.currentTimeMillis();
        UsageContext context = UsageContext.forGeneration(generationId, input.category().getId());
        AlgorithmConfig config = input.config();

        try {
            stateService.advance(generationId, STEP_EMBEDDING, 5);
            Map<Long, float[]> embeddings = embeddingCache.getOrComputeAll(
                    input.answers(), config.embeddingModel(), context);

            stateService.advance(generationId, STEP_CLUSTERING, 25);
            ClusteringResult clustering = clusteringService.cluster(embeddings, config);

            stateService.advance(generationId, STEP_LABELING, 40);
            Map<Long, String> texts = new LinkedHashMap<>();
            for (Answer answer : input.answers()) {
                texts.put(answer.getId(), answer.getAnswerText());
            }
            int clusterTotal = clustering.clusterCount();
            HierarchyTree tree = hierarchyBuilder.build(new HierarchyBuilderService.BuildInput(
                    generationId, input.category(), input.codingType(), clustering, texts, config, context),
                    done -> stateService.advance(generationId, STEP_LABELING, 40 + (29 * done) / Math.max(1, clusterTotal)));

            stateService.advance(generationId, STEP_MECE, 70);
            List<HierarchyNode> codes = tree.nodesAtLevel(NodeType.CODE.getLevel());
            MeceValidatorService.MeceReport mece = meceValidator.validate(embeddings, codes, config);

            if (input.codingType() == CodingType.BRAND) {
                stateService.advance(generationId, STEP_BRAND_VALIDATION, 85);
                brandValidation.validateAll(codes, input.category(), input.credentials(), context);
            }

            stateService.advance(generationId, STEP_PUBLISHING, 95);
            stateService.publish(generationId, tree, new GenerationStateService.GenerationResult(
                    clustering.clusterCount(),
                    tree.nodesAtLevel(NodeType.THEME.getLevel()).size(),
                    codes.size(),
                    clustering.noiseAnswerIds().size(),
                    mece.score(),
                    mece.warnings(),
                    System.currentTimeMillis() - startTime));
        } catch (CodeframeException e) {
            log.error("Generation {} failed at {}: {}", generationId, e.getKind(), e.getMessage(), e);
            markFailed(generationId, e.getKind(), e.getMessage(), startTime);
        } catch (RuntimeException e) {
            log.error("Generation {} failed unexpectedly: {}", generationId, e.getMessage(), e);
            markFailed(generationId, ErrorKind.INTERNAL_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), startTime);
        }
    }

    public GenerationStatusResponse getStatus(UUID generationId) {
        CodeframeGeneration generation = stateService.find(generationId);
        return toStatus(generation, true);
    }

    /**
     * Generations of a category, newest first, without their hierarchies.
     */
    public List<GenerationStatusResponse> history(Long categoryId) {
        return generationRepository.findByCategoryIdOrderByCreatedAtDesc(categoryId).stream()
                .map(g -> toStatus(g, false))
                .collect(Collectors.toList());
    }

    private GenerationStatusResponse toStatus(CodeframeGeneration generation, boolean withHierarchy) {
        GenerationStatusResponse.GenerationStatusResponseBuilder response = GenerationStatusResponse.builder()
                .generationId(generation.getId())
                .status(generation.getStatus().getValue())
                .progressPercent(generation.getProgressPercent() != null ? generation.getProgressPercent() : 0)
                .currentStep(generation.getCurrentStep());

        if (generation.getStatus() == GenerationStatus.FAILED) {
            response.error(new GenerationStatusResponse.Error(
                    generation.getErrorKind() != null ? generation.getErrorKind().name() : ErrorKind.INTERNAL_ERROR.name(),
                    generation.getErrorMessage()));
        } else if (generation.getStatus() == GenerationStatus.COMPLETED
                || generation.getStatus() == GenerationStatus.APPLIED) {
            response.result(GenerationStatusResponse.Result.builder()
                    .clusterCount(generation.getClusterCount())
                    .themeCount(generation.getThemeCount())
                    .codeCount(generation.getCodeCount())
                    .noiseCount(generation.getNoiseCount())
                    .meceScore(generation.getMeceScore())
                    .meceWarnings(generation.getMeceWarnings())
                    .aiModel(generation.getAiModel())
                    .aiInputTokens(generation.getAiInputTokens())
                    .aiOutputTokens(generation.getAiOutputTokens())
                    .aiCostUsd(generation.getAiCostUsd())
                    .processingTimeMs(generation.getProcessingTimeMs())
                    .hierarchy(withHierarchy ? hierarchyView(generation.getId()) : null)
                    .build());
        }
        return response.build();
    }

    private HierarchyNodeView hierarchyView(UUID generationId) {
        List<HierarchyNode> rows = nodeRepository.findByGenerationIdOrderByLevelAscDisplayOrderAsc(generationId);
        if (rows.isEmpty()) {
            return null;
        }
        HierarchyTree tree = HierarchyTree.of(rows);
        return toView(tree, tree.root());
    }

    private HierarchyNodeView toView(HierarchyTree tree, HierarchyNode node) {
        HierarchyNodeView view = HierarchyNodeView.from(node);
        List<HierarchyNode> children = new ArrayList<>(tree.children(node.getId()));
        children.sort((a, b) -> Integer.compare(
                a.getDisplayOrder() != null ? a.getDisplayOrder() : 0,
                b.getDisplayOrder() != null ? b.getDisplayOrder() : 0));
        for (HierarchyNode child : children) {
            view.getChildren().add(toView(tree, child));
        }
        return view;
    }

    private List<Answer> loadAnswers(Long categoryId, List<Long> answerIds) {
        List<Answer> answers = answerIds == null || answerIds.isEmpty()
                ? answerRepository.findByCategoryIdOrderByIdAsc(categoryId)
                : answerRepository.findByCategoryIdAndIdInOrderByIdAsc(categoryId, answerIds);
        return answers.stream()
                .filter(a -> a.getAnswerText() != null && !a.getAnswerText().isBlank())
                .collect(Collectors.toList());
    }

    private void markFailed(UUID generationId, ErrorKind kind, String message, long startTime) {
        try {
            stateService.fail(generationId, kind, message, System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            log.error("Could not mark generation {} as failed: {}", generationId, e.getMessage(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize algorithm config", e);
        }
    }

    record PipelineInput(
            UUID generationId,
            Category category,
            CodingType codingType,
            List<Answer> answers,
            AlgorithmConfig config,
            SearchCredentials credentials
    ) {}
}
