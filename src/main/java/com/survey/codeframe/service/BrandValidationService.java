package com.survey.codeframe.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.brand.BrandConfidenceFusion;
import com.survey.codeframe.brand.BrandConfidenceFusion.BrandAssessment;
import com.survey.codeframe.brand.BrandProbe;
import com.survey.codeframe.brand.EvidenceTier;
import com.survey.codeframe.brand.KnowledgeGraphAssessor;
import com.survey.codeframe.brand.KnowledgeGraphClient;
import com.survey.codeframe.brand.KnowledgeGraphEntity;
import com.survey.codeframe.brand.KnowledgeGraphEvidence;
import com.survey.codeframe.brand.SearchCredentials;
import com.survey.codeframe.brand.TierEvidence;
import com.survey.codeframe.brand.TierResult;
import com.survey.codeframe.brand.TranslationClient;
import com.survey.codeframe.brand.VisionClient;
import com.survey.codeframe.brand.WebSearchClient;
import com.survey.codeframe.brand.WebSearchEvidence;
import com.survey.codeframe.brand.WebSearchHit;
import com.survey.codeframe.config.BrandValidationProperties;
import com.survey.codeframe.entity.ApprovalStatus;
import com.survey.codeframe.entity.Category;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.exception.EvidenceTierException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Multi-source brand validation. For every code node the evidence tiers run in parallel,
 * each behind a retry and a timeout; a tier that still fails is recorded as insufficient
 * data and the node is scored from whatever came back.
 */
@Service
@Slf4j
public class BrandValidationService {

    private final WebSearchClient webSearchClient;
    private final KnowledgeGraphClient knowledgeGraphClient;
    private final VisionClient visionClient;
    private final TranslationClient translationClient;
    private final KnowledgeGraphAssessor knowledgeGraphAssessor;
    private final BrandConfidenceFusion fusion;
    private final BrandValidationProperties properties;
    private final RateLimiterService rateLimiter;
    private final RetryRegistry retryRegistry;
    private final TimeLimiter timeLimiter;
    private final ScheduledExecutorService scheduler;
    private final Executor evidenceExecutor;
    private final ObjectMapper objectMapper;

    public BrandValidationService(WebSearchClient webSearchClient,
                                  KnowledgeGraphClient knowledgeGraphClient,
                                  VisionClient visionClient,
                                  TranslationClient translationClient,
                                  KnowledgeGraphAssessor knowledgeGraphAssessor,
                                  BrandConfidenceFusion fusion,
                                  BrandValidationProperties properties,
                                  RateLimiterService rateLimiter,
                                  RetryRegistry tierRetryRegistry,
                                  TimeLimiter tierTimeLimiter,
                                  ScheduledExecutorService tierTimeoutScheduler,
                                  @Qualifier("evidenceExecutor") Executor evidenceExecutor,
                                  ObjectMapper objectMapper) {
        this.webSearchClient = webSearchClient;
        this.knowledgeGraphClient = knowledgeGraphClient;
        this.visionClient = visionClient;
        this.translationClient = translationClient;
        this.knowledgeGraphAssessor = knowledgeGraphAssessor;
        this.fusion = fusion;
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.retryRegistry = tierRetryRegistry;
        this.timeLimiter = tierTimeLimiter;
        this.scheduler = tierTimeoutScheduler;
        this.evidenceExecutor = evidenceExecutor;
        this.objectMapper = objectMapper;
    }

    /**
     * Validates every code node in place. Nodes are validated one after another; tiers
     * within a node run concurrently.
     */
    public void validateAll(List<HierarchyNode> codeNodes, Category category,
                            SearchCredentials credentials, UsageContext context) {
        log.info("Brand validation of {} candidates for category '{}'", codeNodes.size(), category.getName());
        for (HierarchyNode node : codeNodes) {
            validate(node, category, credentials, context);
        }
    }

    public BrandAssessment validate(HierarchyNode node, Category category,
                                    SearchCredentials credentials, UsageContext context) {
        BrandProbe probe = new BrandProbe(
                node.getName(),
                node.getVariants() != null ? node.getVariants() : List.of(),
                category.getName(),
                category.getLanguage(),
                category.getVisionModel(),
                credentials,
                context);

        Map<EvidenceTier, TierResult> results = collectEvidence(probe);
        BrandAssessment assessment = fusion.fuse(node.getName(), results);

        node.setValidationEvidence(toJson(evidenceJson(results)));
        node.setValidationIssues(toJson(assessment.issues()));
        node.setBrandConfidence(assessment.confidence());
        node.setSuggestedCodes(new ArrayList<>(assessment.suggestedCodes()));
        node.setValidationReasoning(assessment.reasoning());
        node.setRecommendation(assessment.recommendation());
        node.setApprovalStatus(ApprovalStatus.PENDING);

        log.info("Brand '{}': confidence {}%, recommendation {}",
                node.getName(), assessment.confidence(), assessment.recommendation());
        return assessment;
    }

    Map<EvidenceTier, TierResult> collectEvidence(BrandProbe probe) {
        Map<EvidenceTier, CompletableFuture<TierResult>> futures = new EnumMap<>(EvidenceTier.class);
        for (EvidenceTier tier : EvidenceTier.values()) {
            String skipReason = skipReason(tier, probe);
            futures.put(tier, skipReason != null
                    ? CompletableFuture.completedFuture(TierResult.skipped(tier, skipReason))
                    : runTier(tier, probe));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        Map<EvidenceTier, TierResult> results = new EnumMap<>(EvidenceTier.class);
        futures.forEach((tier, future) -> results.put(tier, future.join()));
        return results;
    }

    private String skipReason(EvidenceTier tier, BrandProbe probe) {
        if (!properties.isEnabled(tier)) {
            return "tier disabled";
        }
        if (tier == EvidenceTier.TRANSLATION) {
            String language = probe.language();
            if (language == null || language.isBlank() || language.toLowerCase(Locale.ROOT).startsWith("en")) {
                return "answers are in English";
            }
        }
        return null;
    }

    // never completes exceptionally: failures become INSUFFICIENT_DATA
    private CompletableFuture<TierResult> runTier(EvidenceTier tier, BrandProbe probe) {
        long start = System.currentTimeMillis();
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = retryRegistry.retry("brand-" + tier.getValue());

        Supplier<CompletableFuture<TierEvidence>> call = () -> CompletableFuture.supplyAsync(() -> {
            attempts.incrementAndGet();
            return gather(tier, probe);
        }, evidenceExecutor);
        Supplier<CompletionStage<TierEvidence>> limited =
                () -> timeLimiter.executeCompletionStage(scheduler, call);

        return Retry.decorateCompletionStage(retry, scheduler, limited).get()
                .toCompletableFuture()
                .handle((evidence, error) -> {
                    long elapsed = System.currentTimeMillis() - start;
                    if (error == null && evidence != null) {
                        return TierResult.ok(evidence, elapsed, attempts.get());
                    }
                    String message = describe(error);
                    log.warn("Tier {} gave no evidence for '{}' after {} attempt(s): {}",
                            tier.getValue(), probe.candidate(), attempts.get(), message);
                    return TierResult.insufficientData(tier, message, elapsed, attempts.get());
                });
    }

    private TierEvidence gather(EvidenceTier tier, BrandProbe probe) {
        if (!rateLimiter.allowRequest(tier.getProvider())) {
            throw new EvidenceTierException(tier, "Rate limit reached for " + tier.getProvider());
        }
        return switch (tier) {
            case WEB_SEARCH -> webEvidence(probe);
            case KNOWLEDGE_GRAPH -> knowledgeGraphEvidence(probe);
            case VISION -> visionEvidence(probe);
            case TRANSLATION -> translationClient.translate(probe.candidate(), probe.language(), "en", probe);
        };
    }

    /**
     * The image lookup runs on the search engine's quota, so it takes a search slot as well.
     */
    private TierEvidence visionEvidence(BrandProbe probe) {
        String searchProvider = EvidenceTier.WEB_SEARCH.getProvider();
        if (!rateLimiter.allowRequest(searchProvider)) {
            throw new EvidenceTierException(EvidenceTier.VISION, "Rate limit reached for " + searchProvider);
        }
        return visionClient.analyze(
                webSearchClient.searchImages(probe.candidate() + " " + probe.categoryName(), 5, probe), probe);
    }

    private WebSearchEvidence webEvidence(BrandProbe probe) {
        String query = "\"" + probe.candidate() + "\" " + probe.categoryName();
        List<WebSearchHit> hits = webSearchClient.search(query, properties.getWebResultCount(), probe);
        List<String> names = candidateNames(probe);

        int matching = 0;
        for (WebSearchHit hit : hits) {
            String text = normalize(hit.title() + " " + hit.snippet());
            if (names.stream().anyMatch(text::contains)) {
                matching++;
            }
        }
        return new WebSearchEvidence(query, hits.size(), matching, hits);
    }

    private KnowledgeGraphEvidence knowledgeGraphEvidence(BrandProbe probe) {
        List<KnowledgeGraphEntity> entities =
                knowledgeGraphClient.lookup(probe.candidate(), properties.getKgResultCount(), probe);
        return new KnowledgeGraphEvidence(probe.candidate(), entities,
                knowledgeGraphAssessor.assess(probe.candidate(), probe.variants(), probe.categoryName(), entities));
    }

    private static List<String> candidateNames(BrandProbe probe) {
        List<String> names = new ArrayList<>();
        names.add(normalize(probe.candidate()));
        probe.variants().stream().map(BrandValidationService::normalize).forEach(names::add);
        return names.stream().filter(n -> !n.isBlank()).distinct().collect(Collectors.toList());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "no evidence returned";
        }
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private Map<String, TierResult> evidenceJson(Map<EvidenceTier, TierResult> results) {
        Map<String, TierResult> byName = new LinkedHashMap<>();
        results.forEach((tier, result) -> byName.put(tier.getValue(), result));
        return byName;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize brand validation output", e);
        }
    }
}
