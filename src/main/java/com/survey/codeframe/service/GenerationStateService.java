package com.survey.codeframe.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.survey.codeframe.entity.CodeframeGeneration;
import com.survey.codeframe.entity.GenerationStatus;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.exception.ErrorKind;
import com.survey.codeframe.exception.GenerationConflictException;
import com.survey.codeframe.exception.ResourceNotFoundException;
import com.survey.codeframe.hierarchy.HierarchyTree;
import com.survey.codeframe.repository.CodeframeGenerationRepository;
import com.survey.codeframe.repository.HierarchyNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Owns every write to a generation row. Each method is its own short transaction so the
 * status endpoint always reads a consistent snapshot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GenerationStateService {

    private final CodeframeGenerationRepository generationRepository;
    private final HierarchyNodeRepository nodeRepository;
    private final UsageLedgerService usageLedger;
    private final ObjectMapper objectMapper;

    /**
     * Inserts a new generation in {@code processing}. The partial unique index on
     * (category_id) WHERE status = 'PROCESSING' backs the existence check across instances.
     */
    @Transactional
    public CodeframeGeneration createProcessing(CodeframeGeneration generation) {
        if (generationRepository.existsByCategoryIdAndStatus(generation.getCategoryId(), GenerationStatus.PROCESSING)) {
            throw new GenerationConflictException(
                    "A generation is already processing for category " + generation.getCategoryId());
        }
        generation.setStatus(GenerationStatus.PROCESSING);
        generation.setProgressPercent(0);
        generation.setCurrentStep("queued");
        try {
            return generationRepository.saveAndFlush(generation);
        } catch (DataIntegrityViolationException e) {
            throw new GenerationConflictException(
                    "A generation is already processing for category " + generation.getCategoryId(), e);
        }
    }

    /**
     * Moves the progress forward. Lower percentages are ignored so progress never goes back.
     */
    @Transactional
    public void advance(UUID generationId, String step, int percent) {
        CodeframeGeneration generation = find(generationId);
        if (generation.getStatus() != GenerationStatus.PROCESSING) {
            log.warn("Ignoring progress update for generation {} in status {}", generationId, generation.getStatus());
            return;
        }
        int current = generation.getProgressPercent() != null ? generation.getProgressPercent() : 0;
        if (percent < current) {
            return;
        }
        generation.setProgressPercent(Math.min(100, percent));
        generation.setCurrentStep(step);
        generationRepository.save(generation);
        log.debug("Generation {}: {} {}%", generationId, step, percent);
    }

    /**
     * Writes the staged hierarchy and the completed status in one transaction.
     */
    @Transactional
    public CodeframeGeneration publish(UUID generationId, HierarchyTree tree, GenerationResult result) {
        CodeframeGeneration generation = find(generationId);
        requireTransition(generation, GenerationStatus.COMPLETED);

        List<HierarchyNode> nodes = tree.nodes();
        nodeRepository.saveAll(nodes);

        generation.setClusterCount(result.clusterCount());
        generation.setThemeCount(result.themeCount());
        generation.setCodeCount(result.codeCount());
        generation.setNoiseCount(result.noiseCount());
        generation.setMeceScore(result.meceScore());
        generation.setMeceWarnings(toJson(result.meceWarnings()));
        generation.setProcessingTimeMs(result.processingTimeMs());

        UsageLedgerService.UsageTotals totals = usageLedger.totalsForGeneration(generationId);
        generation.setAiModel(totals.primaryModel());
        generation.setAiInputTokens(totals.inputTokens());
        generation.setAiOutputTokens(totals.outputTokens());
        generation.setAiCostUsd(totals.costUsd());

        generation.setStatus(GenerationStatus.COMPLETED);
        generation.setProgressPercent(100);
        generation.setCurrentStep("completed");
        generation = generationRepository.save(generation);

        log.info("Generation {} completed: {} nodes, {} codes, MECE {}, cost ${}",
                generationId, nodes.size(), result.codeCount(), result.meceScore(), totals.costUsd());
        return generation;
    }

    @Transactional
    public void fail(UUID generationId, ErrorKind kind, String message, long processingTimeMs) {
        CodeframeGeneration generation = find(generationId);
        if (!generation.getStatus().canTransitionTo(GenerationStatus.FAILED)) {
            log.warn("Generation {} is {}, not marking it failed", generationId, generation.getStatus());
            return;
        }
        generation.setStatus(GenerationStatus.FAILED);
        generation.setErrorKind(kind);
        generation.setErrorMessage(message);
        generation.setProcessingTimeMs(processingTimeMs);
        generationRepository.save(generation);
    }

    @Transactional(readOnly = true)
    public CodeframeGeneration find(UUID generationId) {
        return generationRepository.findById(generationId)
                .orElseThrow(() -> new ResourceNotFoundException("Generation not found: " + generationId));
    }

    private void requireTransition(CodeframeGeneration generation, GenerationStatus next) {
        if (!generation.getStatus().canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Generation %s cannot go from %s to %s",
                    generation.getId(), generation.getStatus().getValue(), next.getValue()));
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize generation result", e);
        }
    }

    public record GenerationResult(
            int clusterCount,
            int themeCount,
            int codeCount,
            int noiseCount,
            double meceScore,
            List<MeceValidatorService.MeceWarning> meceWarnings,
            long processingTimeMs
    ) {}
}
