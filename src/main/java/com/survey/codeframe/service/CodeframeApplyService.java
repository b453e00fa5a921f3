package com.survey.codeframe.service;

import com.survey.codeframe.dto.ApplySummary;
import com.survey.codeframe.entity.AnswerCode;
import com.survey.codeframe.entity.ApprovalStatus;
import com.survey.codeframe.entity.Code;
import com.survey.codeframe.entity.CodeframeGeneration;
import com.survey.codeframe.entity.GenerationStatus;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.entity.NodeType;
import com.survey.codeframe.exception.ApplyConflictException;
import com.survey.codeframe.exception.ResourceNotFoundException;
import com.survey.codeframe.repository.AnswerCodeRepository;
import com.survey.codeframe.repository.CodeRepository;
import com.survey.codeframe.repository.CodeframeGenerationRepository;
import com.survey.codeframe.repository.HierarchyNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns the code level of a completed generation into production codes and answer assignments.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CodeframeApplyService {

    private final CodeframeGenerationRepository generationRepository;
    private final HierarchyNodeRepository nodeRepository;
    private final CodeRepository codeRepository;
    private final AnswerCodeRepository answerCodeRepository;

    /**
     * Runs under a row lock on the generation, so of two concurrent calls the second sees
     * {@code applied} and is rejected.
     *
     * @throws ApplyConflictException when the generation is not {@code completed}
     */
    @Transactional
    public ApplySummary apply(UUID generationId, String appliedBy) {
        CodeframeGeneration generation = generationRepository.findWithLockById(generationId)
                .orElseThrow(() -> new ResourceNotFoundException("Generation not found: " + generationId));

        if (generation.getStatus() != GenerationStatus.COMPLETED) {
            throw new ApplyConflictException(String.format(
                    "Generation %s is %s; only completed generations can be applied",
                    generationId, generation.getStatus().getValue()));
        }

        List<HierarchyNode> codes = nodeRepository.findByGenerationIdAndLevel(generationId, NodeType.CODE.getLevel());
        Map<String, Code> byName = new HashMap<>();
        int created = 0;
        int linked = 0;
        int skipped = 0;
        int assignments = 0;

        for (HierarchyNode node : codes) {
            if (node.getApprovalStatus() == ApprovalStatus.REJECTED) {
                skipped++;
                continue;
            }

            String key = node.getName().trim().toLowerCase(Locale.ROOT);
            Code code = byName.get(key);
            if (code == null) {
                code = codeRepository.findFirstByCategoryIdAndNameIgnoreCase(generation.getCategoryId(), node.getName().trim())
                        .orElse(null);
                if (code == null) {
                    code = codeRepository.save(Code.builder()
                            .categoryId(generation.getCategoryId())
                            .name(node.getName().trim())
                            .build());
                    created++;
                } else {
                    linked++;
                }
                byName.put(key, code);
            } else {
                linked++;
            }

            node.setCodeId(code.getId());
            for (Long answerId : node.getMemberAnswerIds()) {
                if (!answerCodeRepository.existsByAnswerIdAndCodeId(answerId, code.getId())) {
                    answerCodeRepository.save(AnswerCode.builder()
                            .answerId(answerId)
                            .codeId(code.getId())
                            .generationId(generationId)
                            .build());
                    assignments++;
                }
            }
        }
        nodeRepository.saveAll(codes);

        generation.setStatus(GenerationStatus.APPLIED);
        generation.setAppliedAt(LocalDateTime.now());
        generation.setAppliedBy(appliedBy);
        generationRepository.save(generation);

        log.info("Applied generation {}: {} codes created, {} linked, {} skipped, {} answer assignments",
                generationId, created, linked, skipped, assignments);

        return ApplySummary.builder()
                .generationId(generationId)
                .codesCreated(created)
                .codesLinked(linked)
                .nodesSkipped(skipped)
                .answerCodesCreated(assignments)
                .appliedBy(appliedBy)
                .build();
    }
}
