package com.survey.codeframe.service;

import com.survey.codeframe.entity.ApprovalStatus;
import com.survey.codeframe.entity.CodeframeGeneration;
import com.survey.codeframe.entity.GenerationStatus;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.exception.ApplyConflictException;
import com.survey.codeframe.exception.InputException;
import com.survey.codeframe.exception.ResourceNotFoundException;
import com.survey.codeframe.repository.CodeframeGenerationRepository;
import com.survey.codeframe.repository.HierarchyNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reviewer decisions on validated brand nodes. Decisions are taken while the generation is
 * completed; once it is applied its codes exist in production and review is closed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BrandReviewService {

    private final CodeframeGenerationRepository generationRepository;
    private final HierarchyNodeRepository nodeRepository;
    private final EditHistoryWriter editHistory;

    /**
     * Approve a pending brand node
     */
    @Transactional
    public HierarchyNode approve(UUID nodeId, String reviewedBy, String notes) {
        return decide(nodeId, ApprovalStatus.APPROVED, reviewedBy, notes);
    }

    /**
     * Reject a pending brand node; rejected nodes are skipped when the generation is applied
     */
    @Transactional
    public HierarchyNode reject(UUID nodeId, String reviewedBy, String notes) {
        return decide(nodeId, ApprovalStatus.REJECTED, reviewedBy, notes);
    }

    public List<HierarchyNode> getPending(UUID generationId) {
        return nodeRepository.findByGenerationIdAndApprovalStatus(generationId, ApprovalStatus.PENDING);
    }

    private HierarchyNode decide(UUID nodeId, ApprovalStatus decision, String reviewedBy, String notes) {
        HierarchyNode node = nodeRepository.findById(nodeId)
                .orElseThrow(() -> new ResourceNotFoundException("Node not found: " + nodeId));

        UUID generationId = node.getGenerationId();
        CodeframeGeneration generation = generationRepository.findById(generationId)
                .orElseThrow(() -> new ResourceNotFoundException("Generation not found: " + generationId));
        if (generation.getStatus() != GenerationStatus.COMPLETED) {
            throw new ApplyConflictException(String.format(
                    "Generation %s is %s; brand review is only open on completed generations",
                    generation.getId(), generation.getStatus().getValue()));
        }

        if (node.getApprovalStatus() != ApprovalStatus.PENDING) {
            throw new InputException(String.format("Node '%s' is not pending review (status: %s)",
                    node.getName(), node.getApprovalStatus() == null ? "none" : node.getApprovalStatus().getValue()));
        }

        node.setApprovalStatus(decision);
        node.setApprovedBy(reviewedBy);
        node.setApprovedAt(LocalDateTime.now());

        Map<String, Object> details = new HashMap<>();
        details.put("brand_confidence", node.getBrandConfidence());
        if (notes != null && !notes.isBlank()) {
            details.put("notes", notes);
        }
        editHistory.append(node, decision.getValue(), reviewedBy, details);

        node = nodeRepository.save(node);
        log.info("Brand '{}' {} by {}", node.getName(), decision.getValue(), reviewedBy);
        return node;
    }
}
