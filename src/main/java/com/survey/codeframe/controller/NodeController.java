package com.survey.codeframe.controller;

import com.survey.codeframe.dto.HierarchyNodeView;
import com.survey.codeframe.dto.NodeEditRequest;
import com.survey.codeframe.dto.ReviewRequest;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.exception.CodeframeException;
import com.survey.codeframe.exception.ResourceNotFoundException;
import com.survey.codeframe.service.BrandReviewService;
import com.survey.codeframe.service.HierarchyEditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Review and editing of individual hierarchy nodes
 */
@RestController
@RequestMapping("/api/codeframe")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Nodes", description = "Brand review and hierarchy editing")
public class NodeController {

    private final BrandReviewService reviewService;
    private final HierarchyEditService editService;

    @Operation(summary = "Pending brand nodes", description = "Brand nodes of a generation awaiting review")
    @GetMapping("/generations/{generationId}/nodes/pending")
    public List<HierarchyNodeView> pending(@PathVariable UUID generationId) {
        return reviewService.getPending(generationId).stream()
                .map(HierarchyNodeView::from)
                .collect(Collectors.toList());
    }

    @Operation(summary = "Approve brand node", description = "Approve a pending brand node")
    @PostMapping("/nodes/{id}/approve")
    public ResponseEntity<Object> approve(
            @Parameter(description = "Node ID") @PathVariable UUID id,
            @RequestBody(required = false) ReviewRequest request) {
        return review(id, request, true);
    }

    @Operation(summary = "Reject brand node", description = "Reject a pending brand node; it will be skipped on apply")
    @PostMapping("/nodes/{id}/reject")
    public ResponseEntity<Object> reject(
            @Parameter(description = "Node ID") @PathVariable UUID id,
            @RequestBody(required = false) ReviewRequest request) {
        return review(id, request, false);
    }

    @Operation(summary = "Edit node", description = "Rename, describe, move or reorder a node of a completed generation")
    @PatchMapping("/nodes/{id}")
    public ResponseEntity<Object> edit(
            @Parameter(description = "Node ID") @PathVariable UUID id,
            @RequestBody NodeEditRequest request) {
        try {
            HierarchyNode node = editService.edit(id, request);
            return ResponseEntity.ok(HierarchyNodeView.from(node));
        } catch (ResourceNotFoundException e) {
            return ErrorBodies.notFound(e.getMessage());
        } catch (CodeframeException e) {
            log.warn("Edit of node {} rejected: {}", id, e.getMessage());
            return ErrorBodies.of(e);
        }
    }

    @Operation(summary = "Delete node", description = "Delete a node and everything below it")
    @DeleteMapping("/nodes/{id}")
    public ResponseEntity<Object> delete(
            @Parameter(description = "Node ID") @PathVariable UUID id,
            @RequestParam(value = "deleted_by", required = false) String deletedBy) {
        try {
            List<UUID> removed = editService.delete(id, deletedBy);
            return ResponseEntity.ok(Map.of("removed", removed));
        } catch (ResourceNotFoundException e) {
            return ErrorBodies.notFound(e.getMessage());
        } catch (CodeframeException e) {
            log.warn("Delete of node {} rejected: {}", id, e.getMessage());
            return ErrorBodies.of(e);
        }
    }

    private ResponseEntity<Object> review(UUID id, ReviewRequest request, boolean approve) {
        String reviewedBy = request != null ? request.getReviewedBy() : null;
        String notes = request != null ? request.getNotes() : null;
        try {
            HierarchyNode node = approve
                    ? reviewService.approve(id, reviewedBy, notes)
                    : reviewService.reject(id, reviewedBy, notes);
            return ResponseEntity.ok(HierarchyNodeView.from(node));
        } catch (ResourceNotFoundException e) {
            return ErrorBodies.notFound(e.getMessage());
        } catch (CodeframeException e) {
            return ErrorBodies.of(e);
        }
    }
}
