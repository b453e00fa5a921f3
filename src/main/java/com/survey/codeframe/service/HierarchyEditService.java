package com.survey.codeframe.service;

import com.survey.codeframe.dto.NodeEditRequest;
import com.survey.codeframe.entity.CodeframeGeneration;
import com.survey.codeframe.entity.GenerationStatus;
import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.exception.ApplyConflictException;
import com.survey.codeframe.exception.InputException;
import com.survey.codeframe.exception.ResourceNotFoundException;
import com.survey.codeframe.hierarchy.HierarchyTree;
import com.survey.codeframe.repository.CodeframeGenerationRepository;
import com.survey.codeframe.repository.HierarchyNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Manual edits to a completed generation's hierarchy. Every edit goes through the in-memory
 * arena so level and cycle checks run before anything is written.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HierarchyEditService {

    private final CodeframeGenerationRepository generationRepository;
    private final HierarchyNodeRepository nodeRepository;
    private final EditHistoryWriter editHistory;

    @Transactional
    public HierarchyNode edit(UUID nodeId, NodeEditRequest request) {
        HierarchyNode target = findNode(nodeId);
        HierarchyTree tree = loadEditableTree(target.getGenerationId());
        HierarchyNode node = tree.get(nodeId)
                .orElseThrow(() -> new ResourceNotFoundException("Node not found: " + nodeId));

        Map<String, Object> changes = new LinkedHashMap<>();
        try {
            if (request.getName() != null) {
                String name = request.getName().trim();
                if (name.isEmpty()) {
                    throw new InputException("Node name must not be blank");
                }
                changes.put("old_name", node.getName());
                changes.put("new_name", name);
                node.setName(name);
            }
            if (request.getDescription() != null) {
                node.setDescription(request.getDescription());
                changes.put("description", true);
            }
            if (request.getParentId() != null && !request.getParentId().equals(node.getParentId())) {
                changes.put("old_parent_id", node.getParentId());
                changes.put("new_parent_id", request.getParentId());
                tree.move(nodeId, request.getParentId());
            }
            if (request.getDisplayOrder() != null) {
                if (request.getDisplayOrder() < 0) {
                    throw new InputException("display_order must not be negative");
                }
                changes.put("old_display_order", node.getDisplayOrder());
                changes.put("new_display_order", request.getDisplayOrder());
                node.setDisplayOrder(request.getDisplayOrder());
            }
        } catch (IllegalArgumentException e) {
            throw new InputException(e.getMessage(), e);
        }

        if (changes.isEmpty()) {
            return node;
        }

        node.setEdited(true);
        editHistory.append(node, "edit", request.getEditedBy(), changes);
        tree.applyDisplayOrder();
        tree.validate();
        nodeRepository.saveAll(tree.nodes());

        log.info("Node '{}' edited by {}: {}", node.getName(), request.getEditedBy(), changes.keySet());
        return node;
    }

    /**
     * Deletes the node and its subtree.
     *
     * @return ids of the removed nodes
     */
    @Transactional
    public List<UUID> delete(UUID nodeId, String deletedBy) {
        HierarchyNode target = findNode(nodeId);
        HierarchyTree tree = loadEditableTree(target.getGenerationId());

        List<HierarchyNode> removed;
        try {
            removed = tree.remove(nodeId);
        } catch (IllegalArgumentException e) {
            throw new InputException(e.getMessage(), e);
        }
        // children first so the parent_id foreign key never points at a deleted row
        List<HierarchyNode> deletionOrder = new ArrayList<>(removed);
        Collections.reverse(deletionOrder);
        nodeRepository.deleteAll(deletionOrder);

        tree.applyDisplayOrder();
        nodeRepository.saveAll(tree.nodes());

        log.info("Deleted node '{}' and {} descendants (by {})", target.getName(), removed.size() - 1, deletedBy);
        return removed.stream().map(HierarchyNode::getId).collect(Collectors.toList());
    }

    private HierarchyTree loadEditableTree(UUID generationId) {
        CodeframeGeneration generation = generationRepository.findById(generationId)
                .orElseThrow(() -> new ResourceNotFoundException("Generation not found: " + generationId));
        if (generation.getStatus() != GenerationStatus.COMPLETED) {
            throw new ApplyConflictException(String.format(
                    "Generation %s is %s; only completed generations can be edited",
                    generationId, generation.getStatus().getValue()));
        }
        return HierarchyTree.of(nodeRepository.findByGenerationIdOrderByLevelAscDisplayOrderAsc(generationId));
    }

    private HierarchyNode findNode(UUID nodeId) {
        return nodeRepository.findById(nodeId)
                .orElseThrow(() -> new ResourceNotFoundException("Node not found: " + nodeId));
    }
}
