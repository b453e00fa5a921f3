package com.survey.codeframe.hierarchy;

import com.survey.codeframe.entity.HierarchyNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * In-memory arena of one generation's hierarchy: nodes by id plus a child index.
 * <p>
 * Every insert and move checks that a non-root node hangs under a parent exactly one level
 * above it and that no cycle is introduced, so a tree held here always satisfies the
 * parent-level invariant.
 */
public class HierarchyTree {

    private static final Comparator<HierarchyNode> AUTO_ORDER =
            Comparator.comparing((HierarchyNode n) -> n.getClusterSize() == null ? 0 : n.getClusterSize())
                    .reversed()
                    .thenComparing(HierarchyNode::getName, String.CASE_INSENSITIVE_ORDER);

    private final Map<UUID, HierarchyNode> nodes = new LinkedHashMap<>();
    private final Map<UUID, List<UUID>> children = new LinkedHashMap<>();
    private UUID rootId;

    /**
     * Rebuilds an arena from persisted rows (any order).
     */
    public static HierarchyTree of(List<HierarchyNode> rows) {
        HierarchyTree tree = new HierarchyTree();
        rows.stream()
                .sorted(Comparator.comparing(HierarchyNode::getLevel))
                .forEach(tree::add);
        return tree;
    }

    public HierarchyNode add(HierarchyNode node) {
        if (node.getId() == null) {
            node.setId(UUID.randomUUID());
        }
        if (nodes.containsKey(node.getId())) {
            throw new IllegalArgumentException("Duplicate node id " + node.getId());
        }
        if (node.getNodeType() != null && node.getLevel() == null) {
            node.setLevel(node.getNodeType().getLevel());
        }
        if (node.getNodeType() != null && node.getNodeType().getLevel() != node.getLevel()) {
            throw new IllegalArgumentException(String.format("Node '%s' is a %s but sits on level %d",
                    node.getName(), node.getNodeType().getValue(), node.getLevel()));
        }

        if (node.getParentId() == null) {
            if (node.getLevel() != 0) {
                throw new IllegalArgumentException("Only the level-0 node may be parentless: " + node.getName());
            }
            if (rootId != null) {
                throw new IllegalArgumentException("Hierarchy already has a root");
            }
            rootId = node.getId();
        } else {
            HierarchyNode parent = requireNode(node.getParentId());
            checkParentLevel(node, parent);
        }

        nodes.put(node.getId(), node);
        children.put(node.getId(), new ArrayList<>());
        if (node.getParentId() != null) {
            children.get(node.getParentId()).add(node.getId());
        }
        return node;
    }

    /**
     * Re-parents a node (and its subtree). The node keeps its level, so the new parent must sit
     * on the same level as the old one.
     */
    public void move(UUID nodeId, UUID newParentId) {
        HierarchyNode node = requireNode(nodeId);
        if (node.isRoot()) {
            throw new IllegalArgumentException("The root node cannot be moved");
        }
        HierarchyNode newParent = requireNode(newParentId);
        if (nodeId.equals(newParentId) || isAncestor(nodeId, newParentId)) {
            throw new IllegalArgumentException("Moving '" + node.getName() + "' there would create a cycle");
        }
        checkParentLevel(node, newParent);

        children.get(node.getParentId()).remove(nodeId);
        children.get(newParentId).add(nodeId);
        node.setParentId(newParentId);
    }

    /**
     * Removes the node and everything below it.
     *
     * @return the removed nodes, parent before children
     */
    public List<HierarchyNode> remove(UUID nodeId) {
        HierarchyNode node = requireNode(nodeId);
        if (node.isRoot()) {
            throw new IllegalArgumentException("The root node cannot be deleted");
        }
        List<HierarchyNode> removed = subtree(nodeId);
        children.get(node.getParentId()).remove(nodeId);
        for (HierarchyNode r : removed) {
            nodes.remove(r.getId());
            children.remove(r.getId());
        }
        return removed;
    }

    /**
     * Assigns display_order among the children of every node. Edited nodes keep their slot;
     * auto nodes fill the free slots by descending cluster size, then name.
     */
    public void applyDisplayOrder() {
        for (UUID parentId : children.keySet()) {
            List<HierarchyNode> kids = children(parentId);
            Set<Integer> taken = new HashSet<>();
            List<HierarchyNode> auto = new ArrayList<>();
            for (HierarchyNode kid : kids) {
                if (Boolean.TRUE.equals(kid.getEdited()) && kid.getDisplayOrder() != null
                        && taken.add(kid.getDisplayOrder())) {
                    continue;
                }
                auto.add(kid);
            }
            auto.sort(AUTO_ORDER);
            int slot = 0;
            for (HierarchyNode kid : auto) {
                while (taken.contains(slot)) {
                    slot++;
                }
                kid.setDisplayOrder(slot);
                taken.add(slot);
            }
        }
    }

    /**
     * Full check of the parent-level and acyclicity invariants over every node.
     */
    public void validate() {
        for (HierarchyNode node : nodes.values()) {
            if (node.isRoot()) {
                if (node.getLevel() != 0 || !node.getId().equals(rootId)) {
                    throw new IllegalStateException("Unexpected parentless node " + node.getName());
                }
                continue;
            }
            checkParentLevel(node, requireNode(node.getParentId()));
            Set<UUID> seen = new HashSet<>();
            UUID current = node.getId();
            while (current != null) {
                if (!seen.add(current)) {
                    throw new IllegalStateException("Cycle through node " + node.getName());
                }
                current = requireNode(current).getParentId();
            }
        }
    }

    public Optional<HierarchyNode> get(UUID id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public HierarchyNode root() {
        return rootId == null ? null : nodes.get(rootId);
    }

    public List<HierarchyNode> children(UUID parentId) {
        return children.getOrDefault(parentId, List.of()).stream().map(nodes::get).collect(Collectors.toList());
    }

    public List<HierarchyNode> nodesAtLevel(int level) {
        return nodes.values().stream().filter(n -> n.getLevel() == level).collect(Collectors.toList());
    }

    /**
     * All nodes, breadth-first from the root with siblings in display order.
     */
    public List<HierarchyNode> nodes() {
        return rootId == null ? List.of() : subtree(rootId);
    }

    public int size() {
        return nodes.size();
    }

    private List<HierarchyNode> subtree(UUID start) {
        List<HierarchyNode> result = new ArrayList<>();
        Deque<UUID> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            UUID id = queue.poll();
            result.add(nodes.get(id));
            children.getOrDefault(id, List.of()).stream()
                    .map(nodes::get)
                    .sorted(Comparator.comparing((HierarchyNode n) -> n.getDisplayOrder() == null ? 0 : n.getDisplayOrder())
                            .thenComparing(HierarchyNode::getName, String.CASE_INSENSITIVE_ORDER))
                    .forEach(n -> queue.add(n.getId()));
        }
        return result;
    }

    private boolean isAncestor(UUID ancestorId, UUID nodeId) {
        UUID current = nodes.get(nodeId).getParentId();
        while (current != null) {
            if (current.equals(ancestorId)) {
                return true;
            }
            current = nodes.get(current).getParentId();
        }
        return false;
    }

    private void checkParentLevel(HierarchyNode node, HierarchyNode parent) {
        if (parent.getLevel() != node.getLevel() - 1) {
            throw new IllegalArgumentException(String.format(
                    "Node '%s' (level %d) cannot hang under '%s' (level %d)",
                    node.getName(), node.getLevel(), parent.getName(), parent.getLevel()));
        }
    }

    private HierarchyNode requireNode(UUID id) {
        HierarchyNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node " + id);
        }
        return node;
    }
}
