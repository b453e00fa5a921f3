package com.survey.codeframe.hierarchy;

import com.survey.codeframe.entity.HierarchyNode;
import com.survey.codeframe.entity.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyTreeTest {

    private HierarchyTree tree;
    private HierarchyNode root;
    private HierarchyNode themeA;
    private HierarchyNode themeB;
    private HierarchyNode code1;
    private HierarchyNode code2;
    private HierarchyNode subcode;

    @BeforeEach
    void setUp() {
        tree = new HierarchyTree();
        root = tree.add(node(NodeType.CATEGORY, "Favourite toothpaste", null, 100));
        themeA = tree.add(node(NodeType.THEME, "Whitening", root.getId(), 60));
        themeB = tree.add(node(NodeType.THEME, "Sensitivity", root.getId(), 40));
        code1 = tree.add(node(NodeType.CODE, "Whiter teeth", themeA.getId(), 35));
        code2 = tree.add(node(NodeType.CODE, "Stain removal", themeA.getId(), 25));
        subcode = tree.add(node(NodeType.SUBCODE, "Coffee stains", code2.getId(), 10));
    }

    private HierarchyNode node(NodeType type, String name, UUID parentId, int size) {
        return HierarchyNode.builder()
                .id(UUID.randomUUID())
                .generationId(UUID.randomUUID())
                .parentId(parentId)
                .level(type.getLevel())
                .nodeType(type)
                .name(name)
                .clusterSize(size)
                .build();
    }

    @Test
    void testRejectsNodeOnWrongLevel() {
        HierarchyNode codeUnderRoot = node(NodeType.CODE, "Mint flavour", root.getId(), 5);

        assertThrows(IllegalArgumentException.class, () -> tree.add(codeUnderRoot));
    }

    @Test
    void testRejectsSecondRoot() {
        assertThrows(IllegalArgumentException.class,
                () -> tree.add(node(NodeType.CATEGORY, "Another", null, 1)));
    }

    @Test
    void testRejectsUnknownParent() {
        assertThrows(IllegalArgumentException.class,
                () -> tree.add(node(NodeType.THEME, "Orphan", UUID.randomUUID(), 1)));
    }

    @Test
    void testMoveCodeToOtherTheme() {
        tree.move(code1.getId(), themeB.getId());

        assertEquals(themeB.getId(), code1.getParentId());
        assertTrue(tree.children(themeB.getId()).contains(code1));
        assertFalse(tree.children(themeA.getId()).contains(code1));
        tree.validate();
    }

    @Test
    void testMoveKeepsSubtree() {
        tree.move(code2.getId(), themeB.getId());

        assertEquals(List.of(subcode), tree.children(code2.getId()));
        tree.validate();
    }

    @Test
    void testMoveRejectsLevelViolation() {
        assertThrows(IllegalArgumentException.class, () -> tree.move(themeA.getId(), code1.getId()));
        assertThrows(IllegalArgumentException.class, () -> tree.move(code1.getId(), root.getId()));
        assertEquals(themeA.getId(), code1.getParentId());
    }

    @Test
    void testMoveRejectsCycle() {
        assertThrows(IllegalArgumentException.class, () -> tree.move(code2.getId(), subcode.getId()));
        assertThrows(IllegalArgumentException.class, () -> tree.move(code2.getId(), code2.getId()));
    }

    @Test
    void testRootCannotBeMovedOrRemoved() {
        assertThrows(IllegalArgumentException.class, () -> tree.move(root.getId(), themeA.getId()));
        assertThrows(IllegalArgumentException.class, () -> tree.remove(root.getId()));
    }

    @Test
    void testRemoveDeletesSubtree() {
        List<HierarchyNode> removed = tree.remove(themeA.getId());

        assertEquals(4, removed.size());
        assertEquals(themeA, removed.get(0));
        assertTrue(tree.get(subcode.getId()).isEmpty());
        assertEquals(2, tree.size());
        tree.validate();
    }

    @Test
    void testDisplayOrderBySizeThenName() {
        tree.applyDisplayOrder();

        assertEquals(0, themeA.getDisplayOrder());
        assertEquals(1, themeB.getDisplayOrder());
        assertEquals(0, code1.getDisplayOrder());
        assertEquals(1, code2.getDisplayOrder());
    }

    @Test
    void testEditedNodeKeepsItsSlot() {
        themeB.setEdited(true);
        themeB.setDisplayOrder(0);

        tree.applyDisplayOrder();

        assertEquals(0, themeB.getDisplayOrder());
        assertEquals(1, themeA.getDisplayOrder());
    }

    @Test
    void testNodesAreBreadthFirst() {
        tree.applyDisplayOrder();

        List<HierarchyNode> nodes = tree.nodes();

        assertEquals(6, nodes.size());
        assertEquals(root, nodes.get(0));
        assertEquals(List.of(themeA, themeB), nodes.subList(1, 3));
        assertEquals(subcode, nodes.get(5));
    }

    @Test
    void testRebuildFromRowsInAnyOrder() {
        List<HierarchyNode> rows = List.of(subcode, code1, themeB, root, code2, themeA);

        HierarchyTree rebuilt = HierarchyTree.of(rows);

        assertEquals(root, rebuilt.root());
        assertEquals(2, rebuilt.nodesAtLevel(2).size());
        rebuilt.validate();
    }
}
