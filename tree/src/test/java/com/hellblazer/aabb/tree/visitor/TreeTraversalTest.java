/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the AABB Tree.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.aabb.tree.visitor;

import com.hellblazer.aabb.geometry.BoxNd;
import com.hellblazer.aabb.tree.AABBTree;
import com.hellblazer.aabb.tree.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for tree traversal with visitor pattern.
 *
 * @author hal.hildebrand
 */
public class TreeTraversalTest {

    private AABBTree<BoxNd, Integer> tree;

    @BeforeEach
    public void setUp() {
        tree = AABBTree.boxNd(1);
        // a perfectly balanced tree: ((0, 1), (2, 3))
        for (int i = 0; i < 4; i++) {
            tree.insert(BoxNd.interval(2 * i, 2 * i + 1), i);
        }
    }

    @Test
    public void testBreadthFirstLevels() {
        var levels = new ArrayList<Integer>();
        var leaves = new ArrayList<Integer>();
        tree.traverse(new AbstractTreeVisitor<>() {
            @Override
            public boolean visitNode(Node<BoxNd, Integer> node, int level) {
                levels.add(level);
                return true;
            }

            @Override
            public void visitLeaf(Integer data, BoxNd bounds, int level) {
                leaves.add(data);
            }
        }, TraversalStrategy.BREADTH_FIRST);

        assertEquals(List.of(0, 1, 1, 2, 2, 2, 2), levels);
        assertEquals(List.of(0, 1, 2, 3), leaves);
    }

    @Test
    public void testBeginAndEnd() {
        var counts = new int[4];
        tree.traverse(new AbstractTreeVisitor<>() {
            @Override
            public void beginTraversal(int totalLeaves, int height) {
                counts[0] = totalLeaves;
                counts[1] = height;
            }

            @Override
            public void endTraversal(int nodesVisited, int leavesVisited) {
                counts[2] = nodesVisited;
                counts[3] = leavesVisited;
            }
        }, TraversalStrategy.DEPTH_FIRST);

        assertArrayEquals(new int[] { 4, 3, 7, 4 }, counts);
    }

    @Test
    public void testDepthFirstOrder() {
        var visitor = new LeafCollectorVisitor<BoxNd, Integer>();
        tree.traverse(visitor, TraversalStrategy.DEPTH_FIRST);

        assertEquals(List.of(0, 1, 2, 3), visitor.getContents());
        assertEquals(BoxNd.interval(4, 5), visitor.getBounds().get(2));
        assertTrue(visitor.getCollected().stream().allMatch(match -> match.level() == 2));
    }

    @Test
    public void testEmptyTree() {
        AABBTree<BoxNd, Integer> empty = AABBTree.boxNd(1);
        var visitor = new TreeShapeVisitor<BoxNd, Integer>();
        empty.traverse(visitor, TraversalStrategy.DEPTH_FIRST);
        assertEquals(0, visitor.getNodeCount());
        assertEquals(0, visitor.getHeight());
        assertNull(visitor.getRootBounds());
        assertEquals(0.0, visitor.getAverageLeafDepth());
    }

    @Test
    public void testLeafCollectorFilterAndLimit() {
        var evens = new LeafCollectorVisitor<BoxNd, Integer>(data -> data % 2 == 0);
        tree.traverse(evens, TraversalStrategy.DEPTH_FIRST);
        assertEquals(List.of(0, 2), evens.getContents());
        assertFalse(evens.isLimitReached());

        var first = new LeafCollectorVisitor<BoxNd, Integer>(data -> true, 1);
        tree.traverse(first, TraversalStrategy.BREADTH_FIRST);
        assertEquals(1, first.getContents().size());
        assertTrue(first.isLimitReached());

        first.reset();
        assertTrue(first.getContents().isEmpty());
    }

    @Test
    public void testLeaveNodeChildCount() {
        var childCounts = new ArrayList<Integer>();
        tree.traverse(new AbstractTreeVisitor<>() {
            @Override
            public void leaveNode(Node<BoxNd, Integer> node, int level, int childCount) {
                if (level == 0) {
                    childCounts.add(childCount);
                }
            }
        }, TraversalStrategy.DEPTH_FIRST);
        assertEquals(List.of(2), childCounts);
    }

    @Test
    public void testMaxDepthLimit() {
        var visitor = new TreeShapeVisitor<BoxNd, Integer>();
        visitor.setMaxDepth(1);
        tree.traverse(visitor, TraversalStrategy.DEPTH_FIRST);

        assertEquals(3, visitor.getNodeCount());
        assertEquals(0, visitor.getLeafCount());
        assertEquals(2, visitor.getLevels());
        assertEquals(3, visitor.getHeight());
    }

    @Test
    public void testTreeShapeVisitor() {
        var visitor = new TreeShapeVisitor<BoxNd, Integer>();
        tree.traverse(visitor, TraversalStrategy.DEPTH_FIRST);

        assertEquals(7, visitor.getNodeCount());
        assertEquals(4, visitor.getLeafCount());
        assertEquals(3, visitor.getInnerCount());
        assertEquals(3, visitor.getHeight());
        assertEquals(3, visitor.getLevels());
        assertEquals(1, visitor.getNodesAtLevel(0));
        assertEquals(2, visitor.getNodesAtLevel(1));
        assertEquals(4, visitor.getLeavesAtLevel(2));
        assertEquals(0, visitor.getLeavesAtLevel(1));
        assertEquals(0, visitor.getMaxAbsBalance());
        assertEquals(2.0, visitor.getAverageLeafDepth(), 1e-9);
        assertEquals(4.0, visitor.getTotalLeafVolume(), 1e-9);
        assertEquals(BoxNd.interval(0, 7), visitor.getRootBounds());

        // a second traversal starts over rather than accumulating
        tree.insert(BoxNd.interval(8, 9), 4);
        tree.traverse(visitor, TraversalStrategy.BREADTH_FIRST);
        assertEquals(9, visitor.getNodeCount());
        assertEquals(5, visitor.getLeafCount());
        assertEquals(1, visitor.getMaxAbsBalance());
        assertEquals(BoxNd.interval(0, 9), visitor.getRootBounds());
    }

    @Test
    public void testPostOrder() {
        var visited = new ArrayList<Node<BoxNd, Integer>>();
        tree.traverse(new AbstractTreeVisitor<>() {
            @Override
            public boolean visitNode(Node<BoxNd, Integer> node, int level) {
                visited.add(node);
                return true;
            }
        }, TraversalStrategy.POST_ORDER);

        assertEquals(7, visited.size());
        assertTrue(visited.get(0).isLeaf());
        assertSame(tree.getRoot(), visited.get(6));
        assertEquals(BoxNd.interval(0, 3), visited.get(2).bounds());
    }

    @Test
    public void testSkipChildren() {
        var visitor = new TreeShapeVisitor<BoxNd, Integer>() {
            @Override
            public boolean visitNode(Node<BoxNd, Integer> node, int level) {
                super.visitNode(node, level);
                return false;
            }
        };
        tree.traverse(visitor, TraversalStrategy.DEPTH_FIRST);
        assertEquals(1, visitor.getNodeCount());
    }
}
