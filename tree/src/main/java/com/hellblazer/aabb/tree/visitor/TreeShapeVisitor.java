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

import com.hellblazer.aabb.geometry.Box;
import com.hellblazer.aabb.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Gathers the shape of a tree in a single traversal: node and leaf counts per level, the worst balance of any inner
 * node, the depth and volume of the leaves and the bounds of the root.
 * <p>
 * Every traversal starts from zero. The height is the one reported by the tree when the traversal begins, so it is
 * not reduced by a depth limit.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public class TreeShapeVisitor<B extends Box<B>, U> extends AbstractTreeVisitor<B, U> {

    private final List<Integer> nodeWidths = new ArrayList<>();
    private final List<Integer> leafWidths = new ArrayList<>();
    private       int           nodes;
    private       int           leaves;
    private       int           height;
    private       int           maxAbsBalance;
    private       long          leafDepths;
    private       double        leafVolume;
    private       B             rootBounds;

    public TreeShapeVisitor() {
        setVisitLeaves(false);
    }

    private static void increment(List<Integer> widths, int level) {
        while (widths.size() <= level) {
            widths.add(0);
        }
        widths.set(level, widths.get(level) + 1);
    }

    @Override
    public void beginTraversal(int totalLeaves, int height) {
        nodeWidths.clear();
        leafWidths.clear();
        nodes = 0;
        leaves = 0;
        maxAbsBalance = 0;
        leafDepths = 0;
        leafVolume = 0;
        rootBounds = null;
        this.height = height;
    }

    /**
     * @return mean level of the visited leaves, the root being at level 0, or 0 if no leaf was visited
     */
    public double getAverageLeafDepth() {
        return leaves == 0 ? 0 : (double) leafDepths / leaves;
    }

    public int getHeight() {
        return height;
    }

    public int getInnerCount() {
        return nodes - leaves;
    }

    public int getLeafCount() {
        return leaves;
    }

    public int getLeavesAtLevel(int level) {
        return level < leafWidths.size() ? leafWidths.get(level) : 0;
    }

    /**
     * The number of levels reached by the traversal, which is the height of the tree unless a depth limit applied
     */
    public int getLevels() {
        return nodeWidths.size();
    }

    /**
     * @return the largest height difference between the two subtrees of any visited inner node
     */
    public int getMaxAbsBalance() {
        return maxAbsBalance;
    }

    public int getNodeCount() {
        return nodes;
    }

    public int getNodesAtLevel(int level) {
        return level < nodeWidths.size() ? nodeWidths.get(level) : 0;
    }

    /**
     * @return the bounds of the root, or null if the tree was empty
     */
    public B getRootBounds() {
        return rootBounds;
    }

    /**
     * @return the summed volume of the visited leaf boxes
     */
    public double getTotalLeafVolume() {
        return leafVolume;
    }

    @Override
    public String toString() {
        return "TreeShape[nodes=" + nodes + ", leaves=" + leaves + ", height=" + height + ", maxBalance="
        + maxAbsBalance + ", widths=" + nodeWidths + "]";
    }

    @Override
    public boolean visitNode(Node<B, U> node, int level) {
        nodes++;
        increment(nodeWidths, level);
        if (level == 0) {
            rootBounds = node.bounds();
        }
        if (node.isLeaf()) {
            leaves++;
            increment(leafWidths, level);
            leafDepths += level;
            leafVolume += node.bounds().volume();
        } else {
            maxAbsBalance = Math.max(maxAbsBalance, Math.abs(node.balance()));
        }
        return true;
    }
}
