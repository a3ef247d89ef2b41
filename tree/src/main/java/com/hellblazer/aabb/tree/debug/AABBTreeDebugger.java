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
package com.hellblazer.aabb.tree.debug;

import com.hellblazer.aabb.geometry.Box;
import com.hellblazer.aabb.tree.AABBIndex;
import com.hellblazer.aabb.tree.Leaf;
import com.hellblazer.aabb.tree.Node;
import com.hellblazer.aabb.tree.visitor.AbstractTreeVisitor;
import com.hellblazer.aabb.tree.visitor.TraversalStrategy;
import com.hellblazer.aabb.tree.visitor.TreeShapeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Debug utilities for AABB trees: the plain dump, an annotated ASCII rendering and shape analysis.
 * <p>
 * Each operation reads the tree in exactly one call of the index, so over a {@link com.hellblazer.aabb.tree.LockingAABBTree}
 * every result reflects a single state of the tree even while other threads mutate it.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public class AABBTreeDebugger<B extends Box<B>, U> {
    private static final Logger log = LoggerFactory.getLogger(AABBTreeDebugger.class);

    private final AABBIndex<B, U> index;

    public AABBTreeDebugger(AABBIndex<B, U> index) {
        this.index = Objects.requireNonNull(index);
    }

    /**
     * Compute the shape statistics of the tree
     */
    public TreeAnalysis analyze() {
        var shape = new TreeShapeVisitor<B, U>();
        index.traverse(shape, TraversalStrategy.DEPTH_FIRST);

        var rootBounds = shape.getRootBounds();
        return new TreeAnalysis(shape.getNodeCount(), shape.getLeafCount(), shape.getInnerCount(), shape.getHeight(),
                                shape.getMaxAbsBalance(), shape.getAverageLeafDepth(), shape.getTotalLeafVolume(),
                                rootBounds == null ? 0 : rootBounds.volume());
    }

    /**
     * The depth first dump of the tree, one line per node
     */
    public String dump() {
        var builder = new StringBuilder();
        index.print(builder);
        return builder.toString();
    }

    /**
     * Log the shape statistics at debug level
     */
    public void logStatistics() {
        if (log.isDebugEnabled()) {
            log.debug("{}", analyze());
        }
    }

    /**
     * Generate ASCII art representation of the tree structure. Inner nodes at the depth limit whose children are cut
     * off are marked with an ellipsis.
     *
     * @param maxDepth Maximum depth to display, -1 for all
     * @return ASCII art string representation
     */
    public String toAsciiArt(int maxDepth) {
        var builder = new StringBuilder();
        builder.append("AABB Tree Structure\n");
        builder.append("===================\n");

        var renderer = new AbstractTreeVisitor<B, U>() {
            @Override
            public void beginTraversal(int totalLeaves, int height) {
                if (totalLeaves == 0) {
                    builder.append("(empty)\n");
                } else {
                    // a full binary tree
                    builder.append(String.format("Leaves: %d, Height: %d, Nodes: %d\n\n", totalLeaves, height,
                                                 2 * totalLeaves - 1));
                }
            }

            @Override
            public boolean visitNode(Node<B, U> node, int level) {
                builder.append("  ".repeat(level)).append("├─ ");
                if (node instanceof Leaf<B, U> leaf) {
                    builder.append("L ").append(leaf.bounds()).append(": ").append(leaf.data());
                } else {
                    builder.append("O ")
                           .append(node.bounds())
                           .append(String.format(" [height=%d, balance=%d]", node.height(), node.balance()));
                    if (level == maxDepth) {
                        builder.append(" ...");
                    }
                }
                builder.append("\n");
                return true;
            }
        };
        renderer.setVisitLeaves(false);
        renderer.setMaxDepth(maxDepth);
        index.traverse(renderer, TraversalStrategy.DEPTH_FIRST);

        return builder.toString();
    }
}
