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

/**
 * Visitor interface for traversing the tree structure. Implementations can perform custom operations on nodes and
 * their payloads during traversal.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public interface TreeVisitor<B extends Box<B>, U> {

    /**
     * Called when entering a node during traversal.
     *
     * @param node  The node being visited
     * @param level The depth level of this node (0 = root)
     * @return true to continue traversing children, false to skip children
     */
    boolean visitNode(Node<B, U> node, int level);

    /**
     * Called after traversal completes.
     *
     * @param nodesVisited  Number of nodes actually visited
     * @param leavesVisited Number of leaf payloads actually visited
     */
    default void endTraversal(int nodesVisited, int leavesVisited) {
        // Default: do nothing
    }

    /**
     * Called before traversal begins.
     *
     * @param totalLeaves Total number of leaves in the tree
     * @param height      Height of the tree
     */
    default void beginTraversal(int totalLeaves, int height) {
        // Default: do nothing
    }

    /**
     * Controls the maximum depth to traverse.
     *
     * @return maximum depth to traverse (-1 for unlimited)
     */
    default int getMaxDepth() {
        return -1;
    }

    /**
     * Called when leaving a node. Only called if visitNode returned true.
     *
     * @param node       The node being left
     * @param level      The depth level of this node
     * @param childCount Number of child nodes that were visited or queued
     */
    default void leaveNode(Node<B, U> node, int level, int childCount) {
        // Default: do nothing
    }

    /**
     * Controls whether to visit leaf payloads in addition to nodes.
     *
     * @return true to visit payloads, false to skip them
     */
    default boolean shouldVisitLeaves() {
        return true;
    }

    /**
     * Called for the payload of each leaf visited.
     *
     * @param data   The payload
     * @param bounds The bounds the payload was inserted with
     * @param level  The depth level of the leaf
     */
    default void visitLeaf(U data, B bounds, int level) {
        // Default: do nothing
    }
}
