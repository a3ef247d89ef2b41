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

/**
 * Defines the strategy for traversing the tree.
 *
 * @author hal.hildebrand
 */
public enum TraversalStrategy {
    /**
     * Depth-first, pre-order traversal. Visits a node, then its left subtree, then its right subtree.
     */
    DEPTH_FIRST,

    /**
     * Breadth-first search traversal. Visits all nodes at the current level before moving to the next level.
     */
    BREADTH_FIRST,

    /**
     * Post-order traversal. Visits both subtrees, then the node.
     */
    POST_ORDER
}
