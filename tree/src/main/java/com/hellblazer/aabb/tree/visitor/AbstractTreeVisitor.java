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
 * Abstract base class for tree visitors providing default implementations. Subclasses can override only the methods
 * they need.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public abstract class AbstractTreeVisitor<B extends Box<B>, U> implements TreeVisitor<B, U> {

    protected boolean visitLeaves = true;
    protected int     maxDepth    = -1;

    @Override
    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Set the maximum depth to traverse.
     *
     * @param maxDepth maximum depth (-1 for unlimited)
     */
    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Set whether to visit leaf payloads.
     *
     * @param visitLeaves true to visit payloads
     */
    public void setVisitLeaves(boolean visitLeaves) {
        this.visitLeaves = visitLeaves;
    }

    @Override
    public boolean shouldVisitLeaves() {
        return visitLeaves;
    }

    @Override
    public boolean visitNode(Node<B, U> node, int level) {
        // Default: continue traversal
        return true;
    }
}
