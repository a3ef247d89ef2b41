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
package com.hellblazer.aabb.tree;

import com.hellblazer.aabb.geometry.Box;

/**
 * Outcome of removing a leaf from a subtree.
 *
 * @author hal.hildebrand
 */
sealed interface RemoveResult<B extends Box<B>, U> {

    @SuppressWarnings("rawtypes")
    NotFound    NOT_FOUND    = new NotFound();
    @SuppressWarnings("rawtypes")
    RemovedLeaf REMOVED_LEAF = new RemovedLeaf();

    @SuppressWarnings("unchecked")
    static <B extends Box<B>, U> RemoveResult<B, U> notFound() {
        return NOT_FOUND;
    }

    @SuppressWarnings("unchecked")
    static <B extends Box<B>, U> RemoveResult<B, U> removedLeaf() {
        return REMOVED_LEAF;
    }

    static <B extends Box<B>, U> RemoveResult<B, U> replaced(Node<B, U> node) {
        return new Replaced<>(node);
    }

    /**
     * No leaf of the subtree matched; the subtree is untouched.
     */
    record NotFound<B extends Box<B>, U>() implements RemoveResult<B, U> {
    }

    /**
     * The subtree root is itself the matching leaf. Its parent drops it and promotes its sibling.
     */
    record RemovedLeaf<B extends Box<B>, U>() implements RemoveResult<B, U> {
    }

    /**
     * A matching leaf was removed below the subtree root. The node is the root of the subtree afterwards, which may be
     * the same instance as before.
     */
    record Replaced<B extends Box<B>, U>(Node<B, U> node) implements RemoveResult<B, U> {
    }
}
