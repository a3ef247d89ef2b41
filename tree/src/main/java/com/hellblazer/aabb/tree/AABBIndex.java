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
import com.hellblazer.aabb.tree.visitor.TraversalStrategy;
import com.hellblazer.aabb.tree.visitor.TreeVisitor;

/**
 * An index of payloads by axis aligned bounding box.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public interface AABBIndex<B extends Box<B>, U> {

    /**
     * Answer the bounds of everything in the index. Callers are expected to check {@link #isEmpty()} first; an empty
     * index answers the configured invalid box.
     *
     * @return the bounds of all leaves, or the invalid box if the index is empty
     */
    B bounds();

    /**
     * Remove everything.
     */
    void clear();

    /**
     * The height of the index is the length of the longest path from the root to a leaf, 0 if empty.
     *
     * @return the height
     */
    int height();

    /**
     * Insert the data with the given bounds. Inserting the same pair twice creates two entries.
     *
     * @param bounds the bounds of the data
     * @param data   the data
     * @throws IllegalArgumentException if the bounds are null, invalid or of the wrong dimension
     */
    void insert(B bounds, U data);

    boolean isEmpty();

    /**
     * Append an indented, depth first dump of the index, one line per node.
     *
     * @param out where to append
     */
    void print(Appendable out);

    /**
     * Remove one entry whose data matches the given data. The bounds are used to prune the search; they must lie
     * within the bounds the data was inserted with, and passing those exact bounds always works.
     *
     * @param bounds the bounds of the entry to remove
     * @param data   the data of the entry to remove
     * @return true if an entry was removed, false if none matched
     */
    boolean remove(B bounds, U data);

    /**
     * @return the number of entries
     */
    int size();

    /**
     * Traverse the index with a visitor.
     *
     * @param visitor  the visitor
     * @param strategy the order in which nodes are visited
     */
    void traverse(TreeVisitor<B, U> visitor, TraversalStrategy strategy);

    /**
     * Check the structural invariants of the index.
     *
     * @throws IllegalStateException describing the first violation found
     */
    void validate();
}
