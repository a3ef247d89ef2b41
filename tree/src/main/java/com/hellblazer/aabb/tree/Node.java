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

import java.io.IOException;
import java.util.function.Predicate;

/**
 * A node of an {@link AABBTree}. A node is either a {@link Leaf}, which carries a payload and the box it was inserted
 * with, or an {@link Inner} node, which owns exactly two children and carries the merged bounds of both.
 * <p>
 * The public surface is read only. Structural changes happen through the owning tree, which always replaces a subtree
 * with whatever node the mutation returns.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public abstract sealed class Node<B extends Box<B>, U> permits Leaf, Inner {

    private B bounds;

    Node(B bounds) {
        this.bounds = bounds;
    }

    /**
     * Selects one of the two given nodes such that it increases the given bounds the least. Ties go to the first
     * node.
     */
    static <B extends Box<B>, N extends Node<B, ?>> N selectLeastIncreaser(N node1, N node2, B bounds) {
        var diff1 = node1.bounds().enlargement(bounds);
        var diff2 = node2.bounds().enlargement(bounds);
        return diff1 <= diff2 ? node1 : node2;
    }

    /**
     * For a leaf always 0. For an inner node the height of the right subtree minus the height of the left subtree.
     *
     * @return the balance of this node
     */
    public abstract int balance();

    /**
     * @return the bounds of this node
     */
    public B bounds() {
        return bounds;
    }

    /**
     * A leaf always has a height of 1. An inner node is one higher than its highest child.
     *
     * @return the height of this node
     */
    public abstract int height();

    public abstract boolean isLeaf();

    /**
     * Appends one line per node of this subtree, depth first, each indented by level.
     */
    abstract void appendTo(Appendable out, String indent, int level) throws IOException;

    /**
     * Appends this node's bounds as a pair of corners: {@code [ (x y z) (x y z) ]}
     */
    void appendBounds(Appendable out) throws IOException {
        out.append("[ (");
        appendCorner(out, true);
        out.append(") (");
        appendCorner(out, false);
        out.append(") ]");
    }

    /**
     * Finds the leaf of this subtree that increases the given bounds the least.
     */
    abstract Leaf<B, U> findRebalanceCandidate(B bounds);

    /**
     * Inserts the leaf into this subtree.
     *
     * @return the new root of the subtree
     */
    abstract Node<B, U> insert(Leaf<B, U> leaf);

    /**
     * Removes the first leaf accepted by the matcher. The bounds are only used to prune subtrees that cannot hold
     * the leaf.
     */
    abstract RemoveResult<B, U> remove(B bounds, Predicate<Leaf<B, U>> matcher);

    void setBounds(B bounds) {
        this.bounds = bounds;
    }

    private void appendCorner(Appendable out, boolean min) throws IOException {
        for (int axis = 0; axis < bounds.dimension(); axis++) {
            if (axis > 0) {
                out.append(' ');
            }
            out.append(Double.toString(min ? bounds.min(axis) : bounds.max(axis)));
        }
    }
}
