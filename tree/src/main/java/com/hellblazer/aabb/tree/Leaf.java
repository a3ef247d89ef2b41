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
 * A leaf represents actual data. It does not have any children. Its bounds equals the bounds supplied when the data
 * was inserted. A leaf has a height of 1 and a balance of 0.
 *
 * @author hal.hildebrand
 */
public final class Leaf<B extends Box<B>, U> extends Node<B, U> {

    private final U data;

    Leaf(B bounds, U data) {
        super(bounds);
        this.data = data;
    }

    @Override
    public int balance() {
        return 0;
    }

    public U data() {
        return data;
    }

    @Override
    public int height() {
        return 1;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public String toString() {
        return "Leaf[" + bounds() + ": " + data + "]";
    }

    @Override
    void appendTo(Appendable out, String indent, int level) throws IOException {
        for (int i = 0; i < level; i++) {
            out.append(indent);
        }
        out.append("L ");
        appendBounds(out);
        out.append(": ").append(String.valueOf(data)).append('\n');
    }

    @Override
    Leaf<B, U> findRebalanceCandidate(B bounds) {
        return this;
    }

    /**
     * A leaf gains a sibling: answer a new inner node with this leaf on the left and the inserted leaf on the right,
     * which replaces this leaf in the parent.
     */
    @Override
    Node<B, U> insert(Leaf<B, U> leaf) {
        return new Inner<>(this, leaf);
    }

    @Override
    RemoveResult<B, U> remove(B bounds, Predicate<Leaf<B, U>> matcher) {
        return matcher.test(this) ? RemoveResult.removedLeaf() : RemoveResult.notFound();
    }
}
