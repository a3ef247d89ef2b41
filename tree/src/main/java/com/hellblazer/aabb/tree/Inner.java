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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Predicate;

/**
 * An inner node of an AABB tree does not carry data. Its only purpose is to structure the tree. Its bounds is the
 * smallest box that contains the bounds of its two children, and it exclusively owns both of them.
 *
 * @author hal.hildebrand
 */
public final class Inner<B extends Box<B>, U> extends Node<B, U> {
    private static final Logger log = LoggerFactory.getLogger(Inner.class);

    private Node<B, U> left;
    private Node<B, U> right;
    private int        height;

    Inner(Node<B, U> left, Node<B, U> right) {
        super(left.bounds().mergedWith(right.bounds()));
        assert left != right;
        this.left = left;
        this.right = right;
        updateHeight();
    }

    @Override
    public int balance() {
        return right.height() - left.height();
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    public Node<B, U> left() {
        return left;
    }

    public Node<B, U> right() {
        return right;
    }

    @Override
    public String toString() {
        return "Inner[" + bounds() + ", height=" + height + ", balance=" + balance() + "]";
    }

    @Override
    void appendTo(Appendable out, String indent, int level) throws IOException {
        for (int i = 0; i < level; i++) {
            out.append(indent);
        }
        out.append("O ");
        appendBounds(out);
        out.append('\n');

        left.appendTo(out, indent, level + 1);
        right.appendTo(out, indent, level + 1);
    }

    @Override
    Leaf<B, U> findRebalanceCandidate(B bounds) {
        var leftCandidate = left.findRebalanceCandidate(bounds);
        var rightCandidate = right.findRebalanceCandidate(bounds);
        return selectLeastIncreaser(leftCandidate, rightCandidate, bounds);
    }

    /**
     * Descend into the child whose bounds grow the least, then update and rebalance. An inner node keeps its identity
     * on insert.
     */
    @Override
    Node<B, U> insert(Leaf<B, U> leaf) {
        if (selectLeastIncreaser(left, right, leaf.bounds()) == left) {
            left = left.insert(leaf);
        } else {
            right = right.insert(leaf);
        }

        update();
        rebalance();

        return this;
    }

    @Override
    RemoveResult<B, U> remove(B bounds, Predicate<Leaf<B, U>> matcher) {
        var result = removeFrom(true, bounds, matcher);
        if (result instanceof RemoveResult.NotFound) {
            result = removeFrom(false, bounds, matcher);
        }
        return result;
    }

    /**
     * Removes the candidate leaf, by identity, from the higher subtree.
     *
     * @return the new root of the higher subtree
     */
    private Node<B, U> detach(Node<B, U> higher, Leaf<B, U> candidate) {
        var result = higher.remove(candidate.bounds(), leaf -> leaf == candidate);
        if (!(result instanceof RemoveResult.Replaced<B, U> replaced)) {
            throw new IllegalStateException("Rebalance candidate " + candidate + " not detached: " + result);
        }
        return replaced.node();
    }

    /**
     * If this node is out of balance, relocate leaves from the higher subtree into the lower one. A node is out of
     * balance if and only if the heights of its subtrees differ by more than 1. The leaf relocated is the one that
     * would increase the bounds of the lower subtree the least.
     */
    private void rebalance() {
        while (Math.abs(balance()) > 1) {
            if (left.height() > right.height()) {
                var candidate = left.findRebalanceCandidate(right.bounds());
                log.trace("Relocating {} from left (height {}) to right (height {})", candidate, left.height(),
                          right.height());
                left = detach(left, candidate);
                right = right.insert(candidate);
            } else {
                var candidate = right.findRebalanceCandidate(left.bounds());
                log.trace("Relocating {} from right (height {}) to left (height {})", candidate, right.height(),
                          left.height());
                right = detach(right, candidate);
                left = left.insert(candidate);
            }
            update();
        }
    }

    /**
     * Drop both children. Called when this node is discarded so that a promoted child is never reachable from two
     * owners.
     */
    private void release() {
        left = null;
        right = null;
    }

    /**
     * Attempt to remove the matching leaf from one child.
     *
     * @param fromLeft true to search the left child, false for the right
     * @return what should replace this node in its parent, or not found if the leaf is not a descendant of the child
     */
    private RemoveResult<B, U> removeFrom(boolean fromLeft, B bounds, Predicate<Leaf<B, U>> matcher) {
        var child = fromLeft ? left : right;
        if (!child.bounds().contains(bounds)) {
            return RemoveResult.notFound();
        }

        var result = child.remove(bounds, matcher);
        if (result instanceof RemoveResult.RemovedLeaf) {
            // the child is the leaf to remove; the sibling takes this node's place
            var sibling = fromLeft ? right : left;
            release();
            return RemoveResult.replaced(sibling);
        }
        if (result instanceof RemoveResult.Replaced<B, U> replaced) {
            if (fromLeft) {
                left = replaced.node();
            } else {
                right = replaced.node();
            }

            update();
            rebalance();

            return RemoveResult.replaced(this);
        }
        return result;
    }

    private void update() {
        setBounds(left.bounds().mergedWith(right.bounds()));
        updateHeight();
    }

    private void updateHeight() {
        height = Math.max(left.height(), right.height()) + 1;
        assert height > 1;
    }
}
