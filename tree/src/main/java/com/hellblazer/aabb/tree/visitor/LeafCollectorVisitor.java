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
import java.util.function.Predicate;

/**
 * Visitor that collects leaf payloads matching a given predicate.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public class LeafCollectorVisitor<B extends Box<B>, U> extends AbstractTreeVisitor<B, U> {

    private final List<LeafMatch<B, U>> collected = new ArrayList<>();
    private final Predicate<U>          filter;
    private final int                   maxResults;

    /**
     * Create a collector that collects all payloads.
     */
    public LeafCollectorVisitor() {
        this(data -> true, Integer.MAX_VALUE);
    }

    /**
     * Create a collector with a payload filter.
     *
     * @param filter predicate to filter payloads
     */
    public LeafCollectorVisitor(Predicate<U> filter) {
        this(filter, Integer.MAX_VALUE);
    }

    /**
     * Create a collector with a payload filter and result limit.
     *
     * @param filter     predicate to filter payloads
     * @param maxResults maximum number of results to collect
     */
    public LeafCollectorVisitor(Predicate<U> filter, int maxResults) {
        if (maxResults <= 0) {
            throw new IllegalArgumentException("Max results must be positive");
        }
        this.filter = filter;
        this.maxResults = maxResults;
        this.visitLeaves = true;
    }

    /**
     * Get the bounds of the collected payloads.
     *
     * @return list of bounds
     */
    public List<B> getBounds() {
        return collected.stream().map(LeafMatch::bounds).toList();
    }

    /**
     * Get the collected matches.
     *
     * @return list of matches
     */
    public List<LeafMatch<B, U>> getCollected() {
        return new ArrayList<>(collected);
    }

    /**
     * Get just the payloads.
     *
     * @return list of payloads
     */
    public List<U> getContents() {
        return collected.stream().map(LeafMatch::data).toList();
    }

    /**
     * Check if the maximum results limit was reached.
     *
     * @return true if limit was reached
     */
    public boolean isLimitReached() {
        return collected.size() >= maxResults;
    }

    /**
     * Reset the collector.
     */
    public void reset() {
        collected.clear();
    }

    @Override
    public void visitLeaf(U data, B bounds, int level) {
        if (collected.size() >= maxResults) {
            return;
        }
        if (filter.test(data)) {
            collected.add(new LeafMatch<>(data, bounds, level));
        }
    }

    @Override
    public boolean visitNode(Node<B, U> node, int level) {
        // Stop descending once we've collected enough results
        return collected.size() < maxResults;
    }

    /**
     * A collected payload, its bounds and the depth of its leaf.
     */
    public record LeafMatch<B extends Box<B>, U>(U data, B bounds, int level) {
    }
}
