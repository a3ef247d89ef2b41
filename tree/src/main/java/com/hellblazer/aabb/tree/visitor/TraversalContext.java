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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * State of a single traversal: visit counters and the queue of pending nodes for breadth-first order.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public class TraversalContext<B extends Box<B>, U> {

    private final Deque<Entry<B, U>> pending = new ArrayDeque<>();
    private       int                nodesVisited;
    private       int                leavesVisited;

    public int getLeavesVisited() {
        return leavesVisited;
    }

    public int getNodesVisited() {
        return nodesVisited;
    }

    public void incrementLeavesVisited() {
        leavesVisited++;
    }

    public void markVisited() {
        nodesVisited++;
    }

    /**
     * Take the oldest pending node.
     *
     * @return the entry, or null if nothing is pending
     */
    public Entry<B, U> popNode() {
        return pending.pollFirst();
    }

    /**
     * Queue a node for a later visit.
     *
     * @param node  the node
     * @param level the depth level of the node
     */
    public void pushNode(Node<B, U> node, int level) {
        pending.addLast(new Entry<>(node, level));
    }

    public record Entry<B extends Box<B>, U>(Node<B, U> node, int level) {
    }
}
