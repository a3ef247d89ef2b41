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
import com.hellblazer.aabb.geometry.Box3f;
import com.hellblazer.aabb.geometry.BoxNd;
import com.hellblazer.aabb.tree.visitor.TraversalContext;
import com.hellblazer.aabb.tree.visitor.TraversalStrategy;
import com.hellblazer.aabb.tree.visitor.TreeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * A dynamic bounding volume tree over axis aligned boxes. Every entry is a leaf holding its payload and the box it was
 * inserted with; every inner node holds exactly two children and the merged bounds of both.
 * <p>
 * New entries descend into the child whose bounds grow the least. The tree keeps the heights of the two subtrees of
 * every inner node within one of each other by relocating single leaves from the higher subtree into the lower one.
 * <p>
 * Not thread safe. Use {@link LockingAABBTree} or serialize all mutations externally.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public class AABBTree<B extends Box<B>, U> implements AABBIndex<B, U> {
    private static final Logger log = LoggerFactory.getLogger(AABBTree.class);

    private final TreeConfig<B, U> config;
    private       Node<B, U>       root;
    private       int              size;

    public AABBTree(TreeConfig<B, U> config) {
        if (config == null) {
            throw new IllegalArgumentException("Config must not be null");
        }
        this.config = config;
    }

    public static <U> AABBTree<Box3f, U> box3f() {
        return new AABBTree<>(TreeConfig.forBox3f());
    }

    public static <U> AABBTree<BoxNd, U> boxNd(int dimension) {
        return new AABBTree<>(TreeConfig.forBoxNd(dimension));
    }

    @Override
    public B bounds() {
        if (isEmpty()) {
            assert !config.isStrictBounds() : "Bounds requested from an empty tree";
            log.warn("Bounds requested from an empty tree, answering the invalid box");
            return config.getEmptyBounds();
        }
        return root.bounds();
    }

    @Override
    public void clear() {
        root = null;
        size = 0;
    }

    public TreeConfig<B, U> getConfig() {
        return config;
    }

    /**
     * @return the root node, or null if the tree is empty
     */
    public Node<B, U> getRoot() {
        return root;
    }

    @Override
    public int height() {
        return isEmpty() ? 0 : root.height();
    }

    @Override
    public void insert(B bounds, U data) {
        checkBounds(bounds);
        if (!bounds.isValid()) {
            throw new IllegalArgumentException("Cannot insert invalid bounds: " + bounds);
        }

        var leaf = new Leaf<>(bounds, data);
        root = isEmpty() ? leaf : root.insert(leaf);
        size++;
        log.trace("Inserted {} at {}, height: {}", data, bounds, root.height());

        assert Math.abs(root.balance()) < 2;
        if (config.isValidateOnMutation()) {
            validate();
        }
    }

    @Override
    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Print the tree to standard out
     */
    public void print() {
        print(System.out);
    }

    @Override
    public void print(Appendable out) {
        if (isEmpty()) {
            return;
        }
        try {
            root.appendTo(out, config.getIndent(), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to print tree", e);
        }
    }

    @Override
    public boolean remove(B bounds, U data) {
        checkBounds(bounds);
        if (isEmpty() || !root.bounds().contains(bounds)) {
            return false;
        }

        var equality = config.getEquality();
        var result = root.remove(bounds, leaf -> equality.test(data, leaf.data()));
        if (result instanceof RemoveResult.RemovedLeaf) {
            root = null;
        } else if (result instanceof RemoveResult.Replaced<B, U> replaced) {
            root = replaced.node();
        } else {
            log.trace("No entry matching {} within {}", data, bounds);
            return false;
        }
        size--;
        log.trace("Removed {} at {}, height: {}", data, bounds, height());

        assert isEmpty() || Math.abs(root.balance()) < 2;
        if (config.isValidateOnMutation()) {
            validate();
        }
        return true;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "AABBTree[empty]";
        }
        return "AABBTree[size=" + size + ", height=" + root.height() + ", bounds=" + root.bounds() + "]";
    }

    @Override
    public void traverse(TreeVisitor<B, U> visitor, TraversalStrategy strategy) {
        visitor.beginTraversal(size, height());
        var context = new TraversalContext<B, U>();
        if (!isEmpty()) {
            switch (strategy) {
                case DEPTH_FIRST -> traversePreOrder(root, 0, visitor, context);
                case POST_ORDER -> traversePostOrder(root, 0, visitor, context);
                case BREADTH_FIRST -> traverseBreadthFirst(visitor, context);
            }
        }
        visitor.endTraversal(context.getNodesVisited(), context.getLeavesVisited());
    }

    @Override
    public void validate() {
        if (isEmpty()) {
            if (size != 0) {
                throw new IllegalStateException("Empty tree reports size " + size);
            }
            return;
        }
        Set<Node<B, U>> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        var leaves = validate(root, seen, "root");
        if (leaves != size) {
            throw new IllegalStateException("Tree holds " + leaves + " leaves but reports size " + size);
        }
    }

    private void checkBounds(B bounds) {
        if (bounds == null) {
            throw new IllegalArgumentException("Bounds must not be null");
        }
        var dimension = config.getEmptyBounds().dimension();
        if (bounds.dimension() != dimension) {
            throw new IllegalArgumentException(
            "Bounds of dimension " + bounds.dimension() + " in a tree of dimension " + dimension);
        }
    }

    private boolean exceedsDepth(TreeVisitor<B, U> visitor, int level) {
        return visitor.getMaxDepth() >= 0 && level > visitor.getMaxDepth();
    }

    private void traverseBreadthFirst(TreeVisitor<B, U> visitor, TraversalContext<B, U> context) {
        context.pushNode(root, 0);
        TraversalContext.Entry<B, U> entry;
        while ((entry = context.popNode()) != null) {
            var node = entry.node();
            var level = entry.level();
            if (exceedsDepth(visitor, level)) {
                continue;
            }
            context.markVisited();
            if (!visitor.visitNode(node, level)) {
                continue;
            }
            var childCount = 0;
            if (node instanceof Inner<B, U> inner) {
                context.pushNode(inner.left(), level + 1);
                context.pushNode(inner.right(), level + 1);
                childCount = 2;
            } else {
                visitLeaf((Leaf<B, U>) node, level, visitor, context);
            }
            visitor.leaveNode(node, level, childCount);
        }
    }

    private boolean traversePostOrder(Node<B, U> node, int level, TreeVisitor<B, U> visitor,
                                      TraversalContext<B, U> context) {
        if (exceedsDepth(visitor, level)) {
            return false;
        }
        var childCount = 0;
        if (node instanceof Inner<B, U> inner) {
            childCount += traversePostOrder(inner.left(), level + 1, visitor, context) ? 1 : 0;
            childCount += traversePostOrder(inner.right(), level + 1, visitor, context) ? 1 : 0;
        }
        context.markVisited();
        if (visitor.visitNode(node, level)) {
            if (node instanceof Leaf<B, U> leaf) {
                visitLeaf(leaf, level, visitor, context);
            }
            visitor.leaveNode(node, level, childCount);
        }
        return true;
    }

    private boolean traversePreOrder(Node<B, U> node, int level, TreeVisitor<B, U> visitor,
                                     TraversalContext<B, U> context) {
        if (exceedsDepth(visitor, level)) {
            return false;
        }
        context.markVisited();
        if (!visitor.visitNode(node, level)) {
            return true;
        }
        var childCount = 0;
        if (node instanceof Inner<B, U> inner) {
            childCount += traversePreOrder(inner.left(), level + 1, visitor, context) ? 1 : 0;
            childCount += traversePreOrder(inner.right(), level + 1, visitor, context) ? 1 : 0;
        } else {
            visitLeaf((Leaf<B, U>) node, level, visitor, context);
        }
        visitor.leaveNode(node, level, childCount);
        return true;
    }

    /**
     * Check bounds, height, balance and exclusive ownership of the subtree.
     *
     * @return the number of leaves of the subtree
     */
    private int validate(Node<B, U> node, Set<Node<B, U>> seen, String path) {
        if (node == null) {
            throw new IllegalStateException("Missing node at " + path);
        }
        if (!seen.add(node)) {
            throw new IllegalStateException("Node at " + path + " is owned more than once: " + node);
        }
        if (node instanceof Inner<B, U> inner) {
            var leaves = validate(inner.left(), seen, path + ".left") + validate(inner.right(), seen, path + ".right");

            var merged = inner.left().bounds().mergedWith(inner.right().bounds());
            if (!merged.equals(inner.bounds())) {
                throw new IllegalStateException(
                "Bounds at " + path + " are " + inner.bounds() + " but children merge to " + merged);
            }
            var expectedHeight = Math.max(inner.left().height(), inner.right().height()) + 1;
            if (inner.height() != expectedHeight) {
                throw new IllegalStateException(
                "Height at " + path + " is " + inner.height() + " but should be " + expectedHeight);
            }
            if (Math.abs(inner.balance()) > 1) {
                throw new IllegalStateException("Node at " + path + " is out of balance: " + inner.balance());
            }
            return leaves;
        }
        if (!node.bounds().isValid()) {
            throw new IllegalStateException("Leaf at " + path + " has invalid bounds");
        }
        return 1;
    }

    private void visitLeaf(Leaf<B, U> leaf, int level, TreeVisitor<B, U> visitor, TraversalContext<B, U> context) {
        if (visitor.shouldVisitLeaves()) {
            visitor.visitLeaf(leaf.data(), leaf.bounds(), level);
            context.incrementLeavesVisited();
        }
    }
}
