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

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * An {@link AABBIndex} that serializes access to an {@link AABBTree} with a read/write lock. Mutations take the write
 * lock; queries, printing, traversal and validation share the read lock.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public class LockingAABBTree<B extends Box<B>, U> implements AABBIndex<B, U> {

    private final AABBTree<B, U> tree;
    private final ReadWriteLock  lock = new ReentrantReadWriteLock();

    public LockingAABBTree(TreeConfig<B, U> config) {
        this(new AABBTree<>(config));
    }

    /**
     * @param tree the tree to guard; callers must not keep using it directly
     */
    public LockingAABBTree(AABBTree<B, U> tree) {
        if (tree == null) {
            throw new IllegalArgumentException("Tree must not be null");
        }
        this.tree = tree;
    }

    @Override
    public B bounds() {
        lock.readLock().lock();
        try {
            return tree.bounds();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            tree.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int height() {
        lock.readLock().lock();
        try {
            return tree.height();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void insert(B bounds, U data) {
        lock.writeLock().lock();
        try {
            tree.insert(bounds, data);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return tree.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void print(Appendable out) {
        lock.readLock().lock();
        try {
            tree.print(out);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean remove(B bounds, U data) {
        lock.writeLock().lock();
        try {
            return tree.remove(bounds, data);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return tree.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return tree.toString();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void traverse(TreeVisitor<B, U> visitor, TraversalStrategy strategy) {
        lock.readLock().lock();
        try {
            tree.traverse(visitor, strategy);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void validate() {
        lock.readLock().lock();
        try {
            tree.validate();
        } finally {
            lock.readLock().unlock();
        }
    }
}
