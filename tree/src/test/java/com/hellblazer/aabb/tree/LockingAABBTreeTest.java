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

import com.hellblazer.aabb.geometry.Box3f;
import com.hellblazer.aabb.tree.debug.AABBTreeDebugger;
import com.hellblazer.aabb.tree.visitor.TraversalStrategy;
import com.hellblazer.aabb.tree.visitor.TreeShapeVisitor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import java.util.ArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class LockingAABBTreeTest {

    private static final int THREADS    = 4;
    private static final int PER_THREAD = 250;

    private ExecutorService            executor;
    private LockingAABBTree<Box3f, Integer> tree;

    @BeforeEach
    public void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
        tree = new LockingAABBTree<>(TreeConfig.<Integer>forBox3f().withValidation(false));
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }

    @Test
    public void testConcurrentInsertAndRemove() throws Exception {
        var inserts = new ArrayList<Future<?>>();
        for (int t = 0; t < THREADS; t++) {
            var thread = t;
            inserts.add(executor.submit(() -> {
                for (int i = 0; i < PER_THREAD; i++) {
                    var id = thread * PER_THREAD + i;
                    tree.insert(boxFor(id), id);
                    if (i % 10 == 0) {
                        assertFalse(tree.isEmpty());
                        tree.height();
                    }
                }
            }));
        }
        for (var future : inserts) {
            future.get(30, TimeUnit.SECONDS);
        }
        assertEquals(THREADS * PER_THREAD, tree.size());
        tree.validate();

        var removes = new ArrayList<Future<?>>();
        for (int t = 0; t < THREADS; t++) {
            var thread = t;
            removes.add(executor.submit(() -> {
                for (int i = 0; i < PER_THREAD; i += 2) {
                    var id = thread * PER_THREAD + i;
                    assertTrue(tree.remove(boxFor(id), id));
                }
            }));
        }
        for (var future : removes) {
            future.get(30, TimeUnit.SECONDS);
        }
        assertEquals(THREADS * PER_THREAD / 2, tree.size());
        tree.validate();

        var shape = new TreeShapeVisitor<Box3f, Integer>();
        tree.traverse(shape, TraversalStrategy.BREADTH_FIRST);
        assertEquals(tree.size(), shape.getLeafCount());
    }

    @Test
    public void testAnalysisUnderConcurrentMutation() throws Exception {
        var mutator = executor.submit(() -> {
            for (int round = 0; round < 20; round++) {
                for (int id = 0; id < 50; id++) {
                    tree.insert(boxFor(id), id);
                }
                for (int id = 0; id < 50; id++) {
                    assertTrue(tree.remove(boxFor(id), id));
                }
            }
        });

        var debugger = new AABBTreeDebugger<>(tree);
        while (!mutator.isDone()) {
            var analysis = debugger.analyze();
            if (analysis.leafCount() == 0) {
                assertEquals(0, analysis.nodeCount(), analysis.toString());
                assertEquals(0, analysis.height(), analysis.toString());
                assertEquals(0.0, analysis.rootVolume(), analysis.toString());
            } else {
                assertEquals(2 * analysis.leafCount() - 1, analysis.nodeCount(), analysis.toString());
                assertTrue(analysis.height() > analysis.averageLeafDepth(), analysis.toString());
                assertTrue(analysis.rootVolume() > 0, analysis.toString());
                assertTrue(analysis.maxAbsBalance() < 2, analysis.toString());
            }
            assertFalse(Double.isNaN(analysis.averageLeafDepth()), analysis.toString());

            var art = debugger.toAsciiArt(-1);
            var rendered = art.lines().filter(line -> line.contains("├─ ")).count();
            if (art.contains("(empty)")) {
                assertEquals(0, rendered, art);
            } else {
                var leaves = Integer.parseInt(art.substring(art.indexOf("Leaves: ") + 8, art.indexOf(',')));
                assertEquals(2L * leaves - 1, rendered, art);
            }
        }
        mutator.get(30, TimeUnit.SECONDS);
        assertTrue(tree.isEmpty());
    }

    @Test
    public void testDelegation() {
        assertTrue(tree.isEmpty());
        assertSame(Box3f.NaN, tree.bounds());

        tree.insert(boxFor(1), 1);
        tree.insert(boxFor(2), 2);
        assertEquals(2, tree.size());
        assertEquals(2, tree.height());
        assertEquals(boxFor(1).mergedWith(boxFor(2)), tree.bounds());

        var builder = new StringBuilder();
        tree.print(builder);
        assertEquals(3, builder.toString().lines().count());
        assertTrue(tree.toString().startsWith("AABBTree[size=2"));

        assertTrue(tree.remove(boxFor(1), 1));
        tree.clear();
        assertTrue(tree.isEmpty());
    }

    private Box3f boxFor(int id) {
        return Box3f.around(new Point3f(id % 32, (id / 32) % 32, id / 1024), 0.25f);
    }
}
