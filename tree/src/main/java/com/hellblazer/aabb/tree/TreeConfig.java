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

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Configuration for an {@link AABBTree}: the box answered for an empty tree, the relation that identifies the payload
 * to remove, the indent of the diagnostic dump, whether every mutation re-validates the tree and whether asking an
 * empty tree for its bounds is treated as a failed assertion.
 *
 * @param <B> the box type
 * @param <U> the payload type
 * @author hal.hildebrand
 */
public class TreeConfig<B extends Box<B>, U> {

    private final B                emptyBounds;
    private       BiPredicate<U, U> equality           = Objects::equals;
    private       String           indent             = "  ";
    private       boolean          strictBounds       = false;
    private       boolean          validateOnMutation = AABBTree.class.desiredAssertionStatus();

    /**
     * @param emptyBounds the invalid box answered by {@link AABBTree#bounds()} when the tree is empty
     */
    public TreeConfig(B emptyBounds) {
        if (emptyBounds == null) {
            throw new IllegalArgumentException("Empty bounds must not be null");
        }
        if (emptyBounds.isValid()) {
            throw new IllegalArgumentException("Empty bounds must be an invalid box: " + emptyBounds);
        }
        this.emptyBounds = emptyBounds;
    }

    /**
     * Configuration for trees of 3D float boxes.
     */
    public static <U> TreeConfig<Box3f, U> forBox3f() {
        return new TreeConfig<>(Box3f.NaN);
    }

    /**
     * Configuration for trees of n-dimensional boxes.
     */
    public static <U> TreeConfig<BoxNd, U> forBoxNd(int dimension) {
        return new TreeConfig<>(BoxNd.nan(dimension));
    }

    /**
     * Turn on validation of the whole tree after every insert and remove. Intended for tests and debugging, as it
     * visits every node.
     */
    public TreeConfig<B, U> debugging() {
        return withValidation(true);
    }

    public B getEmptyBounds() {
        return emptyBounds;
    }

    /**
     * The relation used by remove to recognize the leaf to delete among the leaves whose bounds pass the containment
     * check. Defaults to {@link Objects#equals(Object, Object)}.
     */
    public BiPredicate<U, U> getEquality() {
        return equality;
    }

    /**
     * The string repeated once per level when printing the tree.
     */
    public String getIndent() {
        return indent;
    }

    /**
     * Whether asking an empty tree for its bounds fails an assertion instead of only logging a warning. Has no effect
     * unless assertions are enabled for the tree class.
     */
    public boolean isStrictBounds() {
        return strictBounds;
    }

    /**
     * Whether insert and remove finish by validating every invariant of the tree. Defaults to the assertion status of
     * the tree class.
     */
    public boolean isValidateOnMutation() {
        return validateOnMutation;
    }

    // Fluent API for configuration

    public TreeConfig<B, U> withEquality(BiPredicate<U, U> equality) {
        if (equality == null) {
            throw new IllegalArgumentException("Equality must not be null");
        }
        this.equality = equality;
        return this;
    }

    public TreeConfig<B, U> withIndent(String indent) {
        if (indent == null) {
            throw new IllegalArgumentException("Indent must not be null");
        }
        this.indent = indent;
        return this;
    }

    public TreeConfig<B, U> withStrictBounds(boolean strict) {
        this.strictBounds = strict;
        return this;
    }

    public TreeConfig<B, U> withValidation(boolean validate) {
        this.validateOnMutation = validate;
        return this;
    }
}
