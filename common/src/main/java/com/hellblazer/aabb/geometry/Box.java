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
package com.hellblazer.aabb.geometry;

/**
 * An immutable axis aligned bounding box over a fixed dimension space. Implementations are value types: two boxes with
 * the same corners are equal.
 * <p>
 * Every implementation has a recognizably invalid box whose corners are NaN. Such a box is not valid, contains nothing
 * and is contained by nothing.
 *
 * @param <B> the concrete box type
 * @author hal.hildebrand
 */
public interface Box<B extends Box<B>> {

    /**
     * Answer true if the other box is completely enclosed by the receiver. Touching faces count as enclosed.
     *
     * @param other the box to test
     * @return true if every corner of the other box lies within the receiver
     */
    boolean contains(B other);

    /**
     * @return the number of axes of this box
     */
    int dimension();

    /**
     * Answer the growth of the receiver's volume if it were merged with the given box. Never negative.
     *
     * @param other the box to merge with
     * @return the volume of the merged box minus the volume of the receiver
     */
    default double enlargement(B other) {
        return mergedWith(other).volume() - volume();
    }

    /**
     * @return true if the receiver is a real box, false if it is the NaN sentinel
     */
    boolean isValid();

    /**
     * @param axis the axis, in [0, dimension)
     * @return the maximum coordinate of the receiver along the axis
     */
    double max(int axis);

    /**
     * Answer the smallest box that encloses both the receiver and the other box.
     *
     * @param other the box to merge with
     * @return the merged box
     */
    B mergedWith(B other);

    /**
     * @param axis the axis, in [0, dimension)
     * @return the minimum coordinate of the receiver along the axis
     */
    double min(int axis);

    /**
     * The product of the receiver's extents. A box that is flat along any axis has a volume of zero. Merging never
     * decreases the volume.
     *
     * @return the volume
     */
    double volume();
}
