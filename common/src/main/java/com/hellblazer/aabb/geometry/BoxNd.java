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

import java.util.Arrays;

/**
 * An axis aligned box in n-dimensional space with double coordinates. A one dimensional box is an interval.
 *
 * @author hal.hildebrand
 */
public final class BoxNd implements Box<BoxNd> {

    private final double[] min;
    private final double[] max;

    private BoxNd(double[] min, double[] max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Creates the invalid box of the given dimension.
     *
     * @param dimension number of axes
     * @return a box whose coordinates are all NaN
     */
    public static BoxNd nan(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        var values = new double[dimension];
        Arrays.fill(values, Double.NaN);
        return new BoxNd(values, values.clone());
    }

    /**
     * Creates a one dimensional box.
     *
     * @param lo lower end
     * @param hi upper end
     * @return the interval [lo, hi]
     */
    public static BoxNd interval(double lo, double hi) {
        return of(new double[] { lo }, new double[] { hi });
    }

    /**
     * Creates a bounding box with validation.
     *
     * @param minValues minimum value for each axis
     * @param maxValues maximum value for each axis
     * @return new bounding box
     * @throws IllegalArgumentException if dimensions don't match, are empty, a value is NaN or min > max
     */
    public static BoxNd of(double[] minValues, double[] maxValues) {
        if (minValues.length != maxValues.length) {
            throw new IllegalArgumentException("Min and max coordinates must have same dimension");
        }
        if (minValues.length == 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        for (int i = 0; i < minValues.length; i++) {
            if (Double.isNaN(minValues[i]) || Double.isNaN(maxValues[i])) {
                throw new IllegalArgumentException("Coordinates must not be NaN");
            }
            if (minValues[i] > maxValues[i]) {
                throw new IllegalArgumentException("Min coordinate cannot be greater than max coordinate");
            }
        }
        return new BoxNd(minValues.clone(), maxValues.clone());
    }

    @Override
    public boolean contains(BoxNd other) {
        checkDimension(other);
        for (int i = 0; i < min.length; i++) {
            if (!(min[i] <= other.min[i] && other.max[i] <= max[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int dimension() {
        return min.length;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BoxNd other)) {
            return false;
        }
        return Arrays.equals(min, other.min) && Arrays.equals(max, other.max);
    }

    /**
     * @return the extent along each axis
     */
    public double[] getSize() {
        var sizes = new double[min.length];
        for (int i = 0; i < min.length; i++) {
            sizes[i] = max[i] - min[i];
        }
        return sizes;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(min) + Arrays.hashCode(max);
    }

    @Override
    public boolean isValid() {
        return !Double.isNaN(min[0]);
    }

    @Override
    public double max(int axis) {
        return max[axis];
    }

    @Override
    public BoxNd mergedWith(BoxNd other) {
        checkDimension(other);
        if (!isValid() || !other.isValid()) {
            return nan(min.length);
        }
        var minValues = new double[min.length];
        var maxValues = new double[min.length];
        for (int i = 0; i < min.length; i++) {
            minValues[i] = Math.min(min[i], other.min[i]);
            maxValues[i] = Math.max(max[i], other.max[i]);
        }
        return new BoxNd(minValues, maxValues);
    }

    @Override
    public double min(int axis) {
        return min[axis];
    }

    @Override
    public String toString() {
        return "BoxNd[min=" + Arrays.toString(min) + ", max=" + Arrays.toString(max) + "]";
    }

    @Override
    public double volume() {
        var volume = 1.0;
        for (var size : getSize()) {
            volume *= size;
        }
        return volume;
    }

    private void checkDimension(BoxNd other) {
        if (other.min.length != min.length) {
            throw new IllegalArgumentException(
            "Dimension mismatch: " + min.length + " != " + other.min.length);
        }
    }
}
