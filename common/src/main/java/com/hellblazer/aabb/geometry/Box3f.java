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

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;

/**
 * An axis aligned box in 3D with float coordinates, defined by its min and max corners.
 *
 * @author hal.hildebrand
 */
public final class Box3f implements Box<Box3f> {

    /**
     * The invalid box. All coordinates are NaN.
     */
    public static final Box3f NaN = new Box3f(new Point3f(Float.NaN, Float.NaN, Float.NaN),
                                              new Point3f(Float.NaN, Float.NaN, Float.NaN), false);

    private final Point3f min;
    private final Point3f max;

    private Box3f(Point3f min, Point3f max, boolean check) {
        if (check) {
            if (Float.isNaN(min.x) || Float.isNaN(min.y) || Float.isNaN(min.z) || Float.isNaN(max.x) || Float.isNaN(
            max.y) || Float.isNaN(max.z)) {
                throw new IllegalArgumentException("Box coordinates must not be NaN: " + min + ", " + max);
            }
            if (min.x > max.x || min.y > max.y || min.z > max.z) {
                throw new IllegalArgumentException("Min corner must not exceed max corner: " + min + ", " + max);
            }
        }
        this.min = min;
        this.max = max;
    }

    /**
     * Create a cube centered on the given point
     */
    public static Box3f around(Tuple3f center, float radius) {
        return around(center, radius, radius, radius);
    }

    /**
     * Create a box from center and half-extents
     */
    public static Box3f around(Tuple3f center, float halfWidth, float halfHeight, float halfDepth) {
        if (halfWidth < 0 || halfHeight < 0 || halfDepth < 0) {
            throw new IllegalArgumentException("Half extents must not be negative");
        }
        return new Box3f(new Point3f(center.x - halfWidth, center.y - halfHeight, center.z - halfDepth),
                         new Point3f(center.x + halfWidth, center.y + halfHeight, center.z + halfDepth), true);
    }

    public static Box3f of(float minX, float minY, float minZ, float maxX, float maxY, float maxZ) {
        return new Box3f(new Point3f(minX, minY, minZ), new Point3f(maxX, maxY, maxZ), true);
    }

    public static Box3f of(Tuple3f min, Tuple3f max) {
        return new Box3f(new Point3f(min), new Point3f(max), true);
    }

    /**
     * Create point bounds (no extent)
     */
    public static Box3f point(Tuple3f position) {
        return new Box3f(new Point3f(position), new Point3f(position), true);
    }

    public Point3f getCenter() {
        return new Point3f((min.x + max.x) / 2, (min.y + max.y) / 2, (min.z + max.z) / 2);
    }

    public Point3f getMax() {
        return new Point3f(max);
    }

    public Point3f getMin() {
        return new Point3f(min);
    }

    @Override
    public boolean contains(Box3f other) {
        return min.x <= other.min.x && min.y <= other.min.y && min.z <= other.min.z && other.max.x <= max.x
        && other.max.y <= max.y && other.max.z <= max.z;
    }

    @Override
    public int dimension() {
        return 3;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Box3f other)) {
            return false;
        }
        return min.equals(other.min) && max.equals(other.max);
    }

    @Override
    public int hashCode() {
        return 31 * min.hashCode() + max.hashCode();
    }

    @Override
    public boolean isValid() {
        return !Float.isNaN(min.x);
    }

    @Override
    public double max(int axis) {
        return coordinate(max, axis);
    }

    @Override
    public Box3f mergedWith(Box3f other) {
        if (!isValid() || !other.isValid()) {
            return NaN;
        }
        return new Box3f(new Point3f(Math.min(min.x, other.min.x), Math.min(min.y, other.min.y),
                                     Math.min(min.z, other.min.z)),
                         new Point3f(Math.max(max.x, other.max.x), Math.max(max.y, other.max.y),
                                     Math.max(max.z, other.max.z)), false);
    }

    @Override
    public double min(int axis) {
        return coordinate(min, axis);
    }

    @Override
    public String toString() {
        if (!isValid()) {
            return "Box3f[NaN]";
        }
        return String.format("Box3f[min=(%.2f,%.2f,%.2f), max=(%.2f,%.2f,%.2f)]", min.x, min.y, min.z, max.x, max.y,
                             max.z);
    }

    @Override
    public double volume() {
        return ((double) max.x - min.x) * ((double) max.y - min.y) * ((double) max.z - min.z);
    }

    private static double coordinate(Point3f p, int axis) {
        return switch (axis) {
            case 0 -> p.x;
            case 1 -> p.y;
            case 2 -> p.z;
            default -> throw new IllegalArgumentException("Unexpected axis: " + axis);
        };
    }
}
