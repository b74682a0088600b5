/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.sierpinski.geometry;

/**
 * Immutable 2D point with real-valued coordinates.
 * All arithmetic returns a new point; instances are never mutated.
 *
 * @author hal.hildebrand
 */
public final class Point2d {

    /** X coordinate */
    public final double x;

    /** Y coordinate */
    public final double y;

    /**
     * Create a new 2D point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     */
    public Point2d(double x, double y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Create a point at the origin (0, 0).
     *
     * @return Point at origin
     */
    public static Point2d origin() {
        return new Point2d(0.0, 0.0);
    }

    /**
     * Add another point to this point.
     *
     * @param other Point to add
     * @return New point with summed coordinates
     */
    public Point2d add(Point2d other) {
        return new Point2d(x + other.x, y + other.y);
    }

    /**
     * Subtract another point from this point.
     *
     * @param other Point to subtract
     * @return New point with subtracted coordinates
     */
    public Point2d subtract(Point2d other) {
        return new Point2d(x - other.x, y - other.y);
    }

    /**
     * Multiply this point by a scalar.
     *
     * @param scalar Scalar multiplier
     * @return New point with scaled coordinates
     */
    public Point2d multiply(double scalar) {
        return new Point2d(x * scalar, y * scalar);
    }

    /**
     * Check that both coordinates are finite.
     *
     * @return True if neither coordinate is NaN or infinite
     */
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point2d other)) return false;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return String.format("Point2d(%s, %s)", x, y);
    }

    /**
     * Convert to array [x, y].
     *
     * @return Array representation
     */
    public double[] toArray() {
        return new double[] { x, y };
    }

    /**
     * Create point from array [x, y].
     *
     * @param array Array with at least 2 elements
     * @return Point from array
     * @throws IllegalArgumentException if array length < 2
     */
    public static Point2d fromArray(double[] array) {
        if (array.length < 2) {
            throw new IllegalArgumentException("Array must have at least 2 elements");
        }
        return new Point2d(array[0], array[1]);
    }
}
