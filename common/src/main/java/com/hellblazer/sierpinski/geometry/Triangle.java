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

import java.util.List;
import java.util.Objects;

/**
 * Immutable triangle defined by three vertices in no particular order.
 *
 * <p>Triangles built with {@link #equilateral(double)} or {@link #validated(Point2d, Point2d, Point2d)} are
 * guaranteed to enclose a positive area. {@link #of(Point2d, Point2d, Point2d)} performs no such check; callers
 * that supply arbitrary points are responsible for non-collinearity.
 *
 * @author hal.hildebrand
 */
public final class Triangle {

    /** Relative tolerance used when deciding whether three points are collinear */
    public static final double COLLINEAR_TOLERANCE = 1e-12;

    private static final double SQRT_3 = Math.sqrt(3.0);

    /** First vertex */
    public final Point2d a;

    /** Second vertex */
    public final Point2d b;

    /** Third vertex */
    public final Point2d c;

    private Triangle(Point2d a, Point2d b, Point2d c) {
        this.a = Objects.requireNonNull(a, "a must not be null");
        this.b = Objects.requireNonNull(b, "b must not be null");
        this.c = Objects.requireNonNull(c, "c must not be null");
    }

    /**
     * Create an equilateral triangle anchored at the origin with vertices (0, 0), (side, 0) and
     * (side / 2, side * sqrt(3) / 2).
     *
     * @param sideLength Length of each side
     * @return Equilateral triangle
     * @throws DegenerateGeometryException if the side length is not a strictly positive finite number
     */
    public static Triangle equilateral(double sideLength) throws DegenerateGeometryException {
        if (!(sideLength > 0.0) || Double.isInfinite(sideLength)) {
            throw new DegenerateGeometryException("Side length must be strictly positive and finite: " + sideLength);
        }
        return new Triangle(Point2d.origin(), new Point2d(sideLength, 0.0),
                            new Point2d(sideLength / 2.0, sideLength * SQRT_3 / 2.0));
    }

    /**
     * Create a triangle directly from three points. No collinearity check is performed.
     *
     * @param a First vertex
     * @param b Second vertex
     * @param c Third vertex
     * @return Triangle over the given points
     */
    public static Triangle of(Point2d a, Point2d b, Point2d c) {
        return new Triangle(a, b, c);
    }

    /**
     * Create a triangle from three points, rejecting collinear or non-finite input.
     *
     * @param a First vertex
     * @param b Second vertex
     * @param c Third vertex
     * @return Non-degenerate triangle over the given points
     * @throws DegenerateGeometryException if the points are collinear or not finite
     */
    public static Triangle validated(Point2d a, Point2d b, Point2d c) throws DegenerateGeometryException {
        var triangle = new Triangle(a, b, c);
        if (!a.isFinite() || !b.isFinite() || !c.isFinite()) {
            throw new DegenerateGeometryException("Triangle vertices must be finite: " + triangle);
        }
        if (triangle.isDegenerate()) {
            throw new DegenerateGeometryException("Triangle vertices are collinear: " + triangle);
        }
        return triangle;
    }

    /**
     * Twice the signed area; positive when the vertices run counter-clockwise.
     *
     * @return Signed doubled area
     */
    public double signedDoubleArea() {
        return (b.x - a.x) * (c.y - a.y) - (c.x - a.x) * (b.y - a.y);
    }

    /**
     * Absolute area of the triangle.
     *
     * @return Area
     */
    public double area() {
        return Math.abs(signedDoubleArea()) / 2.0;
    }

    /**
     * Check whether the vertices are collinear, relative to the triangle's extent.
     *
     * @return True if the triangle encloses no area
     */
    public boolean isDegenerate() {
        var extent = Math.max(maxX() - minX(), maxY() - minY());
        return extent == 0.0 || Math.abs(signedDoubleArea()) <= COLLINEAR_TOLERANCE * extent * extent;
    }

    /**
     * Barycentric weights of a point with respect to (a, b, c). The weights sum to one; all are non-negative exactly
     * when the point lies in the triangle.
     *
     * @param p Point to express
     * @return Weights {wa, wb, wc}
     * @throws IllegalStateException if the triangle is degenerate
     */
    public double[] barycentric(Point2d p) {
        var area2 = signedDoubleArea();
        if (area2 == 0.0) {
            throw new IllegalStateException("Barycentric coordinates are undefined for a degenerate triangle");
        }
        var wa = ((b.x - p.x) * (c.y - p.y) - (c.x - p.x) * (b.y - p.y)) / area2;
        var wb = ((c.x - p.x) * (a.y - p.y) - (a.x - p.x) * (c.y - p.y)) / area2;
        return new double[] { wa, wb, 1.0 - wa - wb };
    }

    /**
     * Convex hull membership test, boundary included.
     *
     * @param p         Point to test
     * @param tolerance Slack allowed on each barycentric weight
     * @return True if the point lies inside or on the triangle
     */
    public boolean contains(Point2d p, double tolerance) {
        for (var w : barycentric(p)) {
            if (w < -tolerance) {
                return false;
            }
        }
        return true;
    }

    /**
     * Get a vertex by index.
     *
     * @param index 0 for a, 1 for b, 2 for c
     * @return The vertex
     * @throws IndexOutOfBoundsException if index is not 0, 1 or 2
     */
    public Point2d vertex(int index) {
        return switch (index) {
            case 0 -> a;
            case 1 -> b;
            case 2 -> c;
            default -> throw new IndexOutOfBoundsException("Triangle vertex index must be 0-2: " + index);
        };
    }

    /**
     * @return The vertices in (a, b, c) order
     */
    public List<Point2d> vertices() {
        return List.of(a, b, c);
    }

    public double minX() {
        return Math.min(a.x, Math.min(b.x, c.x));
    }

    public double minY() {
        return Math.min(a.y, Math.min(b.y, c.y));
    }

    public double maxX() {
        return Math.max(a.x, Math.max(b.x, c.x));
    }

    public double maxY() {
        return Math.max(a.y, Math.max(b.y, c.y));
    }

    /**
     * Check whether the bounding box of this triangle lies within the closed box [0, width] x [0, height]. Only the
     * right and bottom edges of that box floor outside the raster, and a chaos game started strictly inside the
     * triangle never lands on them.
     *
     * @param width  Raster width in pixels
     * @param height Raster height in pixels
     * @return True if the triangle is covered by the raster
     */
    public boolean fitsWithin(int width, int height) {
        return minX() >= 0.0 && minY() >= 0.0 && maxX() <= width && maxY() <= height;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Triangle other)) return false;
        return a.equals(other.a) && b.equals(other.b) && c.equals(other.c);
    }

    @Override
    public int hashCode() {
        return Objects.hash(a, b, c);
    }

    @Override
    public String toString() {
        return String.format("Triangle[%s, %s, %s]", a, b, c);
    }
}
