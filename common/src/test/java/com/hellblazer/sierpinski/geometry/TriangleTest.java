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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Triangle construction and queries.
 *
 * @author hal.hildebrand
 */
class TriangleTest {

    @Test
    @DisplayName("Equilateral triangle has the documented vertices")
    void testEquilateralVertices() throws DegenerateGeometryException {
        var triangle = Triangle.equilateral(100);

        assertEquals(new Point2d(0, 0), triangle.a);
        assertEquals(new Point2d(100, 0), triangle.b);
        assertEquals(50.0, triangle.c.x, 1e-12);
        assertEquals(86.60254037844386, triangle.c.y, 1e-9);
        assertFalse(triangle.isDegenerate());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, -1.0, -0.0001, Double.NaN, Double.POSITIVE_INFINITY })
    void testEquilateralRejectsInvalidSide(double side) {
        var e = assertThrows(DegenerateGeometryException.class, () -> Triangle.equilateral(side));
        assertTrue(e.getMessage().contains("Side length"));
    }

    @Test
    void testCollinearPointsAreRejected() {
        assertThrows(DegenerateGeometryException.class,
                     () -> Triangle.validated(new Point2d(0, 0), new Point2d(1, 1), new Point2d(2, 2)));
    }

    @Test
    void testCoincidentPointsAreRejected() {
        var p = new Point2d(3, 4);
        assertThrows(DegenerateGeometryException.class, () -> Triangle.validated(p, p, p));
    }

    @Test
    void testNonFinitePointsAreRejected() {
        assertThrows(DegenerateGeometryException.class,
                     () -> Triangle.validated(new Point2d(0, 0), new Point2d(Double.NaN, 1), new Point2d(2, 0)));
    }

    @Test
    void testDirectConstructionSkipsCheck() {
        var triangle = Triangle.of(new Point2d(0, 0), new Point2d(1, 1), new Point2d(2, 2));
        assertTrue(triangle.isDegenerate());
    }

    @Test
    void testValidatedKeepsOrder() throws DegenerateGeometryException {
        var a = new Point2d(5, 5);
        var b = new Point2d(1, 9);
        var c = new Point2d(8, 2);
        var triangle = Triangle.validated(a, b, c);

        assertEquals(a, triangle.vertex(0));
        assertEquals(b, triangle.vertex(1));
        assertEquals(c, triangle.vertex(2));
        assertEquals(List.of(a, b, c), triangle.vertices());
        assertThrows(IndexOutOfBoundsException.class, () -> triangle.vertex(3));
    }

    @Test
    void testArea() throws DegenerateGeometryException {
        var triangle = Triangle.of(new Point2d(0, 0), new Point2d(4, 0), new Point2d(0, 3));
        assertEquals(6.0, triangle.area(), 1e-12);
        assertEquals(12.0, triangle.signedDoubleArea(), 1e-12);

        var clockwise = Triangle.of(new Point2d(0, 0), new Point2d(0, 3), new Point2d(4, 0));
        assertEquals(-12.0, clockwise.signedDoubleArea(), 1e-12);
        assertEquals(6.0, clockwise.area(), 1e-12);
    }

    @Test
    void testBarycentricOfVertices() {
        var triangle = Triangle.of(new Point2d(0, 0), new Point2d(4, 0), new Point2d(0, 3));

        assertArrayEquals(new double[] { 1, 0, 0 }, triangle.barycentric(triangle.a), 1e-12);
        assertArrayEquals(new double[] { 0, 1, 0 }, triangle.barycentric(triangle.b), 1e-12);
        assertArrayEquals(new double[] { 0, 0, 1 }, triangle.barycentric(triangle.c), 1e-12);
    }

    @Test
    void testBarycentricUndefinedForDegenerate() {
        var triangle = Triangle.of(new Point2d(0, 0), new Point2d(1, 1), new Point2d(2, 2));
        assertThrows(IllegalStateException.class, () -> triangle.barycentric(new Point2d(0, 0)));
    }

    @Test
    void testContains() throws DegenerateGeometryException {
        var triangle = Triangle.equilateral(10);

        assertTrue(triangle.contains(new Point2d(5, 2), 0.0));
        assertTrue(triangle.contains(triangle.c, 1e-12));
        assertTrue(triangle.contains(new Point2d(5, 0), 1e-12));
        assertFalse(triangle.contains(new Point2d(-0.5, 0), 1e-12));
        assertFalse(triangle.contains(new Point2d(5, 9), 1e-12));
        assertFalse(triangle.contains(new Point2d(1, 5), 1e-12));
    }

    @Test
    void testBoundsAndFit() throws DegenerateGeometryException {
        var triangle = Triangle.equilateral(100);

        assertEquals(0.0, triangle.minX());
        assertEquals(0.0, triangle.minY());
        assertEquals(100.0, triangle.maxX());
        assertEquals(86.60254037844386, triangle.maxY(), 1e-9);

        assertTrue(triangle.fitsWithin(101, 87));
        assertTrue(triangle.fitsWithin(100, 100));
        assertTrue(triangle.fitsWithin(100, 87));
        assertFalse(triangle.fitsWithin(99, 100));
        assertFalse(triangle.fitsWithin(101, 86));
        assertFalse(Triangle.of(new Point2d(-1, 0), new Point2d(10, 0), new Point2d(5, 8)).fitsWithin(20, 20));
    }

    @Test
    void testEquality() throws DegenerateGeometryException {
        assertEquals(Triangle.equilateral(3), Triangle.equilateral(3));
        assertEquals(Triangle.equilateral(3).hashCode(), Triangle.equilateral(3).hashCode());
        assertNotEquals(Triangle.equilateral(3), Triangle.equilateral(4));
    }
}
