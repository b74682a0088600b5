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

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;

import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Point2d Property-Based Tests")
class Point2dPropertyTest {

    @Property
    @Label("Addition is commutative")
    void additionIsCommutative(@ForAll("points") Point2d a, @ForAll("points") Point2d b) {
        assertPointsEqual(a.add(b), b.add(a), 1e-10);
    }

    @Property
    @Label("Subtraction is inverse of addition")
    void subtractionIsInverseOfAddition(@ForAll("points") Point2d a, @ForAll("points") Point2d b) {
        assertPointsEqual(a, a.add(b).subtract(b), 1e-10);
    }

    @Property
    @Label("Scalar multiplication is distributive")
    void scalarMultiplicationIsDistributive(
        @ForAll("points") Point2d a,
        @ForAll("points") Point2d b,
        @ForAll @DoubleRange(min = -10.0, max = 10.0) double scalar
    ) {
        var result1 = a.add(b).multiply(scalar);
        var result2 = a.multiply(scalar).add(b.multiply(scalar));

        assertPointsEqual(result1, result2, 1e-9);
    }

    @Property
    @Label("Midpoint of two points lies within the triangle they span with a third")
    void midpointStaysInTriangle(@ForAll("vertices") Point2d v, @ForAll @DoubleRange(min = 0.0, max = 1.0) double u) {
        var triangle = Triangle.of(new Point2d(0, 0), new Point2d(100, 0), new Point2d(50, 80));
        var inside = triangle.a.add(triangle.b.subtract(triangle.a).multiply(u));
        var midpoint = inside.add(v).multiply(0.5);

        assertTrue(triangle.contains(midpoint, 1e-9), () -> midpoint + " escaped " + triangle);
    }

    @Provide
    Arbitrary<Point2d> points() {
        return Arbitraries.doubles()
            .between(-100.0, 100.0)
            .array(double[].class)
            .ofSize(2)
            .map(Point2d::fromArray);
    }

    @Provide
    Arbitrary<Point2d> vertices() {
        return Arbitraries.of(new Point2d(0, 0), new Point2d(100, 0), new Point2d(50, 80));
    }

    private void assertPointsEqual(Point2d expected, Point2d actual, double delta) {
        assertEquals(expected.x, actual.x, delta, "x differs");
        assertEquals(expected.y, actual.y, delta, "y differs");
    }
}
