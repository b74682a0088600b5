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
package com.hellblazer.sierpinski.config;

import com.hellblazer.sierpinski.geometry.DegenerateGeometryException;
import com.hellblazer.sierpinski.geometry.Point2d;
import com.hellblazer.sierpinski.geometry.Triangle;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one render: canvas size, iteration count, seed and triangle sizing.
 *
 * <p>Square and rectangular canvases share this one configuration. With {@link TriangleSizing#FIT_CANVAS} the
 * triangle side is min(width, height), anchored at the origin.
 *
 * @param width            Canvas width in pixels, positive
 * @param height           Canvas height in pixels, positive
 * @param iterations       Number of chaos game transitions, non-negative
 * @param seed             RNG seed, or null to seed from entropy
 * @param sizing           Triangle sizing policy
 * @param sideLength       Side length, used with {@link TriangleSizing#SIDE_LENGTH}
 * @param vertices         Three vertices, used with {@link TriangleSizing#EXPLICIT}
 * @param progressInterval Transitions between progress notifications, positive
 *
 * @author hal.hildebrand
 */
public record RenderConfig(int width, int height, long iterations, Long seed, TriangleSizing sizing,
                           double sideLength, List<Point2d> vertices, long progressInterval) {

    public static final long DEFAULT_ITERATIONS        = 4_000_000L;
    public static final long DEFAULT_PROGRESS_INTERVAL = 10_000L;

    public RenderConfig {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
            String.format("Canvas dimensions must be positive: %dx%d", width, height));
        }
        if (iterations < 0) {
            throw new IllegalArgumentException("Iterations must be non-negative: " + iterations);
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("Progress interval must be positive: " + progressInterval);
        }
        Objects.requireNonNull(sizing, "sizing must not be null");
        vertices = vertices == null ? List.of() : List.copyOf(vertices);
        if (sizing == TriangleSizing.EXPLICIT && vertices.size() != 3) {
            throw new IllegalArgumentException("Explicit sizing requires exactly 3 vertices, got " + vertices.size());
        }
    }

    /**
     * Square canvas with the triangle fitted to it.
     */
    public static RenderConfig square(int size, long iterations) {
        return canvas(size, size, iterations);
    }

    /**
     * Rectangular canvas with the triangle fitted to min(width, height).
     */
    public static RenderConfig canvas(int width, int height, long iterations) {
        return new RenderConfig(width, height, iterations, null, TriangleSizing.FIT_CANVAS, 0.0, List.of(),
                                DEFAULT_PROGRESS_INTERVAL);
    }

    public RenderConfig withSeed(Long seed) {
        return new RenderConfig(width, height, iterations, seed, sizing, sideLength, vertices, progressInterval);
    }

    public RenderConfig withIterations(long iterations) {
        return new RenderConfig(width, height, iterations, seed, sizing, sideLength, vertices, progressInterval);
    }

    public RenderConfig withSideLength(double sideLength) {
        return new RenderConfig(width, height, iterations, seed, TriangleSizing.SIDE_LENGTH, sideLength, List.of(),
                                progressInterval);
    }

    public RenderConfig withVertices(Point2d a, Point2d b, Point2d c) {
        return new RenderConfig(width, height, iterations, seed, TriangleSizing.EXPLICIT, 0.0, List.of(a, b, c),
                                progressInterval);
    }

    public RenderConfig withProgressInterval(long progressInterval) {
        return new RenderConfig(width, height, iterations, seed, sizing, sideLength, vertices, progressInterval);
    }

    /**
     * Resolve the triangle described by this configuration.
     *
     * @return Non-degenerate triangle
     * @throws DegenerateGeometryException if the side length is not positive or the explicit vertices are collinear
     */
    public Triangle triangle() throws DegenerateGeometryException {
        return switch (sizing) {
            case FIT_CANVAS -> Triangle.equilateral(Math.min(width, height));
            case SIDE_LENGTH -> Triangle.equilateral(sideLength);
            case EXPLICIT -> Triangle.validated(vertices.get(0), vertices.get(1), vertices.get(2));
        };
    }

    @Override
    public String toString() {
        return String.format("RenderConfig{%dx%d, iterations=%d, seed=%s, sizing=%s}", width, height, iterations,
                             seed == null ? "entropy" : seed, sizing);
    }
}
