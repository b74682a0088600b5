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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.hellblazer.sierpinski.geometry.Point2d;

import java.util.ArrayList;
import java.util.List;

/**
 * Partial render settings as read from a JSON profile or collected from the command line. Every field is optional;
 * {@link #merge(RenderProfile)} layers one profile over another and {@link #toRenderConfig()} applies defaults.
 *
 * <pre>
 * {
 *   "width": 1024, "height": 768,
 *   "iterations": 4000000,
 *   "seed": 42,
 *   "vertices": [[0, 0], [1000, 0], [500, 760]]
 * }
 * </pre>
 *
 * @param width            Canvas width
 * @param height           Canvas height
 * @param size             Square canvas size, used where width or height is absent
 * @param iterations       Chaos game transitions
 * @param seed             RNG seed
 * @param sideLength       Equilateral side length
 * @param vertices         Three [x, y] pairs
 * @param progressInterval Transitions between progress notifications
 *
 * @author hal.hildebrand
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RenderProfile(Integer width, Integer height, Integer size, Long iterations, Long seed,
                            Double sideLength, double[][] vertices, Long progressInterval) {

    public static RenderProfile empty() {
        return new RenderProfile(null, null, null, null, null, null, null, null);
    }

    /**
     * Layer another profile over this one. Non-null values of {@code overrides} win; a size override replaces any
     * width and height from this profile, and a triangle given one way replaces a triangle given the other way.
     *
     * @param overrides Profile whose values take precedence
     * @return Merged profile
     */
    public RenderProfile merge(RenderProfile overrides) {
        var w = width;
        var h = height;
        var s = size;
        if (overrides.size != null) {
            s = overrides.size;
            w = null;
            h = null;
        }
        if (overrides.width != null) {
            w = overrides.width;
        }
        if (overrides.height != null) {
            h = overrides.height;
        }

        var side = sideLength;
        var points = vertices;
        if (overrides.sideLength != null) {
            side = overrides.sideLength;
            points = null;
        }
        if (overrides.vertices != null) {
            points = overrides.vertices;
            side = null;
        }

        return new RenderProfile(w, h, s, pick(overrides.iterations, iterations), pick(overrides.seed, seed), side,
                                 points, pick(overrides.progressInterval, progressInterval));
    }

    /**
     * Resolve into a complete configuration, applying defaults for iterations and progress interval.
     *
     * @return Validated configuration
     * @throws IllegalArgumentException if the canvas size is missing or any value is out of range
     */
    public RenderConfig toRenderConfig() {
        var w = width != null ? width : size;
        var h = height != null ? height : size;
        if (w == null || h == null) {
            throw new IllegalArgumentException("Canvas size is not configured: set size, or width and height");
        }
        var config = new RenderConfig(w, h, pick(iterations, RenderConfig.DEFAULT_ITERATIONS), seed,
                                      TriangleSizing.FIT_CANVAS, 0.0, List.of(),
                                      pick(progressInterval, RenderConfig.DEFAULT_PROGRESS_INTERVAL));
        if (vertices != null) {
            var points = toPoints(vertices);
            return config.withVertices(points.get(0), points.get(1), points.get(2));
        }
        if (sideLength != null) {
            return config.withSideLength(sideLength);
        }
        return config;
    }

    private static List<Point2d> toPoints(double[][] pairs) {
        if (pairs.length != 3) {
            throw new IllegalArgumentException("Expected 3 vertices, got " + pairs.length);
        }
        var points = new ArrayList<Point2d>(3);
        for (var pair : pairs) {
            if (pair == null || pair.length != 2) {
                throw new IllegalArgumentException("Each vertex must be an [x, y] pair");
            }
            points.add(Point2d.fromArray(pair));
        }
        return points;
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
