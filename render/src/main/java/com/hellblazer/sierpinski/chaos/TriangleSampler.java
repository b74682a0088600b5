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
package com.hellblazer.sierpinski.chaos;

import com.hellblazer.sierpinski.geometry.Point2d;
import com.hellblazer.sierpinski.geometry.Triangle;

import java.util.Random;

/**
 * Random sampling over a triangle, driven by an explicit, reseedable generator.
 *
 * <p>Every call consumes the generator, so for a fixed seed and call order the results are fully deterministic.
 * Instances are not thread safe.
 *
 * @author hal.hildebrand
 */
public class TriangleSampler {

    private final Random random;
    private long         seed;

    /**
     * Create a sampler seeded from entropy. The drawn seed is available from {@link #seed()} for replay.
     */
    public TriangleSampler() {
        this(new Random().nextLong());
    }

    public TriangleSampler(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    /**
     * @return The seed this sampler was created with or last reseeded with
     */
    public long seed() {
        return seed;
    }

    /**
     * Restart the random stream from a new seed.
     */
    public void reseed(long seed) {
        this.seed = seed;
        random.setSeed(seed);
    }

    /**
     * Draw barycentric weights (u, v) with u, v >= 0 and u + v <= 1.
     *
     * <p>v is drawn uniformly from [0, 1 - u]. u is drawn as 1 - sqrt(r) so that its density 2(1 - u) compensates
     * for the shrinking range of v, making (u, v) uniform over the simplex.
     *
     * @return {u, v}
     */
    public double[] randomBarycentric() {
        var u = 1.0 - Math.sqrt(random.nextDouble());
        var v = random.nextDouble() * (1.0 - u);
        return new double[] { u, v };
    }

    /**
     * Uniformly distributed point inside the triangle, computed as a + u(b - a) + v(c - a).
     *
     * @param triangle Non-degenerate triangle
     * @return Point within the triangle's convex hull
     */
    public Point2d randomInteriorPoint(Triangle triangle) {
        var uv = randomBarycentric();
        return triangle.a.add(triangle.b.subtract(triangle.a).multiply(uv[0]))
                         .add(triangle.c.subtract(triangle.a).multiply(uv[1]));
    }

    /**
     * One of the three vertices, each with probability 1/3, independent of earlier draws.
     *
     * @param triangle Triangle to choose from
     * @return Selected vertex
     */
    public Point2d randomVertex(Triangle triangle) {
        return triangle.vertex(random.nextInt(3));
    }
}
