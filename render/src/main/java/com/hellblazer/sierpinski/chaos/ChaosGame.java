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

import com.hellblazer.sierpinski.canvas.Canvas;
import com.hellblazer.sierpinski.canvas.PixelOutOfBoundsException;
import com.hellblazer.sierpinski.config.RenderConfig;
import com.hellblazer.sierpinski.geometry.DegenerateGeometryException;
import com.hellblazer.sierpinski.geometry.Point2d;
import com.hellblazer.sierpinski.geometry.Triangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Chaos game over a triangle: starting from a random interior point, repeatedly move halfway toward a randomly chosen
 * vertex and plot the pixel under the new point. The attractor is the Sierpinski triangle.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Construction samples the initial point. It is never plotted.</li>
 *   <li>Each {@link #step()} applies exactly one transition and plots exactly one pixel.</li>
 *   <li>After the configured number of transitions the game is complete and {@link #step()} does nothing.</li>
 * </ol>
 *
 * <p>The current point stays a convex combination of the vertices throughout: the midpoint of a point in the
 * triangle and one of its vertices is again in the triangle. Pixel coordinates are the floor of each component.
 * Writes the canvas rejects as out of bounds are counted and skipped; the run continues.
 *
 * <p>A game is single threaded and owns its sampler; it must not be shared. Stopping early, by no longer calling
 * {@link #step()}, leaves a consistent partially rendered canvas.
 *
 * @author hal.hildebrand
 */
public class ChaosGame {
    private static final Logger log = LoggerFactory.getLogger(ChaosGame.class);

    private final Triangle               triangle;
    private final TriangleSampler        sampler;
    private final Canvas                 canvas;
    private final long                   iterations;
    private final long                   progressInterval;
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    private Point2d current;
    private long    completed;
    private long    plotted;
    private long    skipped;
    private long    elapsedNanos;

    public ChaosGame(Triangle triangle, TriangleSampler sampler, Canvas canvas, long iterations) {
        this(triangle, sampler, canvas, iterations, RenderConfig.DEFAULT_PROGRESS_INTERVAL);
    }

    /**
     * @param triangle         Non-degenerate triangle; its bounding box should lie within the canvas
     * @param sampler          Random source, owned by this game from now on
     * @param canvas           Target raster
     * @param iterations       Transitions to apply, non-negative
     * @param progressInterval Transitions between progress notifications, positive
     */
    public ChaosGame(Triangle triangle, TriangleSampler sampler, Canvas canvas, long iterations,
                     long progressInterval) {
        this.triangle = Objects.requireNonNull(triangle, "triangle must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.canvas = Objects.requireNonNull(canvas, "canvas must not be null");
        if (iterations < 0) {
            throw new IllegalArgumentException("Iterations must be non-negative: " + iterations);
        }
        if (progressInterval <= 0) {
            throw new IllegalArgumentException("Progress interval must be positive: " + progressInterval);
        }
        this.iterations = iterations;
        this.progressInterval = progressInterval;
        this.current = sampler.randomInteriorPoint(triangle);
    }

    /**
     * Create a game for a configuration. The sampler is seeded from the configuration, or from entropy when it has
     * no seed.
     *
     * @param config Render configuration
     * @param canvas Target raster, normally config.width() x config.height()
     * @return Ready game
     * @throws DegenerateGeometryException if the configured triangle is degenerate
     */
    public static ChaosGame create(RenderConfig config, Canvas canvas) throws DegenerateGeometryException {
        var triangle = config.triangle();
        if (!triangle.fitsWithin(canvas.width(), canvas.height())) {
            log.warn("{} extends beyond the {}x{} canvas; pixels outside it will be skipped", triangle,
                     canvas.width(), canvas.height());
        }
        var sampler = config.seed() == null ? new TriangleSampler() : new TriangleSampler(config.seed());
        return new ChaosGame(triangle, sampler, canvas, config.iterations(), config.progressInterval());
    }

    public void addProgressListener(ProgressListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeProgressListener(ProgressListener listener) {
        listeners.remove(listener);
    }

    /**
     * Apply one transition.
     *
     * @return True if a transition was applied, false if the game was already complete
     */
    public boolean step() {
        if (completed >= iterations) {
            return false;
        }
        var vertex = sampler.randomVertex(triangle);
        var next = current.add(vertex).multiply(0.5);
        plot(next);
        current = next;
        completed++;

        if (completed % progressInterval == 0 || completed == iterations) {
            notifyProgress();
        }
        return true;
    }

    /**
     * Apply every remaining transition.
     *
     * @return Statistics for the whole game so far
     */
    public RenderStats run() {
        log.info("Chaos game starting: {} iterations over {}, seed={}", iterations - completed, triangle,
                 sampler.seed());
        if (iterations == 0) {
            notifyProgress();
        }
        var start = System.nanoTime();
        while (!isComplete()) {
            step();
        }
        elapsedNanos += System.nanoTime() - start;
        var stats = stats();
        log.info("Chaos game finished: {}, {} iterations/s", stats, (long) stats.iterationsPerSecond());
        return stats;
    }

    /**
     * @return Counters so far; elapsed time covers {@link #run()} only
     */
    public RenderStats stats() {
        return new RenderStats(completed, plotted, skipped, Duration.ofNanos(elapsedNanos));
    }

    /**
     * Map a point to its pixel by flooring each component.
     */
    public static int toPixel(double coordinate) {
        return (int) Math.floor(coordinate);
    }

    private void plot(Point2d point) {
        var x = toPixel(point.x);
        var y = toPixel(point.y);
        try {
            canvas.plot(x, y);
            plotted++;
        } catch (PixelOutOfBoundsException e) {
            skipped++;
            if (skipped == 1) {
                log.warn("Skipping out of bounds pixel write at iteration {}: {}", completed + 1, e.getMessage());
            } else {
                log.debug("Skipping out of bounds pixel write at iteration {}: {}", completed + 1, e.getMessage());
            }
        }
    }

    private void notifyProgress() {
        for (var listener : listeners) {
            try {
                listener.onProgress(completed, iterations);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed at {}/{}", completed, iterations, e);
            }
        }
    }

    public Triangle getTriangle() {
        return triangle;
    }

    public Canvas getCanvas() {
        return canvas;
    }

    public long getSeed() {
        return sampler.seed();
    }

    /**
     * @return The point reached by the last transition, or the initial interior point before the first
     */
    public Point2d currentPoint() {
        return current;
    }

    public long totalIterations() {
        return iterations;
    }

    public long completedIterations() {
        return completed;
    }

    public long remainingIterations() {
        return iterations - completed;
    }

    public boolean isComplete() {
        return completed >= iterations;
    }
}
