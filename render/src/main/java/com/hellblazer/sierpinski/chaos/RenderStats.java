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

import java.time.Duration;

/**
 * Summary of a chaos game run.
 *
 * @param iterations Transitions applied
 * @param plotted    Pixel writes accepted by the canvas
 * @param skipped    Pixel writes rejected as out of bounds
 * @param elapsed    Wall time spent iterating
 *
 * @author hal.hildebrand
 */
public record RenderStats(long iterations, long plotted, long skipped, Duration elapsed) {

    /**
     * @return Throughput over the elapsed time, zero when no time was measured
     */
    public double iterationsPerSecond() {
        var nanos = elapsed.toNanos();
        return nanos == 0 ? 0.0 : iterations * 1_000_000_000.0 / nanos;
    }

    @Override
    public String toString() {
        return String.format("RenderStats{iterations=%d, plotted=%d, skipped=%d, elapsed=%d ms}", iterations,
                             plotted, skipped, elapsed.toMillis());
    }
}
