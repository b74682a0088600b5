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
package com.hellblazer.sierpinski.canvas;

/**
 * A raster of single-color pixels written by the chaos game.
 *
 * <p>Every pixel is either background or foreground. Writes are idempotent, so plotting the same pixel twice is the
 * same as plotting it once. A canvas has exactly one writer during a render.
 *
 * @author hal.hildebrand
 */
public interface Canvas {

    /**
     * @return Width in pixels
     */
    int width();

    /**
     * @return Height in pixels
     */
    int height();

    /**
     * Set a pixel to the foreground value.
     *
     * @param x Column, 0 based
     * @param y Row, 0 based
     * @throws PixelOutOfBoundsException if (x, y) lies outside [0, width) x [0, height); the canvas is left unchanged
     */
    void plot(int x, int y) throws PixelOutOfBoundsException;

    /**
     * @param x Column, 0 based
     * @param y Row, 0 based
     * @return True if the pixel has been plotted
     * @throws IndexOutOfBoundsException if (x, y) lies outside the canvas
     */
    boolean isSet(int x, int y);

    /**
     * @param x Column
     * @param y Row
     * @return True if (x, y) addresses a pixel of this canvas
     */
    default boolean inBounds(int x, int y) {
        return x >= 0 && x < width() && y >= 0 && y < height();
    }
}
