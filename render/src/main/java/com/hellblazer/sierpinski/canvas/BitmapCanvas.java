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

import java.util.BitSet;

/**
 * Canvas backed by one bit per pixel, row-major. All pixels start as background.
 *
 * @author hal.hildebrand
 */
public final class BitmapCanvas implements Canvas {

    private final int    width;
    private final int    height;
    private final BitSet pixels;

    /**
     * Create a background-filled canvas.
     *
     * @param width  Width in pixels, positive
     * @param height Height in pixels, positive
     * @throws IllegalArgumentException if either dimension is not positive or the pixel count overflows an int
     */
    public BitmapCanvas(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
            String.format("Canvas dimensions must be positive: %dx%d", width, height));
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(String.format("Canvas too large: %dx%d", width, height));
        }
        this.width = width;
        this.height = height;
        this.pixels = new BitSet(width * height);
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public void plot(int x, int y) throws PixelOutOfBoundsException {
        if (!inBounds(x, y)) {
            throw new PixelOutOfBoundsException(x, y, width, height);
        }
        pixels.set(index(x, y));
    }

    @Override
    public boolean isSet(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException(
            String.format("Pixel (%d, %d) lies outside %dx%d canvas", x, y, width, height));
        }
        return pixels.get(index(x, y));
    }

    /**
     * @return Number of distinct foreground pixels
     */
    public int plottedCount() {
        return pixels.cardinality();
    }

    /**
     * Reset every pixel to background.
     */
    public void clear() {
        pixels.clear();
    }

    private int index(int x, int y) {
        return y * width + x;
    }

    @Override
    public String toString() {
        return String.format("BitmapCanvas{%dx%d, plotted=%d}", width, height, plottedCount());
    }
}
