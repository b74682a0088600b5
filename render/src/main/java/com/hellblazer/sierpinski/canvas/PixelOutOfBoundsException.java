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

import com.hellblazer.sierpinski.SierpinskiException;

/**
 * Thrown by a {@link Canvas} when a write addresses a pixel outside its bounds. Recoverable: the offending write is
 * skipped and rendering continues.
 */
public final class PixelOutOfBoundsException extends SierpinskiException {

    private final int x;
    private final int y;

    public PixelOutOfBoundsException(int x, int y, int width, int height) {
        super(String.format("Pixel (%d, %d) lies outside %dx%d canvas", x, y, width, height));
        this.x = x;
        this.y = y;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }
}
