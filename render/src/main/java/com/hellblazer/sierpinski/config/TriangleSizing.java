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

/**
 * How the triangle of a render is derived from its configuration.
 */
public enum TriangleSizing {
    /** Equilateral triangle anchored at the origin with side min(width, height) */
    FIT_CANVAS,
    /** Equilateral triangle anchored at the origin with an explicit side length */
    SIDE_LENGTH,
    /** Three explicit vertices */
    EXPLICIT
}
