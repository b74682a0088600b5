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

import com.hellblazer.sierpinski.geometry.Point2d;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RenderProfile parsing, merging and resolution.
 *
 * @author hal.hildebrand
 */
class RenderProfileLoaderTest {

    @TempDir
    Path tempDir;

    private RenderProfileLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RenderProfileLoader();
    }

    @Test
    void testDefaultProfile() throws IOException {
        var profile = loader.loadDefault();

        assertEquals(RenderConfig.DEFAULT_ITERATIONS, profile.iterations());
        assertEquals(RenderConfig.DEFAULT_PROGRESS_INTERVAL, profile.progressInterval());
        assertNull(profile.width());
        assertNull(profile.size());
    }

    @Test
    void testLoadFile() throws IOException {
        var file = tempDir.resolve("profile.json");
        Files.writeString(file, """
            {
              "width": 640,
              "height": 480,
              "iterations": 1234,
              "seed": 42,
              "vertices": [[0, 0], [600, 10], [300, 470]],
              "comment": "unknown properties are ignored"
            }
            """);

        var config = loader.load(file).toRenderConfig();

        assertEquals(640, config.width());
        assertEquals(480, config.height());
        assertEquals(1234, config.iterations());
        assertEquals(42L, config.seed());
        assertEquals(TriangleSizing.EXPLICIT, config.sizing());
        assertEquals(new Point2d(600, 10), config.vertices().get(1));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void testMalformedJson() {
        assertThrows(IOException.class, () -> loader.parse("{ \"width\": "));
        assertThrows(IOException.class, () -> loader.parse("{ \"width\": \"wide\" }"));
    }

    @Test
    void testSizeAppliesToBothDimensions() throws IOException {
        var config = loader.parse("{ \"size\": 300 }").toRenderConfig();

        assertEquals(300, config.width());
        assertEquals(300, config.height());
        assertEquals(RenderConfig.DEFAULT_ITERATIONS, config.iterations());
        assertEquals(TriangleSizing.FIT_CANVAS, config.sizing());
    }

    @Test
    void testMissingCanvasSize() throws IOException {
        var profile = loader.parse("{ \"width\": 300 }");
        assertThrows(IllegalArgumentException.class, profile::toRenderConfig);
    }

    @Test
    void testOverridesWin() throws IOException {
        var base = loader.parse("{ \"width\": 800, \"height\": 600, \"iterations\": 10, \"sideLength\": 50 }");
        var overrides = new RenderProfile(null, null, null, 99L, 5L, null, null, null);

        var config = base.merge(overrides).toRenderConfig();

        assertEquals(800, config.width());
        assertEquals(600, config.height());
        assertEquals(99, config.iterations());
        assertEquals(5L, config.seed());
        assertEquals(TriangleSizing.SIDE_LENGTH, config.sizing());
        assertEquals(50.0, config.sideLength());
    }

    @Test
    void testSizeOverrideReplacesDimensions() throws IOException {
        var base = loader.parse("{ \"width\": 800, \"height\": 600 }");
        var overrides = new RenderProfile(null, null, 256, null, null, null, null, null);

        var config = base.merge(overrides).toRenderConfig();

        assertEquals(256, config.width());
        assertEquals(256, config.height());
    }

    @Test
    void testTriangleOverrideReplacesOtherForm() throws IOException {
        var base = loader.parse("{ \"size\": 100, \"vertices\": [[0, 0], [90, 0], [45, 80]] }");
        var overrides = new RenderProfile(null, null, null, null, null, 40.0, null, null);

        var config = base.merge(overrides).toRenderConfig();

        assertEquals(TriangleSizing.SIDE_LENGTH, config.sizing());
        assertTrue(config.vertices().isEmpty());
    }

    @Test
    void testInvalidVertexShape() throws IOException {
        var twoVertices = loader.parse("{ \"size\": 100, \"vertices\": [[0, 0], [90, 0]] }");
        assertThrows(IllegalArgumentException.class, twoVertices::toRenderConfig);

        var shortPair = loader.parse("{ \"size\": 100, \"vertices\": [[0, 0], [90], [45, 80]] }");
        assertThrows(IllegalArgumentException.class, shortPair::toRenderConfig);
    }
}
