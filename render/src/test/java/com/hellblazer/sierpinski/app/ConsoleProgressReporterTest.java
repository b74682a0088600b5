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
package com.hellblazer.sierpinski.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConsoleProgressReporter.
 *
 * @author hal.hildebrand
 */
class ConsoleProgressReporterTest {

    @Test
    void testRenderEmptyBar() {
        var line = ConsoleProgressReporter.render(0, 1000, 0);

        assertTrue(line.startsWith("[00:00:00] [>"), line);
        assertTrue(line.contains("   0/1000"), line);
    }

    @Test
    void testRenderHalfBar() {
        var line = ConsoleProgressReporter.render(500, 1000, 2_000_000_000L);

        assertTrue(line.startsWith("[00:00:02] "), line);
        assertTrue(line.contains("[" + "#".repeat(20) + ">" + "-".repeat(19) + "]"), line);
        assertTrue(line.contains(" 500/1000"), line);
    }

    @Test
    void testRenderFullBar() {
        var line = ConsoleProgressReporter.render(1000, 1000, 3_725_000_000_000L);

        assertTrue(line.startsWith("[01:02:05] "), line);
        assertTrue(line.contains("[" + "#".repeat(40) + "]"), line);
        assertTrue(line.contains("1000/1000"), line);
    }

    @Test
    void testRenderZeroTotal() {
        var line = ConsoleProgressReporter.render(0, 0, 0);
        assertTrue(line.contains("[" + "#".repeat(40) + "]"), line);
        assertTrue(line.contains("0/0"), line);
    }

    @Test
    void testRedrawIsThrottledAndCompletionPrinted() {
        var clock = new AtomicLong();
        var baos = new ByteArrayOutputStream();
        var reporter = new ConsoleProgressReporter(new PrintStream(baos), clock::get);

        reporter.onProgress(10, 100);
        clock.set(50_000_000L);
        reporter.onProgress(20, 100);
        clock.set(150_000_000L);
        reporter.onProgress(30, 100);
        clock.set(160_000_000L);
        reporter.onProgress(100, 100);
        reporter.onProgress(100, 100);

        var output = baos.toString();
        assertEquals(3, output.chars().filter(ch -> ch == '\r').count(), output);
        assertFalse(output.contains(" 20/100"), output);
        assertTrue(output.contains(" 30/100"), output);
        assertTrue(output.contains("100/100"), output);
        assertEquals(1, output.split("Finished in", -1).length - 1, output);
    }
}
