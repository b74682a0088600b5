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

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Output file naming and output path checks.
 *
 * @author hal.hildebrand
 */
public final class OutputNaming {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("ddHHmmss");

    private OutputNaming() {
    }

    /**
     * Build a file name of the form {@code ddHHmmss_<width>x<height>_<iterations>.png}.
     *
     * @param clock      Source of the timestamp
     * @param width      Canvas width
     * @param height     Canvas height
     * @param iterations Iteration count
     * @return File name without directory
     */
    public static String fileName(Clock clock, int width, int height, long iterations) {
        var timestamp = ZonedDateTime.now(clock).format(TIMESTAMP);
        return String.format("%s_%dx%d_%d.png", timestamp, width, height, iterations);
    }

    /**
     * Check that a file can be created at the given path.
     *
     * @param path Target file
     * @return Error message, or empty if the parent directory exists
     */
    public static Optional<String> checkPath(Path path) {
        var parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return Optional.of("Invalid path: " + path);
        }
        if (!Files.isDirectory(parent)) {
            return Optional.of(String.format("Directory \"%s\" does not exist", parent));
        }
        return Optional.empty();
    }
}
