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

import com.hellblazer.sierpinski.config.RenderProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser and entry point for rendering Sierpinski triangles.
 *
 * @author hal.hildebrand
 */
public class SierpinskiCommandLine {
    private static final Logger log = LoggerFactory.getLogger(SierpinskiCommandLine.class);

    /**
     * Configuration holder for all command-line options. Unset options are null and fall back to the render profile.
     */
    public static class Config {
        // Canvas
        public Integer size;
        public Integer width;
        public Integer height;

        // Chaos game
        public Long       iterations;
        public Long       seed;
        public Double     sideLength;
        public double[][] vertices;
        public Long       progressInterval;

        // Files
        public String profileFile;
        public String outputDirectory = "./";

        // General options
        public boolean quiet = false;
        public boolean help  = false;

        final List<String> parseErrors = new ArrayList<>();

        public List<String> getValidationErrors() {
            var errors = new ArrayList<>(parseErrors);

            if (profileFile == null && size == null && (width == null || height == null)) {
                errors.add("Canvas size required: use --size, or --width and --height");
            }
            if (profileFile != null && !Files.isRegularFile(Path.of(profileFile))) {
                errors.add("Profile file does not exist: " + profileFile);
            }
            if (size != null && size <= 0) {
                errors.add("Size must be positive");
            }
            if (width != null && width <= 0) {
                errors.add("Width must be positive");
            }
            if (height != null && height <= 0) {
                errors.add("Height must be positive");
            }
            if (iterations != null && iterations < 0) {
                errors.add("Quality (iterations) must not be negative");
            }
            if (progressInterval != null && progressInterval <= 0) {
                errors.add("Progress interval must be positive");
            }
            if (sideLength != null && vertices != null) {
                errors.add("Use either --side or --vertices, not both");
            }

            return errors;
        }

        /**
         * @return The options given on the command line, as a profile to layer over the loaded one
         */
        public RenderProfile toOverrides() {
            return new RenderProfile(width, height, size, iterations, seed, sideLength, vertices, progressInterval);
        }

        @Override
        public String toString() {
            return String.format("Config{size=%s, width=%s, height=%s, quality=%s, seed=%s, profile=%s, output=%s}",
                                 size, width, height, iterations, seed, profileFile, outputDirectory);
        }
    }

    /**
     * Parse command-line arguments into configuration.
     */
    public static Config parse(String[] args) {
        var config = new Config();

        if (args.length == 0) {
            config.help = true;
            return config;
        }

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];

            switch (arg) {
                case "-s", "--size" -> config.size = parseInt(config, arg, value(args, ++i));
                case "-w", "--width" -> config.width = parseInt(config, arg, value(args, ++i));
                case "-h", "--height" -> config.height = parseInt(config, arg, value(args, ++i));
                case "-q", "--quality" -> config.iterations = parseLong(config, arg, value(args, ++i));
                case "-d", "--output-directory" -> config.outputDirectory = value(args, ++i);
                case "--seed" -> config.seed = parseLong(config, arg, value(args, ++i));
                case "--side" -> config.sideLength = parseDouble(config, arg, value(args, ++i));
                case "--vertices" -> config.vertices = parseVertices(config, value(args, ++i));
                case "--profile" -> config.profileFile = value(args, ++i);
                case "--progress-interval" -> config.progressInterval = parseLong(config, arg, value(args, ++i));
                case "--quiet" -> config.quiet = true;
                case "--help" -> config.help = true;
                default -> {
                    if (arg.startsWith("-")) {
                        log.warn("Unknown option: {}", arg);
                    } else {
                        log.warn("Ignoring unexpected argument: {}", arg);
                    }
                }
            }
        }

        return config;
    }

    private static String value(String[] args, int i) {
        return i < args.length ? args[i] : null;
    }

    private static Integer parseInt(Config config, String option, String value) {
        if (value == null) {
            config.parseErrors.add("Missing value for " + option);
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid integer for " + option + ": " + value);
            return null;
        }
    }

    private static Long parseLong(Config config, String option, String value) {
        if (value == null) {
            config.parseErrors.add("Missing value for " + option);
            return null;
        }
        try {
            return Long.parseLong(value.replace("_", ""));
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid integer for " + option + ": " + value);
            return null;
        }
    }

    private static Double parseDouble(Config config, String option, String value) {
        if (value == null) {
            config.parseErrors.add("Missing value for " + option);
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid number for " + option + ": " + value);
            return null;
        }
    }

    /**
     * Parse "x1,y1,x2,y2,x3,y3" into three [x, y] pairs.
     */
    private static double[][] parseVertices(Config config, String value) {
        if (value == null) {
            config.parseErrors.add("Missing value for --vertices");
            return null;
        }
        var parts = value.split(",");
        if (parts.length != 6) {
            config.parseErrors.add("--vertices expects x1,y1,x2,y2,x3,y3: " + value);
            return null;
        }
        var vertices = new double[3][2];
        try {
            for (int k = 0; k < 6; k++) {
                vertices[k / 2][k % 2] = Double.parseDouble(parts[k].trim());
            }
        } catch (NumberFormatException e) {
            config.parseErrors.add("Invalid number in --vertices: " + value);
            return null;
        }
        return vertices;
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("sierpinski - Render a Sierpinski triangle with the chaos game");
        out.println();
        out.println("Usage: sierpinski (--size <n> | --width <n> --height <n>) [options]");
        out.println();
        out.println("Canvas Options:");
        out.println("  -s, --size <n>                 Square canvas size in pixels");
        out.println("  -w, --width <n>                Canvas width in pixels");
        out.println("  -h, --height <n>               Canvas height in pixels");
        out.println();
        out.println("Render Options:");
        out.println("  -q, --quality <n>              Number of iterations (default: 4000000)");
        out.println("  --seed <n>                     Random seed for reproducible output");
        out.println("  --side <length>                Equilateral side length (default: min(width, height))");
        out.println("  --vertices x1,y1,x2,y2,x3,y3   Explicit triangle vertices");
        out.println("  --progress-interval <n>        Iterations between progress updates (default: 10000)");
        out.println("  --profile <file>               JSON render profile; command-line options override it");
        out.println();
        out.println("Output Options:");
        out.println("  -d, --output-directory <dir>   Directory for the PNG file (default: ./)");
        out.println("  --quiet                        Suppress progress output");
        out.println("  --help                         Show this help message");
        out.println();
        out.println("Examples:");
        out.println("  sierpinski --size 1000");
        out.println("  sierpinski -w 1920 -h 1080 -q 10000000 -d renders");
        out.println("  sierpinski -s 512 --seed 42 --vertices 0,0,511,0,256,400");
    }

    /**
     * Validate configuration and print any errors.
     */
    public static boolean validate(Config config, PrintStream out) {
        var errors = config.getValidationErrors();
        if (!errors.isEmpty()) {
            out.println("Configuration errors:");
            for (var error : errors) {
                out.println("  - " + error);
            }
            out.println();
            out.println("Use 'sierpinski --help' for usage information.");
            return false;
        }
        return true;
    }

    /**
     * Main entry point for CLI.
     */
    public static void main(String[] args) {
        var config = parse(args);

        if (config.help) {
            printUsage(System.out);
            return;
        }

        if (!validate(config, System.err)) {
            System.exit(1);
        }

        log.debug("Configuration: {}", config);

        try {
            System.exit(SierpinskiRenderMode.run(config));
        } catch (Exception e) {
            log.error("Error rendering Sierpinski triangle: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
