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

import com.hellblazer.sierpinski.canvas.BitmapCanvas;
import com.hellblazer.sierpinski.canvas.PngCanvasWriter;
import com.hellblazer.sierpinski.chaos.ChaosGame;
import com.hellblazer.sierpinski.config.RenderConfig;
import com.hellblazer.sierpinski.config.RenderProfileLoader;
import com.hellblazer.sierpinski.geometry.DegenerateGeometryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Renders one fractal to a PNG file.
 *
 * <p>Phases:
 * <ol>
 *   <li>Resolve the render configuration from profile and command line</li>
 *   <li>Check the output path</li>
 *   <li>[1/3] Generate the fractal</li>
 *   <li>[2/3] Save the PNG</li>
 *   <li>[3/3] Report the saved path</li>
 * </ol>
 *
 * @author hal.hildebrand
 */
public class SierpinskiRenderMode {
    private static final Logger log = LoggerFactory.getLogger(SierpinskiRenderMode.class);

    private final SierpinskiCommandLine.Config config;
    private final PrintStream                  out;
    private final PrintStream                  err;
    private final Clock                        clock;
    private final RenderProfileLoader          profileLoader;
    private final PngCanvasWriter              writer;

    public SierpinskiRenderMode(SierpinskiCommandLine.Config config) {
        this(config, System.out, System.err, Clock.systemUTC());
    }

    public SierpinskiRenderMode(SierpinskiCommandLine.Config config, PrintStream out, PrintStream err, Clock clock) {
        this.config = config;
        this.out = out;
        this.err = err;
        this.clock = clock;
        this.profileLoader = new RenderProfileLoader();
        this.writer = new PngCanvasWriter();
    }

    /**
     * Run render mode.
     */
    public static int run(SierpinskiCommandLine.Config config) {
        return new SierpinskiRenderMode(config).execute();
    }

    /**
     * Execute the render.
     *
     * @return Process exit status, 0 on success
     */
    public int execute() {
        RenderConfig renderConfig;
        try {
            renderConfig = resolveConfig();
        } catch (IOException | IllegalArgumentException e) {
            error(e.getMessage());
            return 1;
        }
        log.info("Render configuration: {}", renderConfig);

        var outputPath = outputPath(renderConfig);
        var pathError = OutputNaming.checkPath(outputPath);
        if (pathError.isPresent()) {
            error(pathError.get());
            return 1;
        }

        var canvas = new BitmapCanvas(renderConfig.width(), renderConfig.height());
        ChaosGame game;
        try {
            game = ChaosGame.create(renderConfig, canvas);
        } catch (DegenerateGeometryException e) {
            error(e.getMessage());
            return 1;
        }

        stage(1, "Generating fractal... (seed " + game.getSeed() + ")");
        if (!config.quiet) {
            game.addProgressListener(new ConsoleProgressReporter(out));
        }
        var stats = game.run();
        if (stats.skipped() > 0) {
            log.warn("{} of {} pixel writes fell outside the canvas", stats.skipped(), stats.iterations());
        }

        stage(2, "Saving file...");
        try {
            writer.write(canvas, outputPath);
        } catch (IOException e) {
            log.error("Failed to save {}", outputPath, e);
            error("An error occurred while trying to save the file: " + e.getMessage());
            return 1;
        }

        stage(3, "Saved to: " + outputPath);
        return 0;
    }

    /**
     * Load the profile (file or bundled default) and layer the command-line options over it.
     */
    RenderConfig resolveConfig() throws IOException {
        var base = config.profileFile != null ? profileLoader.load(Path.of(config.profileFile))
                                              : profileLoader.loadDefault();
        return base.merge(config.toOverrides()).toRenderConfig();
    }

    Path outputPath(RenderConfig renderConfig) {
        var fileName = OutputNaming.fileName(clock, renderConfig.width(), renderConfig.height(),
                                             renderConfig.iterations());
        return Path.of(config.outputDirectory).resolve(fileName);
    }

    private void stage(int step, String message) {
        if (config.quiet) return;
        out.printf("[%d/3] %s%n", step, message);
    }

    private void error(String message) {
        err.println("error: " + message);
    }
}
