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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Encodes a {@link Canvas} as an RGB PNG image: foreground pixels white, background black.
 *
 * @author hal.hildebrand
 */
public class PngCanvasWriter {
    private static final Logger log = LoggerFactory.getLogger(PngCanvasWriter.class);

    public static final int FOREGROUND_RGB = 0xFFFFFF;
    public static final int BACKGROUND_RGB = 0x000000;

    private final int foreground;
    private final int background;

    public PngCanvasWriter() {
        this(FOREGROUND_RGB, BACKGROUND_RGB);
    }

    /**
     * @param foreground RGB value for plotted pixels
     * @param background RGB value for untouched pixels
     */
    public PngCanvasWriter(int foreground, int background) {
        this.foreground = foreground & 0xFFFFFF;
        this.background = background & 0xFFFFFF;
    }

    /**
     * Rasterize the canvas into an image of the same dimensions.
     *
     * @param canvas Canvas to convert
     * @return TYPE_INT_RGB image
     */
    public BufferedImage toImage(Canvas canvas) {
        var image = new BufferedImage(canvas.width(), canvas.height(), BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < canvas.height(); y++) {
            for (int x = 0; x < canvas.width(); x++) {
                image.setRGB(x, y, canvas.isSet(x, y) ? foreground : background);
            }
        }
        return image;
    }

    /**
     * Write the canvas as a PNG file.
     *
     * @param canvas     Canvas to encode
     * @param outputPath Target file; its parent directory must exist
     * @throws IOException if no PNG writer is available or the file cannot be written
     */
    public void write(Canvas canvas, Path outputPath) throws IOException {
        var image = toImage(canvas);
        if (!ImageIO.write(image, "png", outputPath.toFile())) {
            throw new IOException("No PNG image writer available");
        }
        log.info("PNG saved: {} ({}x{}, {} bytes)", outputPath, canvas.width(), canvas.height(),
                 outputPath.toFile().length());
    }
}
