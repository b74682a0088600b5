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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link RenderProfile}s from JSON.
 *
 * <p>Profiles come from:
 * <ol>
 *   <li>A user supplied file (--profile)</li>
 *   <li>The bundled default profile (sierpinski-default-profile.json)</li>
 * </ol>
 *
 * @author hal.hildebrand
 */
public class RenderProfileLoader {
    private static final Logger log = LoggerFactory.getLogger(RenderProfileLoader.class);
    public static final String DEFAULT_PROFILE_RESOURCE = "/sierpinski-default-profile.json";

    private final ObjectMapper objectMapper;

    public RenderProfileLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load the bundled default profile, or an empty profile if it is not on the classpath.
     *
     * @return Default profile
     * @throws IOException if the resource exists but cannot be parsed
     */
    public RenderProfile loadDefault() throws IOException {
        try (InputStream is = getClass().getResourceAsStream(DEFAULT_PROFILE_RESOURCE)) {
            if (is == null) {
                log.warn("Default render profile not found: {}", DEFAULT_PROFILE_RESOURCE);
                return RenderProfile.empty();
            }
            var profile = objectMapper.readValue(is, RenderProfile.class);
            log.debug("Loaded default render profile: {}", DEFAULT_PROFILE_RESOURCE);
            return profile;
        }
    }

    /**
     * Load a profile from a JSON file.
     *
     * @param path Profile file
     * @return Parsed profile
     * @throws IOException if the file is missing, unreadable or not a valid profile
     */
    public RenderProfile load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Render profile does not exist: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            var profile = objectMapper.readValue(is, RenderProfile.class);
            log.info("Loaded render profile: {}", path);
            return profile;
        }
    }

    /**
     * Parse a profile from a JSON string.
     *
     * @param json Profile document
     * @return Parsed profile
     * @throws IOException if the document is not a valid profile
     */
    public RenderProfile parse(String json) throws IOException {
        return objectMapper.readValue(json, RenderProfile.class);
    }
}
