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
package com.hellblazer.sierpinski.chaos;

/**
 * Receives iteration progress from a {@link ChaosGame}.
 *
 * <p>Notifications are delivered synchronously on the rendering thread and never influence the pixel stream.
 * Exceptions thrown by a listener are caught and logged by the game.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * Called after a transition has been applied.
     *
     * @param completed Transitions applied so far
     * @param total     Transitions configured for the run
     */
    void onProgress(long completed, long total);
}
