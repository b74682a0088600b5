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

import com.hellblazer.sierpinski.chaos.ProgressListener;

import java.io.PrintStream;
import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Single-line console progress bar for a chaos game run:
 * {@code [00:00:03] [#########>----------]  1800000/4000000 (3.7s)}.
 *
 * <p>The line is redrawn in place with a carriage return, at most once per refresh period and once at completion.
 *
 * @author hal.hildebrand
 */
public class ConsoleProgressReporter implements ProgressListener {

    private static final int  BAR_WIDTH     = 40;
    private static final long REFRESH_NANOS = 100_000_000L;

    private final PrintStream  out;
    private final LongSupplier nanoClock;
    private final long         startNanos;

    private long    lastDrawNanos = Long.MIN_VALUE;
    private boolean finished;

    public ConsoleProgressReporter(PrintStream out) {
        this(out, System::nanoTime);
    }

    /**
     * @param out       Console stream
     * @param nanoClock Monotonic time source in nanoseconds
     */
    public ConsoleProgressReporter(PrintStream out, LongSupplier nanoClock) {
        this.out = out;
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
    }

    @Override
    public void onProgress(long completed, long total) {
        if (finished) {
            return;
        }
        var now = nanoClock.getAsLong();
        var done = completed >= total;
        if (!done && lastDrawNanos != Long.MIN_VALUE && now - lastDrawNanos < REFRESH_NANOS) {
            return;
        }
        lastDrawNanos = now;
        out.print("\r" + render(completed, total, now - startNanos));
        if (done) {
            out.println();
            out.printf("Finished in %s.%n", formatElapsed(now - startNanos));
            finished = true;
        }
        out.flush();
    }

    /**
     * Format one progress line.
     *
     * @param completed    Transitions done
     * @param total        Transitions configured
     * @param elapsedNanos Time since the reporter was created
     * @return Progress line without line terminator
     */
    static String render(long completed, long total, long elapsedNanos) {
        var fraction = total == 0 ? 1.0 : Math.min(1.0, (double) completed / total);
        var filled = (int) (fraction * BAR_WIDTH);
        var bar = new StringBuilder(BAR_WIDTH);
        bar.append("#".repeat(filled));
        if (filled < BAR_WIDTH) {
            bar.append('>');
            bar.append("-".repeat(BAR_WIDTH - filled - 1));
        }
        var eta = fraction <= 0.0 ? 0.0 : elapsedNanos * (1.0 - fraction) / fraction / 1e9;
        var width = Long.toString(total).length();
        return String.format("[%s] [%s] %" + width + "d/%d (%.1fs)", formatClock(elapsedNanos), bar, completed, total,
                             eta);
    }

    private static String formatClock(long nanos) {
        var d = Duration.ofNanos(nanos);
        return String.format("%02d:%02d:%02d", d.toHours(), d.toMinutesPart(), d.toSecondsPart());
    }

    private static String formatElapsed(long nanos) {
        return String.format("%.3fs", nanos / 1e9);
    }
}
