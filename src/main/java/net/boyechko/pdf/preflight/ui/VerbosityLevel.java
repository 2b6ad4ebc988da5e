/*
 * PDF-Preflight - Print-Readiness Analysis for PDF Documents
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.preflight.ui;

import ch.qos.logback.classic.Level;

/**
 * Defines the verbosity levels for output control.
 *
 * <p>Levels (from least to most verbose):
 *
 * <ul>
 *   <li>QUIET - Only the verdict and errors
 *   <li>NORMAL - Full report (default)
 *   <li>VERBOSE - Report plus phase and per-page progress
 *   <li>DEBUG - All information including debug logs
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(0, Level.ERROR),
    NORMAL(1, Level.WARN),
    VERBOSE(2, Level.INFO),
    DEBUG(3, Level.DEBUG);

    private final int level;
    private final Level logLevel;

    VerbosityLevel(int level, Level logLevel) {
        this.level = level;
        this.logLevel = logLevel;
    }

    /** Root logger level matching this verbosity. */
    public Level logLevel() {
        return logLevel;
    }

    public boolean isAtLeast(VerbosityLevel other) {
        return this.level >= other.level;
    }
}
