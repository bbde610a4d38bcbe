/*
 * Aria-Snapshot - Accessibility Tree Snapshot Assertions
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
package net.boyechko.aria.snapshot.core;

import ch.qos.logback.classic.Level;

/**
 * How much diagnostic logging a run produces, from least to most verbose.
 *
 * <ul>
 *   <li>QUIET - errors only
 *   <li>NORMAL - warnings such as legacy baseline fallbacks (default)
 *   <li>VERBOSE - baselines written
 *   <li>DEBUG - parser, matcher and regexifier details
 * </ul>
 */
public enum VerbosityLevel {
    QUIET(Level.ERROR),
    NORMAL(Level.WARN),
    VERBOSE(Level.INFO),
    DEBUG(Level.DEBUG);

    private final Level logLevel;

    VerbosityLevel(Level logLevel) {
        this.logLevel = logLevel;
    }

    /** Returns the root logger level for this verbosity. */
    public Level logLevel() {
        return logLevel;
    }
}
