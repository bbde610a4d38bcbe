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

import java.util.Optional;

/** Named storage for expected templates. */
public interface BaselineStore {

    /** Returns the stored template text, or empty when no baseline exists under {@code name}. */
    Optional<String> read(String name);

    void write(String name, String content);

    /** Returns a human-readable location of the baseline, used in messages. */
    String describe(String name);
}
