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

/** When an assertion rewrites its baseline from the captured tree. */
public enum UpdateMode {
    /** Never write. */
    NONE("none"),
    /** Write only baselines that do not exist yet. */
    MISSING("missing"),
    /** Write missing baselines and those that no longer match. */
    CHANGED("changed"),
    /** Rewrite every baseline. */
    ALL("all");

    private final String key;

    UpdateMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<UpdateMode> fromKey(String key) {
        for (UpdateMode mode : values()) {
            if (mode.key.equals(key)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
