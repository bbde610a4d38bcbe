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
package net.boyechko.aria.snapshot.template;

import java.util.Optional;

/** How strictly the expected children of a node must correspond to the captured children. */
public enum ContainerMode {
    /** Expected children appear, in order, as a subsequence of the captured ones. */
    CONTAIN("contain"),
    /** Same length and pairwise match; grandchildren fall back to {@link #CONTAIN}. */
    EQUAL("equal"),
    /** Like {@link #EQUAL}, inherited by every descendant level without its own directive. */
    DEEP_EQUAL("deep-equal");

    private final String key;

    ContainerMode(String key) {
        this.key = key;
    }

    /** Returns the keyword used after {@code /children:}. */
    public String key() {
        return key;
    }

    public static Optional<ContainerMode> fromKey(String key) {
        for (ContainerMode mode : values()) {
            if (mode.key.equals(key)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
