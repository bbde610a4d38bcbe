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
package net.boyechko.aria.snapshot.tree;

import java.util.Objects;

/** Outcome of capturing the accessibility tree for a locator. */
public sealed interface CaptureResult {
    record Captured(AriaNode root) implements CaptureResult {
        public Captured {
            Objects.requireNonNull(root, "root");
        }
    }

    /** The locator resolved to no element; never matched, never diffed. */
    record ElementNotFound(String locator) implements CaptureResult {}

    static CaptureResult captured(AriaNode root) {
        return new Captured(root);
    }

    static CaptureResult notFound(String locator) {
        return new ElementNotFound(locator);
    }
}
