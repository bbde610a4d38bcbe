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

/** The value domain of {@code checked} and {@code pressed}: a boolean or {@code mixed}. */
public enum Tristate {
    TRUE("true"),
    FALSE("false"),
    MIXED("mixed");

    private final String token;

    Tristate(String token) {
        this.token = token;
    }

    /** Returns the token used for this state in templates, e.g. {@code mixed}. */
    public String token() {
        return token;
    }

    public static Tristate of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public String toString() {
        return token;
    }
}
