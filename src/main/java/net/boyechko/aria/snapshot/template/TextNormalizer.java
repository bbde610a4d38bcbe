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

import java.util.regex.Pattern;

/** Whitespace normalization applied to literal names and text on both sides of a match. */
public final class TextNormalizer {
    private static final Pattern INVISIBLE = Pattern.compile("[\\u200b\\u00ad]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextNormalizer() {}

    /** Drops zero-width spaces and soft hyphens, trims, and collapses whitespace runs. */
    public static String normalize(String text) {
        if (text == null) return "";
        String visible = INVISIBLE.matcher(text).replaceAll("");
        return WHITESPACE_RUN.matcher(visible.strip()).replaceAll(" ");
    }
}
