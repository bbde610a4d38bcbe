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

import java.util.ArrayList;
import java.util.List;

/**
 * A template with its common indentation removed. Blank and comment lines are dropped; each kept
 * line remembers its original line number and how much leading whitespace was stripped, so errors
 * can point back into the text the user wrote.
 */
final class TemplateSource {

    record Line(int number, int prefixWidth, String text) {
        /** Returns the number of leading spaces of the de-indented text. */
        int indent() {
            int i = 0;
            while (i < text.length() && text.charAt(i) == ' ') i++;
            return i;
        }

        /** Maps an offset into the de-indented text to a 1-based column of the original line. */
        int column(int offset) {
            return prefixWidth + offset + 1;
        }
    }

    private final List<Line> lines;

    private TemplateSource(List<Line> lines) {
        this.lines = List.copyOf(lines);
    }

    List<Line> lines() {
        return lines;
    }

    /**
     * Splits and de-indents {@code raw} by the leading whitespace of its first non-blank line.
     *
     * @throws TemplateSyntaxException if a later line is indented less than the first one
     */
    static TemplateSource of(String raw) {
        String[] split = raw.split("\\r?\n", -1);
        List<Line> kept = new ArrayList<>();
        String prefix = null;
        for (int i = 0; i < split.length; i++) {
            String text = split[i];
            String trimmed = text.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

            if (prefix == null) {
                prefix = leadingWhitespace(text);
            }
            if (!text.startsWith(prefix)) {
                int indent = leadingWhitespace(text).length();
                throw new TemplateSyntaxException(
                        SyntaxErrorKind.UNEXPECTED_SCALAR_AT_NODE_END,
                        "Unexpected scalar at node end",
                        i + 1,
                        indent + 1,
                        text,
                        indent);
            }
            kept.add(new Line(i + 1, prefix.length(), text.substring(prefix.length())));
        }
        return new TemplateSource(kept);
    }

    /**
     * Removes the indentation of the first non-blank line from every line, keeping blank lines and
     * leaving under-indented lines unchanged. Used for display, never for parsing.
     */
    static String unshift(String raw) {
        String[] split = raw.split("\\r?\n", -1);
        String prefix = null;
        StringBuilder out = new StringBuilder();
        boolean first = true;
        for (String text : split) {
            if (prefix == null) {
                if (text.isBlank()) continue;
                prefix = leadingWhitespace(text);
            }
            if (!first) out.append('\n');
            first = false;
            out.append(text.startsWith(prefix) ? text.substring(prefix.length()) : text);
        }
        return out.toString().stripTrailing();
    }

    private static String leadingWhitespace(String text) {
        int i = 0;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) i++;
        return text.substring(0, i);
    }
}
