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
package net.boyechko.aria.snapshot.render;

import java.util.Set;
import java.util.regex.Pattern;

/** Quoting rules for scalars written into a template, so that they parse back to the same value. */
public final class YamlScalars {
    private static final Pattern COLON_SEPARATOR = Pattern.compile(":(\\s|$)");
    private static final Pattern NUMBER =
            Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Set<String> RESERVED_WORDS =
            Set.of("y", "n", "yes", "no", "true", "false", "on", "off", "null");
    private static final String INDICATORS = "&*],?!>|@\"'#%[";

    private YamlScalars() {}

    /** Returns {@code value} as-is, or double-quoted when it would not read back unquoted. */
    public static String escapeIfNeeded(String value) {
        return needsQuotes(value) ? quote(value) : value;
    }

    public static boolean needsQuotes(String value) {
        if (value.isEmpty()) return true;
        if (!value.equals(value.strip())) return true;
        for (int i = 0; i < value.length(); i++) {
            if (isControl(value.charAt(i))) return true;
        }
        if (value.startsWith("-")) return true;
        if (COLON_SEPARATOR.matcher(value).find()) return true;
        if (value.contains(" #")) return true;
        if (INDICATORS.indexOf(value.charAt(0)) >= 0) return true;
        if (value.contains("{") || value.contains("}") || value.contains("`")) return true;
        if (NUMBER.matcher(value).matches()) return true;
        return RESERVED_WORDS.contains(value.toLowerCase());
    }

    /** Double-quotes {@code value} with JSON-style escapes; other control characters as {@code \xHH}. */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (isControl(c)) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private static boolean isControl(char c) {
        return c < 0x20 || c == 0x7f;
    }
}
