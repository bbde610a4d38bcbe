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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Matches a name, text or url value, either by exact string equality or by a regular expression
 * found anywhere in the value.
 */
public sealed interface TextMatcher permits TextMatcher.Literal, TextMatcher.Regex {

    boolean matches(String value);

    static TextMatcher literal(String value) {
        return new Literal(value);
    }

    /**
     * Compiles {@code source} (the text between the slashes of a regex literal).
     *
     * @throws java.util.regex.PatternSyntaxException if the source is not a valid regex
     */
    static TextMatcher regex(String source) {
        return new Regex(source);
    }

    record Literal(String value) implements TextMatcher {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean matches(String candidate) {
            return value.equals(candidate);
        }
    }

    /** Regex matcher; two instances are equal when their sources are. */
    final class Regex implements TextMatcher {
        private final String source;
        private final Pattern pattern;

        private Regex(String source) {
            this.source = Objects.requireNonNull(source, "source");
            this.pattern = Pattern.compile(source);
        }

        public String source() {
            return source;
        }

        @Override
        public boolean matches(String candidate) {
            return candidate != null && pattern.matcher(candidate).find();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Regex other && source.equals(other.source);
        }

        @Override
        public int hashCode() {
            return source.hashCode();
        }

        @Override
        public String toString() {
            return "/" + source + "/";
        }
    }
}
