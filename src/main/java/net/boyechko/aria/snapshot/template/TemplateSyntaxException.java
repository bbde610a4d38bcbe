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

/**
 * A template could not be parsed. Parsing stops at the first error; the exception carries the
 * 1-based line and column in the template as written and an excerpt with the offset of the
 * offending character, for {@link #formatted()}.
 */
public class TemplateSyntaxException extends RuntimeException {
    private final SyntaxErrorKind kind;
    private final int line;
    private final int column;
    private final String excerpt;
    private final int caretOffset;

    public TemplateSyntaxException(
            SyntaxErrorKind kind,
            String message,
            int line,
            int column,
            String excerpt,
            int caretOffset) {
        this(kind, message, line, column, excerpt, caretOffset, null);
    }

    public TemplateSyntaxException(
            SyntaxErrorKind kind,
            String message,
            int line,
            int column,
            String excerpt,
            int caretOffset,
            Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.excerpt = excerpt;
        this.caretOffset = caretOffset;
    }

    public SyntaxErrorKind kind() {
        return kind;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public SourcePosition position() {
        return new SourcePosition(line, column);
    }

    public int caretOffset() {
        return caretOffset;
    }

    /** Returns {@code <message>:\n\n<excerpt>\n<caret>\n}. */
    public String formatted() {
        return getMessage() + ":\n\n" + excerpt + "\n" + " ".repeat(caretOffset) + "^\n";
    }
}
