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

import java.util.List;
import java.util.regex.PatternSyntaxException;
import net.boyechko.aria.snapshot.tree.AriaAttribute;
import net.boyechko.aria.snapshot.tree.AriaNode;
import net.boyechko.aria.snapshot.validation.AttributeValidator;
import net.boyechko.aria.snapshot.validation.AttributeValueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the template language into a {@link TemplateNode} tree.
 *
 * <p>A template is a list of {@code - } items nested by two-space indentation:
 *
 * <pre>
 * - /children: equal
 * - heading "Title" [level=1]
 * - list:
 *   - listitem: One
 *   - listitem: /Item \d+/
 * - link:
 *   - /url: https://example.com
 * </pre>
 *
 * <p>Parsing stops at the first problem with a {@link TemplateSyntaxException}.
 */
public final class TemplateParser {
    private static final Logger logger = LoggerFactory.getLogger(TemplateParser.class);

    static final int INDENT_STEP = 2;
    private static final String ITEM_MARKER = "- ";
    private static final String NESTED_MAPPING_MESSAGE =
            "Nested mappings are not allowed in compact mappings."
                    + " Hint: Strings containing colons need to be quoted, e.g., \"Items: 42\"";

    private TemplateParser() {}

    /**
     * Parses {@code text} into a tree rooted at a fragment node whose children are the top-level
     * items. Common indentation of the text is ignored.
     *
     * @throws TemplateSyntaxException on the first syntax or attribute error
     */
    public static TemplateNode parse(String text) {
        List<TemplateSource.Line> lines = TemplateSource.of(text).lines();
        TemplateNode.Builder root = TemplateNode.builder(AriaNode.FRAGMENT_ROLE);
        parseBlock(lines, 0, 0, root);
        TemplateNode parsed = root.build();
        logger.debug(
                "Parsed template with {} top-level items, root mode {}",
                parsed.children().size(),
                parsed.containerMode());
        return parsed;
    }

    /** Removes the indentation of the first non-blank line, as shown in assertion messages. */
    public static String unshift(String text) {
        return TemplateSource.unshift(text);
    }

    /** Parses the items at exactly {@code indent} into {@code parent}; returns the next line. */
    private static int parseBlock(
            List<TemplateSource.Line> lines, int start, int indent, TemplateNode.Builder parent) {
        int i = start;
        while (i < lines.size()) {
            TemplateSource.Line line = lines.get(i);
            int lineIndent = line.indent();
            if (lineIndent < indent) {
                return i;
            }
            if (lineIndent > indent) {
                throw unexpectedIndent(line);
            }

            String rest = line.text().substring(indent);
            if (!rest.startsWith(ITEM_MARKER) && !rest.equals("-")) {
                throw new TemplateSyntaxException(
                        SyntaxErrorKind.UNEXPECTED_INPUT,
                        "Expected a list item",
                        line.number(),
                        line.column(indent),
                        line.text(),
                        indent);
            }
            String body = rest.length() > ITEM_MARKER.length() ? rest.substring(2) : "";
            TemplateLine item = new ItemParser(line, indent + ITEM_MARKER.length(), body).parse();
            i++;

            if (item instanceof TemplateLine.NodeLine node) {
                if (i < lines.size() && lines.get(i).indent() > indent) {
                    if (!node.acceptsChildren()) {
                        throw unexpectedIndent(lines.get(i));
                    }
                    i = parseBlock(lines, i, indent + INDENT_STEP, node.node());
                }
                parent.withChild(node.node().build());
            } else if (item instanceof TemplateLine.ChildrenDirective directive) {
                parent.withContainerMode(directive.mode());
            } else if (item instanceof TemplateLine.UrlDirective directive) {
                parent.withProperty(TemplateNode.URL_PROPERTY, directive.url());
            }
        }
        return i;
    }

    private static TemplateSyntaxException unexpectedIndent(TemplateSource.Line line) {
        return new TemplateSyntaxException(
                SyntaxErrorKind.UNEXPECTED_SCALAR_AT_NODE_END,
                "Unexpected scalar at node end",
                line.number(),
                line.column(line.indent()),
                line.text(),
                line.indent());
    }

    /** Scans the body of one item, the text after {@code "- "}. */
    private static final class ItemParser {
        private final TemplateSource.Line line;
        private final int bodyOffset;
        private final String input;
        private int pos;

        ItemParser(TemplateSource.Line line, int bodyOffset, String input) {
            this.line = line;
            this.bodyOffset = bodyOffset;
            this.input = input;
        }

        TemplateLine parse() {
            if (peek() == '/') {
                return parseDirective();
            }
            if (peek() == '"') {
                int start = pos;
                TextMatcher text = toTextMatcher(readQuoted(), start);
                expectEnd();
                return new TemplateLine.NodeLine(
                        TemplateNode.builder(AriaNode.TEXT_ROLE).withText(text).at(position(start)),
                        false);
            }
            return parseRoleItem();
        }

        private TemplateLine parseDirective() {
            pos++;
            String key = readWord();
            if (peek() != ':') {
                throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Unexpected input", pos);
            }
            pos++;
            skipWhitespace();
            int valueStart = pos;
            switch (key) {
                case "children" -> {
                    String value = input.substring(pos).strip();
                    ContainerMode mode =
                            ContainerMode.fromKey(value)
                                    .orElseThrow(
                                            () ->
                                                    error(
                                                            SyntaxErrorKind.INVALID_CHILDREN_MODE,
                                                            "Children mode must be one of"
                                                                    + " contain, equal, deep-equal",
                                                            valueStart));
                    return new TemplateLine.ChildrenDirective(mode);
                }
                case "url" -> {
                    if (atEnd()) {
                        throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Expected url value", pos);
                    }
                    return new TemplateLine.UrlDirective(readTextValue());
                }
                default ->
                        throw error(
                                SyntaxErrorKind.UNSUPPORTED_PROPERTY,
                                "Unsupported property /" + key,
                                0);
            }
        }

        private TemplateLine parseRoleItem() {
            int roleStart = pos;
            String role = readWord();
            if (role.isEmpty()) {
                throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Unexpected input", pos);
            }
            TemplateNode.Builder node = TemplateNode.builder(role).at(position(roleStart));

            skipWhitespace();
            if (peek() == '"') {
                node.withName(TextMatcher.literal(TextNormalizer.normalize(readQuoted())));
            } else if (peek() == '/') {
                node.withName(readRegex());
            }

            skipWhitespace();
            while (peek() == '[') {
                readAttributes(node);
                skipWhitespace();
            }

            if (atEnd()) {
                return finishLeaf(node, null, false);
            }
            if (peek() != ':') {
                throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Unexpected input", pos);
            }
            int colon = pos++;
            if (input.substring(pos).isBlank()) {
                return finishLeaf(node, null, true);
            }
            if (!Character.isWhitespace(peek())) {
                throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Unexpected input", colon);
            }
            skipWhitespace();
            return finishLeaf(node, readTextValue(), false);
        }

        private TemplateLine finishLeaf(
                TemplateNode.Builder node, TextMatcher text, boolean acceptsChildren) {
            TemplateNode built = node.build();
            if (!built.isText()) {
                return new TemplateLine.NodeLine(node.withText(text), acceptsChildren);
            }
            // text items carry their value either as "- text: value" or "- text "value""
            TextMatcher value = text != null ? text : built.name();
            if (value == null) {
                throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Expected text value", pos);
            }
            return new TemplateLine.NodeLine(
                    TemplateNode.builder(AriaNode.TEXT_ROLE)
                            .withText(value)
                            .at(built.position()),
                    false);
        }

        private void readAttributes(TemplateNode.Builder node) {
            pos++;
            skipWhitespace();
            if (peek() == ']') {
                pos++;
                return;
            }
            while (true) {
                skipWhitespace();
                int keyStart = pos;
                String key = readWord();
                if (key.isEmpty()) {
                    throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Unexpected input", pos);
                }
                AriaAttribute attribute =
                        AriaAttribute.fromKey(key)
                                .orElseThrow(
                                        () ->
                                                error(
                                                        SyntaxErrorKind.UNSUPPORTED_ATTRIBUTE,
                                                        "Unsupported attribute [" + key + "]",
                                                        keyStart));
                skipWhitespace();

                String raw = "true";
                int valueStart = pos;
                if (peek() == '=') {
                    pos++;
                    skipWhitespace();
                    valueStart = pos;
                    while (!atEnd() && peek() != ',' && peek() != ']') pos++;
                    raw = input.substring(valueStart, pos);
                }
                try {
                    node.withAttribute(attribute, AttributeValidator.validate(attribute, raw));
                } catch (AttributeValueException e) {
                    throw error(
                            SyntaxErrorKind.INVALID_ATTRIBUTE_VALUE, e.getMessage(), valueStart, e);
                }

                skipWhitespace();
                if (peek() == ',') {
                    pos++;
                    continue;
                }
                if (peek() == ']') {
                    pos++;
                    return;
                }
                throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Expected ]", pos);
            }
        }

        /** Reads a text value running to the end of the line. */
        private TextMatcher readTextValue() {
            int start = pos;
            if (peek() == '"') {
                String decoded = readQuoted();
                expectEnd();
                return toTextMatcher(decoded, start);
            }
            String value = input.substring(pos).strip();
            pos = input.length();
            if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
                return toTextMatcher(value.substring(1, value.length() - 1).replace("''", "'"), start);
            }
            if (value.endsWith(":")) {
                throw error(
                        SyntaxErrorKind.NESTED_MAPPING,
                        NESTED_MAPPING_MESSAGE,
                        start + value.length() - 1);
            }
            return toTextMatcher(value, start);
        }

        private TextMatcher toTextMatcher(String value, int start) {
            if (value.length() >= 2 && value.startsWith("/") && value.endsWith("/")) {
                return compile(value.substring(1, value.length() - 1), start);
            }
            return TextMatcher.literal(TextNormalizer.normalize(value));
        }

        private String readQuoted() {
            pos++;
            StringBuilder value = new StringBuilder();
            while (!atEnd()) {
                char c = input.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c != '\\') {
                    value.append(c);
                    continue;
                }
                if (atEnd()) break;
                char escaped = input.charAt(pos++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case 'b' -> value.append('\b');
                    case 'f' -> value.append('\f');
                    case 'u' -> value.append(readHexEscape(4));
                    case 'x' -> value.append(readHexEscape(2));
                    default -> value.append(escaped);
                }
            }
            throw error(SyntaxErrorKind.UNTERMINATED_STRING, "Unterminated string", input.length());
        }

        private char readHexEscape(int digits) {
            int escapeStart = pos - 2;
            if (pos + digits > input.length()) {
                throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Invalid escape sequence", escapeStart);
            }
            try {
                char decoded = (char) Integer.parseInt(input.substring(pos, pos + digits), 16);
                pos += digits;
                return decoded;
            } catch (NumberFormatException e) {
                throw error(
                        SyntaxErrorKind.UNEXPECTED_INPUT, "Invalid escape sequence", escapeStart, e);
            }
        }

        /** Scans {@code /.../}; a slash inside {@code [...]} or after a backslash does not end it. */
        private TextMatcher readRegex() {
            int start = pos++;
            StringBuilder source = new StringBuilder();
            boolean escaped = false;
            boolean inClass = false;
            while (!atEnd()) {
                char c = input.charAt(pos++);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (inClass) {
                    if (c == ']') inClass = false;
                } else if (c == '[') {
                    inClass = true;
                } else if (c == '/') {
                    return compile(source.toString(), start);
                }
                source.append(c);
            }
            throw error(SyntaxErrorKind.UNTERMINATED_REGEX, "Unterminated regex", input.length());
        }

        private TextMatcher compile(String source, int start) {
            try {
                return TextMatcher.regex(source);
            } catch (PatternSyntaxException e) {
                throw error(
                        SyntaxErrorKind.INVALID_REGEX,
                        "Invalid regular expression: " + e.getDescription(),
                        start,
                        e);
            }
        }

        private String readWord() {
            int start = pos;
            while (!atEnd()) {
                char c = peek();
                if (!Character.isLetterOrDigit(c) && c != '-' && c != '_') break;
                pos++;
            }
            return input.substring(start, pos);
        }

        private void expectEnd() {
            skipWhitespace();
            if (!atEnd()) {
                throw error(SyntaxErrorKind.UNEXPECTED_INPUT, "Unexpected input", pos);
            }
        }

        private void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) pos++;
        }

        private char peek() {
            return atEnd() ? '\0' : input.charAt(pos);
        }

        private boolean atEnd() {
            return pos >= input.length();
        }

        private SourcePosition position(int offset) {
            return new SourcePosition(line.number(), line.column(bodyOffset + offset));
        }

        private TemplateSyntaxException error(SyntaxErrorKind kind, String message, int offset) {
            return error(kind, message, offset, null);
        }

        private TemplateSyntaxException error(
                SyntaxErrorKind kind, String message, int offset, Throwable cause) {
            return new TemplateSyntaxException(
                    kind,
                    message,
                    line.number(),
                    line.column(bodyOffset + offset),
                    input,
                    offset,
                    cause);
        }
    }
}
