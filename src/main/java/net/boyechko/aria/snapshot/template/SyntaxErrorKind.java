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

/** Categories of template syntax errors. */
public enum SyntaxErrorKind {
    UNTERMINATED_STRING,
    UNTERMINATED_REGEX,
    INVALID_REGEX,
    UNEXPECTED_INPUT,
    UNEXPECTED_SCALAR_AT_NODE_END,
    UNSUPPORTED_ATTRIBUTE,
    INVALID_ATTRIBUTE_VALUE,
    UNSUPPORTED_PROPERTY,
    INVALID_CHILDREN_MODE,
    NESTED_MAPPING
}
