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

/** What a single {@code - ...} item of a template turned out to be. */
sealed interface TemplateLine {

    /** An element or text item; {@code acceptsChildren} when the item ended with a bare colon. */
    record NodeLine(TemplateNode.Builder node, boolean acceptsChildren) implements TemplateLine {}

    /** {@code /children: <mode>}, applied to the enclosing node. */
    record ChildrenDirective(ContainerMode mode) implements TemplateLine {}

    /** {@code /url: <value>}, applied to the enclosing node. */
    record UrlDirective(TextMatcher url) implements TemplateLine {}
}
