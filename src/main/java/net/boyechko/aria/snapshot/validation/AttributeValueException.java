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
package net.boyechko.aria.snapshot.validation;

import net.boyechko.aria.snapshot.tree.AriaAttribute;

/** Thrown when a raw attribute value does not belong to the attribute's typed domain. */
public class AttributeValueException extends IllegalArgumentException {
    private final AriaAttribute attribute;
    private final String rawValue;

    public AttributeValueException(AriaAttribute attribute, String rawValue) {
        super(
                "Value of \""
                        + attribute.key()
                        + "\" attribute "
                        + attribute.domain().requirement());
        this.attribute = attribute;
        this.rawValue = rawValue;
    }

    public AriaAttribute attribute() {
        return attribute;
    }

    public String rawValue() {
        return rawValue;
    }
}
