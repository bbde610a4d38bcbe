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

import java.util.Optional;

/**
 * The closed set of ARIA attributes a template may assert on. Declaration order is the order in
 * which attributes are rendered.
 */
public enum AriaAttribute {
    CHECKED("checked", Domain.TRISTATE),
    DISABLED("disabled", Domain.BOOLEAN),
    EXPANDED("expanded", Domain.BOOLEAN),
    LEVEL("level", Domain.INTEGER),
    PRESSED("pressed", Domain.TRISTATE),
    SELECTED("selected", Domain.BOOLEAN);

    /** Typed value domain of an attribute, with the message fragment used when a value is invalid. */
    public enum Domain {
        BOOLEAN(Boolean.class, "must be a boolean"),
        TRISTATE(Tristate.class, "must be a boolean or \"mixed\""),
        INTEGER(Integer.class, "must be a number");

        private final Class<?> valueType;
        private final String requirement;

        Domain(Class<?> valueType, String requirement) {
            this.valueType = valueType;
            this.requirement = requirement;
        }

        public String requirement() {
            return requirement;
        }

        public boolean accepts(Object value) {
            return valueType.isInstance(value);
        }
    }

    private final String key;
    private final Domain domain;

    AriaAttribute(String key, Domain domain) {
        this.key = key;
        this.domain = domain;
    }

    public String key() {
        return key;
    }

    public Domain domain() {
        return domain;
    }

    /** Looks up an attribute by its template key; keys are case-sensitive. */
    public static Optional<AriaAttribute> fromKey(String key) {
        for (AriaAttribute attribute : values()) {
            if (attribute.key.equals(key)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }
}
