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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of typed attribute values. Values are {@link Boolean}, {@link Tristate} or {@link
 * Integer} according to {@link AriaAttribute#domain()}; iteration follows the enum order.
 */
public final class AriaAttributes {
    private static final AriaAttributes EMPTY = new AriaAttributes(new EnumMap<>(AriaAttribute.class));

    private final EnumMap<AriaAttribute, Object> values;

    private AriaAttributes(EnumMap<AriaAttribute, Object> values) {
        this.values = values;
    }

    public static AriaAttributes empty() {
        return EMPTY;
    }

    /**
     * Returns a copy with {@code attribute} set to {@code value}. A {@link Boolean} given for a
     * tristate attribute is converted to the matching {@link Tristate}.
     *
     * @throws IllegalArgumentException if the value does not belong to the attribute's domain
     */
    public AriaAttributes with(AriaAttribute attribute, Object value) {
        Objects.requireNonNull(attribute, "attribute");
        Object typed = value;
        if (attribute.domain() == AriaAttribute.Domain.TRISTATE && value instanceof Boolean flag) {
            typed = Tristate.of(flag);
        }
        if (!attribute.domain().accepts(typed)) {
            throw new IllegalArgumentException(
                    "Value "
                            + value
                            + " of \""
                            + attribute.key()
                            + "\" attribute "
                            + attribute.domain().requirement());
        }
        EnumMap<AriaAttribute, Object> copy = new EnumMap<>(AriaAttribute.class);
        copy.putAll(values);
        copy.put(attribute, typed);
        return new AriaAttributes(copy);
    }

    /** Returns the value of the attribute, or null if it is not set. */
    public Object get(AriaAttribute attribute) {
        return values.get(attribute);
    }

    public boolean has(AriaAttribute attribute) {
        return values.containsKey(attribute);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<AriaAttribute> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<AriaAttribute, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AriaAttributes other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
