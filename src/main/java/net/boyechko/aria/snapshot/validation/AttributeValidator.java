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

import java.util.regex.Pattern;
import net.boyechko.aria.snapshot.tree.AriaAttribute;
import net.boyechko.aria.snapshot.tree.Tristate;

/**
 * Type-checks and coerces raw attribute text into the attribute's domain.
 *
 * <p>Booleans accept exactly {@code true} and {@code false}; tristates additionally accept {@code
 * mixed}; integers accept a digit sequence with an optional leading {@code -}. Surrounding
 * whitespace is ignored, everything else is case-sensitive.
 */
public final class AttributeValidator {
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");

    private AttributeValidator() {}

    /**
     * Returns the typed value ({@link Boolean}, {@link Tristate} or {@link Integer}) for {@code
     * rawValue}.
     *
     * @throws AttributeValueException if the value is outside the attribute's domain
     */
    public static Object validate(AriaAttribute attribute, String rawValue) {
        String value = rawValue == null ? "" : rawValue.strip();
        return switch (attribute.domain()) {
            case BOOLEAN -> parseBoolean(attribute, value, rawValue);
            case TRISTATE -> parseTristate(attribute, value, rawValue);
            case INTEGER -> parseInteger(attribute, value, rawValue);
        };
    }

    /**
     * Like {@link #validate(AriaAttribute, String)}, but looks the attribute up by key first.
     *
     * @throws IllegalArgumentException if the key is not a supported attribute
     */
    public static Object validate(String key, String rawValue) {
        AriaAttribute attribute =
                AriaAttribute.fromKey(key)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "Unsupported attribute [" + key + "]"));
        return validate(attribute, rawValue);
    }

    private static Boolean parseBoolean(AriaAttribute attribute, String value, String raw) {
        if ("true".equals(value)) return Boolean.TRUE;
        if ("false".equals(value)) return Boolean.FALSE;
        throw new AttributeValueException(attribute, raw);
    }

    private static Tristate parseTristate(AriaAttribute attribute, String value, String raw) {
        return switch (value) {
            case "true" -> Tristate.TRUE;
            case "false" -> Tristate.FALSE;
            case "mixed" -> Tristate.MIXED;
            default -> throw new AttributeValueException(attribute, raw);
        };
    }

    private static Integer parseInteger(AriaAttribute attribute, String value, String raw) {
        if (!INTEGER.matcher(value).matches()) {
            throw new AttributeValueException(attribute, raw);
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            // digit run too long for an int
            AttributeValueException invalid = new AttributeValueException(attribute, raw);
            invalid.initCause(e);
            throw invalid;
        }
    }
}
