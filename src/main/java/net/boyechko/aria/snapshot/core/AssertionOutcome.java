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
package net.boyechko.aria.snapshot.core;

/**
 * Result of one assertion attempt.
 *
 * @param pass whether the assertion holds
 * @param message failure message, empty when passing without remarks
 * @param expected the expected template as shown to the user
 * @param received the rendered captured tree, or null when no element was found
 * @param suggestedBaseline regexified rendering to paste into an inline expectation, or null
 */
public record AssertionOutcome(
        boolean pass, String message, String expected, String received, String suggestedBaseline) {

    static AssertionOutcome passed(String expected, String received) {
        return new AssertionOutcome(true, "", expected, received, null);
    }

    static AssertionOutcome failed(String message, String expected, String received) {
        return new AssertionOutcome(false, message, expected, received, null);
    }

    AssertionOutcome withSuggestedBaseline(String baseline) {
        return new AssertionOutcome(pass, message, expected, received, baseline);
    }
}
