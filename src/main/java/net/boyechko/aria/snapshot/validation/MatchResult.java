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

import java.util.Optional;
import net.boyechko.aria.snapshot.tree.AriaNode;

/**
 * Outcome of matching a template against a captured tree.
 *
 * @param matched whether the template matched
 * @param snapshot the captured root, kept as the renderable witness of the attempt
 * @param matchedAt the node whose children matched the template's top-level items, or null
 */
public record MatchResult(boolean matched, AriaNode snapshot, AriaNode matchedAt) {

    public static MatchResult matched(AriaNode snapshot, AriaNode matchedAt) {
        return new MatchResult(true, snapshot, matchedAt);
    }

    public static MatchResult mismatched(AriaNode snapshot) {
        return new MatchResult(false, snapshot, null);
    }

    public Optional<AriaNode> matchLocation() {
        return Optional.ofNullable(matchedAt);
    }
}
