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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.aria.snapshot.tree.AriaNode;
import org.junit.jupiter.api.Test;

class TemplateNodeTest {

    @Test
    void leafTextExpandsToSingleTextChild() {
        TemplateNode item =
                TemplateNode.builder("listitem").withText(TextMatcher.literal("One")).build();
        List<TemplateNode> children = item.effectiveChildren();
        assertEquals(1, children.size());
        assertEquals(AriaNode.TEXT_ROLE, children.get(0).role());
        assertEquals(TextMatcher.literal("One"), children.get(0).text());
    }

    @Test
    void equalityIgnoresPosition() {
        TemplateNode a = TemplateNode.builder("button").at(new SourcePosition(1, 3)).build();
        TemplateNode b = TemplateNode.builder("button").at(new SourcePosition(4, 7)).build();
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void regexMatchersCompareBySource() {
        assertEquals(TextMatcher.regex("\\d+"), TextMatcher.regex("\\d+"));
        assertNotEquals(TextMatcher.regex("\\d+"), TextMatcher.literal("\\d+"));
    }

    @Test
    void regexFindsMatchAnywhereInValue() {
        assertTrue(TextMatcher.regex("\\d+ items").matches("Total: 42 items in cart"));
        assertFalse(TextMatcher.regex("^\\d+$").matches("Total: 42"));
    }

    @Test
    void rejectsEmptyRole() {
        assertThrows(IllegalArgumentException.class, () -> TemplateNode.builder(""));
    }
}
