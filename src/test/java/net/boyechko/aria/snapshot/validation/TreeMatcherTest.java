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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.aria.snapshot.template.TemplateParser;
import net.boyechko.aria.snapshot.tree.AriaAttribute;
import net.boyechko.aria.snapshot.tree.AriaNode;
import org.junit.jupiter.api.Test;

class TreeMatcherTest {
    private final TreeMatcher matcher = new TreeMatcher();

    @Test
    void matchesNameIgnoringUnlistedAttributes() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.builder("heading")
                                .withName("title")
                                .withAttribute(AriaAttribute.LEVEL, 1)
                                .build());
        assertTrue(matches("- heading \"title\"", snapshot));
    }

    @Test
    void attributeMismatchFailsRegardlessOfName() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.builder("heading")
                                .withName("Section Title")
                                .withAttribute(AriaAttribute.LEVEL, 2)
                                .build());
        assertFalse(matches("- heading [level=3]", snapshot));
        assertTrue(matches("- heading [level=2]", snapshot));
    }

    @Test
    void attributeMissingFromSnapshotFails() {
        AriaNode snapshot = AriaNode.fragment(AriaNode.builder("button").withName("Save").build());
        assertFalse(matches("- button [disabled]", snapshot));
        assertFalse(matches("- button [disabled=false]", snapshot));
    }

    @Test
    void roleMustBeEqual() {
        AriaNode snapshot = AriaNode.fragment(AriaNode.builder("button").withName("OK").build());
        assertFalse(matches("- link \"OK\"", snapshot));
    }

    @Test
    void noneRoleMatchesAnyElementButNotText() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.builder("button").withName("OK").build(), AriaNode.text("OK"));
        assertTrue(matches("- none \"OK\"", snapshot));
        assertFalse(matches("- none \"Cancel\"", snapshot));
        assertFalse(matches("- none \"OK\"", AriaNode.fragment(AriaNode.text("OK"))));
    }

    @Test
    void regexNameIsSearchedInValue() {
        AriaNode snapshot =
                AriaNode.fragment(AriaNode.builder("heading").withName("Sales Report 2024").build());
        assertTrue(matches("- heading /Report \\d+/", snapshot));
        assertFalse(matches("- heading /Summary/", snapshot));
    }

    @Test
    void literalComparisonNormalizesCapturedWhitespace() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.builder("button").withName("  Add\u200b to \n cart ").build());
        assertTrue(matches("- button \"Add to cart\"", snapshot));
    }

    @Test
    void equalRootListMatchesExactChildren() {
        String template =
                """
                - /children: equal
                - list:
                  - listitem: One
                  - listitem: Two
                  - listitem: Three
                """;
        assertTrue(matches(template, AriaNode.fragment(list("One", "Two", "Three"))));
        assertFalse(matches(template, AriaNode.fragment(list("One", "Three"))));
        assertFalse(
                matches(
                        template,
                        AriaNode.fragment(
                                list("One", "Two", "Three"),
                                AriaNode.builder("button").build())));
    }

    @Test
    void containToleratesExtraChildren() {
        String template = "- list:\n  - listitem: One\n  - listitem: Three";
        assertTrue(matches(template, AriaNode.fragment(list("One", "Three"))));
        assertTrue(matches(template, AriaNode.fragment(list("Zero", "One", "Two", "Three", "Four"))));
    }

    @Test
    void containRequiresOrder() {
        String template = "- list:\n  - listitem: Three\n  - listitem: One";
        assertFalse(matches(template, AriaNode.fragment(list("One", "Two", "Three"))));
    }

    @Test
    void containDoesNotReuseConsumedChild() {
        String template = "- list:\n  - listitem: One\n  - listitem: One";
        assertFalse(matches(template, AriaNode.fragment(list("One", "Two"))));
        assertTrue(matches(template, AriaNode.fragment(list("One", "Two", "One"))));
    }

    @Test
    void equalRejectsAddedOrRemovedChild() {
        String template =
                """
                - list:
                  - /children: equal
                  - listitem: One
                  - listitem: Two
                """;
        assertTrue(matches(template, AriaNode.fragment(list("One", "Two"))));
        assertFalse(matches(template, AriaNode.fragment(list("One", "Two", "Three"))));
        assertFalse(matches(template, AriaNode.fragment(list("One"))));
    }

    @Test
    void equalDoesNotPropagateToGrandchildren() {
        String template =
                """
                - list:
                  - /children: equal
                  - listitem:
                    - text: One
                """;
        AriaNode item =
                AriaNode.builder("listitem")
                        .withText("One")
                        .withChild(AriaNode.builder("button").build())
                        .build();
        AriaNode snapshot = AriaNode.fragment(AriaNode.builder("list").withChild(item).build());
        assertTrue(matches(template, snapshot));
    }

    @Test
    void deepEqualIsInheritedUntilOverridden() {
        AriaNode snapshot = AriaNode.fragment(nestedList("1.1", "1.2"));

        String deep =
                """
                - /children: deep-equal
                - list:
                  - listitem:
                    - list:
                      - listitem: "1.1"
                """;
        assertFalse(matches(deep, snapshot));

        String overridden =
                """
                - /children: deep-equal
                - list:
                  - listitem:
                    - list:
                      - /children: contain
                      - listitem: "1.1"
                """;
        assertTrue(matches(overridden, snapshot));

        String complete =
                """
                - /children: deep-equal
                - list:
                  - listitem:
                    - list:
                      - listitem: "1.1"
                      - listitem: "1.2"
                """;
        assertTrue(matches(complete, snapshot));
    }

    @Test
    void matchesUrlProperty() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.builder("link")
                                .withUrl("https://example.com/docs")
                                .withText("Docs")
                                .build());
        assertTrue(matches("- link:\n  - /url: https://example.com/docs", snapshot));
        assertTrue(matches("- link:\n  - /url: /example\\.com/", snapshot));
        assertFalse(matches("- link:\n  - /url: https://example.org", snapshot));
    }

    @Test
    void textItemMatchesTextNodeOnly() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.text("Hello"), AriaNode.builder("button").withName("Hello").build());
        assertTrue(matches("- text: Hello", snapshot));
        assertTrue(matches("- \"Hello\"\n- button", snapshot));
        assertFalse(matches("- button\n- text: Hello", snapshot));
    }

    @Test
    void emptyTemplateMatchesAnything() {
        assertTrue(matches("", AriaNode.fragment(list("One"))));
    }

    @Test
    void descendantSearchFindsNestedFragment() {
        AriaNode banner =
                AriaNode.builder("banner")
                        .withChild(AriaNode.builder("heading").withName("todos").build())
                        .withChild(AriaNode.builder("textbox").build())
                        .build();
        AriaNode snapshot = AriaNode.fragment(AriaNode.builder("main").withChild(banner).build());
        String template = "- heading \"todos\"\n- textbox";

        assertFalse(matches(template, snapshot));

        MatchResult result = new TreeMatcher(true).match(TemplateParser.parse(template), snapshot);
        assertTrue(result.matched());
        assertSame(banner, result.matchedAt());
        assertSame(snapshot, result.snapshot());
    }

    @Test
    void mismatchHasNoLocation() {
        MatchResult result =
                new TreeMatcher(true)
                        .match(TemplateParser.parse("- dialog"), AriaNode.fragment(list("One")));
        assertFalse(result.matched());
        assertTrue(result.matchLocation().isEmpty());
    }

    private boolean matches(String template, AriaNode snapshot) {
        return matcher.matches(TemplateParser.parse(template), snapshot);
    }

    private static AriaNode list(String... items) {
        AriaNode.Builder list = AriaNode.builder("list");
        for (String item : items) {
            list.withChild(AriaNode.builder("listitem").withText(item).build());
        }
        return list.build();
    }

    private static AriaNode nestedList(String... items) {
        return AriaNode.builder("list")
                .withChild(AriaNode.builder("listitem").withChild(list(items)).build())
                .build();
    }
}
