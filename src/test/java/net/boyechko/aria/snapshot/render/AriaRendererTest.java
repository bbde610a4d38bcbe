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
package net.boyechko.aria.snapshot.render;

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.aria.snapshot.template.TemplateNode;
import net.boyechko.aria.snapshot.template.TemplateParser;
import net.boyechko.aria.snapshot.tree.AriaAttribute;
import net.boyechko.aria.snapshot.tree.AriaNode;
import net.boyechko.aria.snapshot.tree.SnapshotLoader;
import net.boyechko.aria.snapshot.tree.Tristate;
import net.boyechko.aria.snapshot.validation.TreeMatcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AriaRendererTest {

    @ParameterizedTest
    @ValueSource(
            strings = {
                "- heading \"title\" [level=1]",
                "- /children: equal\n- list:\n  - listitem: One\n  - listitem: /Item \\d+/",
                "- link:\n  - /url: https://example.com\n  - text: Docs",
                "- paragraph: \"Items: 42\"",
                "- paragraph: Price: $99.00",
                "- checkbox [checked=mixed] [disabled]",
                "- paragraph: \"/Total: \\\\d+ items/\"",
                "- \"yes\"",
                "- list:\n  - /children: deep-equal\n  - listitem:\n    - button \"a \\\"b\\\"\"",
                "- heading /a[/\\]]b/ [level=2]"
            })
    void renderedTemplateParsesBackToSameTree(String template) {
        TemplateNode parsed = TemplateParser.parse(template);
        String rendered = AriaRenderer.render(parsed);
        assertEquals(parsed, TemplateParser.parse(rendered), () -> "Rendered as:\n" + rendered);
    }

    @Test
    void slashDelimitedLiteralsRenderAsExactRegex() {
        AriaNode snapshot = docsPage("/docs/", "//");
        String rendered = AriaRenderer.render(snapshot);
        assertEquals("- link \"Docs\":\n  - /url: /^\\/docs\\/$/\n- code: /^\\/\\/$/", rendered);

        TemplateNode baseline = TemplateParser.parse(rendered);
        TreeMatcher matcher = new TreeMatcher();
        assertTrue(matcher.matches(baseline, snapshot));
        assertFalse(matcher.matches(baseline, docsPage("/mydocs/x", "//")));
        assertFalse(matcher.matches(baseline, docsPage("/docs/", "anything")));
    }

    private static AriaNode docsPage(String url, String code) {
        return AriaNode.fragment(
                AriaNode.builder("link").withName("Docs").withUrl(url).build(),
                AriaNode.builder("code").withText(code).build());
    }

    @Test
    void rendersCapturedTreeFromFixture() {
        AriaNode snapshot = SnapshotLoader.fromResource("/snapshots/todo-list.yml");
        assertEquals(
                "- banner:\n"
                        + "  - heading \"todos\" [level=1]\n"
                        + "  - textbox \"What needs to be done?\"",
                AriaRenderer.render(snapshot));
    }

    @Test
    void collapsesSingleTextChildIntoLeaf() {
        AriaNode snapshot =
                AriaNode.fragment(AriaNode.builder("paragraph").withText("Items: 42").build());
        assertEquals("- paragraph: \"Items: 42\"", AriaRenderer.render(snapshot));
    }

    @Test
    void rendersAttributesInFixedOrder() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.builder("treeitem")
                                .withName("Docs")
                                .withAttribute(AriaAttribute.SELECTED, true)
                                .withAttribute(AriaAttribute.LEVEL, 2)
                                .withAttribute(AriaAttribute.EXPANDED, false)
                                .withAttribute(AriaAttribute.CHECKED, Tristate.MIXED)
                                .build());
        assertEquals(
                "- treeitem \"Docs\" [checked=mixed] [expanded=false] [level=2] [selected]",
                AriaRenderer.render(snapshot));
    }

    @Test
    void rendersUrlBeforeChildren() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.builder("link")
                                .withName("Docs")
                                .withUrl("https://example.com/docs")
                                .withChild(AriaNode.builder("img").withName("icon").build())
                                .build());
        assertEquals(
                "- link \"Docs\":\n  - /url: https://example.com/docs\n  - img \"icon\"",
                AriaRenderer.render(snapshot));
    }

    @Test
    void rendersMixedTextAndElementsAsItems() {
        AriaNode snapshot =
                AriaNode.fragment(
                        AriaNode.builder("paragraph")
                                .withText("Read the")
                                .withChild(AriaNode.builder("link").withName("docs").build())
                                .build());
        assertEquals(
                "- paragraph:\n  - text: Read the\n  - link \"docs\"",
                AriaRenderer.render(snapshot));
    }

    @Test
    void emptyFragmentRendersEmpty() {
        assertEquals("", AriaRenderer.render(AriaNode.fragment()));
    }
}
