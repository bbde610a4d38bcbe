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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import net.boyechko.aria.snapshot.template.TemplateSyntaxException;
import net.boyechko.aria.snapshot.tree.AriaNode;
import net.boyechko.aria.snapshot.tree.CaptureResult;
import net.boyechko.aria.snapshot.tree.SnapshotLoader;
import org.junit.jupiter.api.Test;

class AriaSnapshotAssertionTest {
    private static final String TODO_REGEX =
            "- banner:\n"
                    + "  - heading \"todos\" [level=1]\n"
                    + "  - textbox \"What needs to be done?\"";

    private final CaptureResult todo =
            CaptureResult.captured(SnapshotLoader.fromResource("/snapshots/todo-list.yml"));

    @Test
    void passesWhenTemplateMatchesBelowRoot() {
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .build()
                        .assertInline(
                                """
                                    - heading "todos"
                                    - textbox
                                """,
                                todo,
                                false);
        assertTrue(outcome.pass(), outcome.message());
        assertEquals("- heading \"todos\"\n- textbox", outcome.expected());
    }

    @Test
    void descendantSearchCanBeDisabled() {
        AriaSnapshotAssertion assertion =
                AriaSnapshotAssertion.builder().withDescendantSearch(false).build();
        assertFalse(assertion.assertInline("- heading \"todos\"", todo, false).pass());
        assertTrue(assertion.assertInline("- banner", todo, false).pass());
    }

    @Test
    void mismatchShowsDiffAgainstRegexRendering() {
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .build()
                        .assertInline(
                                "\n    - heading \"todos\"\n    - textbox \"Wrong text\"\n  ",
                                todo,
                                false);
        assertFalse(outcome.pass());
        assertEquals(
                "- Expected  - 2\n"
                        + "+ Received  + 3\n"
                        + "\n"
                        + "- - heading \"todos\"\n"
                        + "- - textbox \"Wrong text\"\n"
                        + "+ - banner:\n"
                        + "+   - heading \"todos\" [level=1]\n"
                        + "+   - textbox \"What needs to be done?\"",
                outcome.message());
        assertEquals(TODO_REGEX, outcome.received());
        assertNull(outcome.suggestedBaseline());
    }

    @Test
    void dynamicContentAppearsAsRegexInDiff() {
        CaptureResult report =
                CaptureResult.captured(SnapshotLoader.fromResource("/snapshots/sales-report.yml"));
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .build()
                        .assertInline("- heading \"Sales Report 2023\" [level=1]", report, false);
        assertFalse(outcome.pass());
        assertTrue(outcome.message().contains("- - heading \"Sales Report 2023\" [level=1]"));
        assertTrue(outcome.message().contains("+ - heading /Sales Report \\d+/ [level=1]"));
    }

    @Test
    void equalRootListReportsRemovedItemInDiff() {
        String expected =
                """
                - /children: equal
                - list:
                  - listitem: One
                  - listitem: Two
                  - listitem: Three
                """;
        AriaSnapshotAssertion assertion = AriaSnapshotAssertion.builder().build();

        assertTrue(assertion.assertInline(expected, list("One", "Two", "Three"), false).pass());

        AssertionOutcome outcome = assertion.assertInline(expected, list("One", "Three"), false);
        assertFalse(outcome.pass());
        assertTrue(outcome.message().startsWith("- Expected  - 2\n+ Received  + 0\n"));
        assertTrue(outcome.message().contains("\n-   - listitem: Two\n"), outcome.message());
        assertEquals("- list:\n  - listitem: One\n  - listitem: Three", outcome.received());
    }

    private static CaptureResult list(String... items) {
        StringBuilder yaml = new StringBuilder("- role: list\n  children:\n");
        for (String item : items) {
            yaml.append("    - role: listitem\n      children: [").append(item).append("]\n");
        }
        return CaptureResult.captured(SnapshotLoader.fromYaml(yaml.toString()));
    }

    @Test
    void elementNotFoundAlwaysFails() {
        AriaSnapshotAssertion assertion = AriaSnapshotAssertion.builder().build();
        CaptureResult missing = CaptureResult.notFound("#missing");

        AssertionOutcome outcome = assertion.assertInline("- heading \"todos\"", missing, false);
        assertFalse(outcome.pass());
        assertEquals("Expected: - heading \"todos\"\nReceived: <element not found>", outcome.message());
        assertNull(outcome.received());

        assertFalse(assertion.assertInline("- heading \"todos\"", missing, true).pass());
    }

    @Test
    void negatedAssertionFailsOnMatchWithRawRendering() {
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder().build().assertInline("- banner", todo, true);
        assertFalse(outcome.pass());
        assertEquals("Expected: not - banner\nReceived: " + TODO_REGEX, outcome.message());
    }

    @Test
    void negatedAssertionPassesOnMismatch() {
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder().build().assertInline("- dialog", todo, true);
        assertTrue(outcome.pass());
    }

    @Test
    void syntaxErrorsPropagate() {
        AriaSnapshotAssertion assertion = AriaSnapshotAssertion.builder().build();
        var ex =
                assertThrows(
                        TemplateSyntaxException.class,
                        () -> assertion.assertInline("- heading [level=a]", todo, false));
        assertEquals("Value of \"level\" attribute must be a number", ex.getMessage());
    }

    @Test
    void missingInlineTemplateSuggestsBaseline() {
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .withUpdateMode(UpdateMode.MISSING)
                        .build()
                        .assertInline("", todo, false);
        assertFalse(outcome.pass());
        assertEquals("A snapshot is not provided, generating new baseline.", outcome.message());
        assertEquals(TODO_REGEX, outcome.suggestedBaseline());
    }

    @Test
    void negatedAssertionCannotGenerateBaseline() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .withUpdateMode(UpdateMode.MISSING)
                        .withBaselineStore(store)
                        .build()
                        .assertBaseline("todo", todo, true);
        assertFalse(outcome.pass());
        assertEquals("Matchers using \".not\" can't generate new baselines", outcome.message());
        assertTrue(store.files.isEmpty());
    }

    @Test
    void missingBaselineIsWrittenAndFails() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .withUpdateMode(UpdateMode.MISSING)
                        .withBaselineStore(store)
                        .build()
                        .assertBaseline("todo", todo, false);
        assertFalse(outcome.pass());
        assertEquals("A snapshot doesn't exist at memory:todo, writing actual.", outcome.message());
        assertEquals(TODO_REGEX, store.files.get("todo"));
    }

    @Test
    void existingBaselineIsNotRewrittenInMissingMode() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        store.files.put("todo", "- banner");
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .withUpdateMode(UpdateMode.MISSING)
                        .withBaselineStore(store)
                        .build()
                        .assertBaseline("todo", todo, false);
        assertTrue(outcome.pass());
        assertEquals("- banner", store.files.get("todo"));
    }

    @Test
    void changedModeRewritesOnlyMismatches() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        AriaSnapshotAssertion assertion =
                AriaSnapshotAssertion.builder()
                        .withUpdateMode(UpdateMode.CHANGED)
                        .withBaselineStore(store)
                        .build();

        store.files.put("todo", "- banner");
        assertTrue(assertion.assertBaseline("todo", todo, false).pass());
        assertEquals("- banner", store.files.get("todo"));

        store.files.put("todo", "- dialog");
        assertTrue(assertion.assertBaseline("todo", todo, false).pass());
        assertEquals(TODO_REGEX, store.files.get("todo"));
    }

    @Test
    void allModeRewritesMatchingBaseline() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        store.files.put("todo", "- banner");
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .withUpdateMode(UpdateMode.ALL)
                        .withBaselineStore(store)
                        .build()
                        .assertBaseline("todo", todo, false);
        assertTrue(outcome.pass());
        assertEquals(TODO_REGEX, store.files.get("todo"));
    }

    @Test
    void negatedAssertionNeverWrites() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        store.files.put("todo", "- dialog");
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .withUpdateMode(UpdateMode.ALL)
                        .withBaselineStore(store)
                        .build()
                        .assertBaseline("todo", todo, true);
        assertTrue(outcome.pass());
        assertEquals("- dialog", store.files.get("todo"));
    }

    @Test
    void absentBaselineWithoutUpdatesIsEmptyTemplate() {
        InMemoryBaselineStore store = new InMemoryBaselineStore();
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .withBaselineStore(store)
                        .build()
                        .assertBaseline("todo", todo, false);
        assertTrue(outcome.pass());
        assertTrue(store.files.isEmpty());
    }

    @Test
    void committedBaselineMatchesFixture() throws Exception {
        Path snapshots = Path.of(getClass().getResource("/snapshots").toURI());
        AssertionOutcome outcome =
                AriaSnapshotAssertion.builder()
                        .withBaselineStore(new FileBaselineStore(snapshots))
                        .build()
                        .assertBaseline("todo-list", todo, false);
        assertTrue(outcome.pass(), outcome.message());
        assertEquals(TODO_REGEX, outcome.expected());
    }

    @Test
    void baselineAssertionRequiresStore() {
        AriaSnapshotAssertion assertion = AriaSnapshotAssertion.builder().build();
        assertThrows(IllegalStateException.class, () -> assertion.assertBaseline("todo", todo, false));
    }

    @Test
    void repeatedAttemptsAreIndependent() {
        AriaSnapshotAssertion assertion = AriaSnapshotAssertion.builder().build();
        AriaNode empty = AriaNode.fragment();
        assertFalse(assertion.assertInline("- banner", CaptureResult.captured(empty), false).pass());
        assertTrue(assertion.assertInline("- banner", todo, false).pass());
    }

    private static class InMemoryBaselineStore implements BaselineStore {
        final Map<String, String> files = new HashMap<>();

        @Override
        public Optional<String> read(String name) {
            return Optional.ofNullable(files.get(name));
        }

        @Override
        public void write(String name, String content) {
            files.put(name, content);
        }

        @Override
        public String describe(String name) {
            return "memory:" + name;
        }
    }
}
