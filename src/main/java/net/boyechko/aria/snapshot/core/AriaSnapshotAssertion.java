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

import java.util.Objects;
import java.util.Optional;
import net.boyechko.aria.snapshot.render.AriaRenderer;
import net.boyechko.aria.snapshot.render.DiffFormatter;
import net.boyechko.aria.snapshot.render.Regexifier;
import net.boyechko.aria.snapshot.template.TemplateNode;
import net.boyechko.aria.snapshot.template.TemplateParser;
import net.boyechko.aria.snapshot.tree.AriaNode;
import net.boyechko.aria.snapshot.tree.CaptureResult;
import net.boyechko.aria.snapshot.validation.MatchResult;
import net.boyechko.aria.snapshot.validation.TreeMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates one attempt of an accessibility snapshot assertion: parses the expected template,
 * matches it against the captured tree, builds the failure message and, depending on the {@link
 * UpdateMode}, writes the regexified rendering back as the new baseline.
 *
 * <p>Instances hold no state between attempts; a retry loop calls again with a fresh capture.
 */
public class AriaSnapshotAssertion {
    private static final Logger logger = LoggerFactory.getLogger(AriaSnapshotAssertion.class);

    /** Template evaluated in place of a missing baseline; no real element carries its name. */
    static final String GENERATING_TEMPLATE = "- none \"Generating new baseline\"";

    static final String NEGATED_GENERATION_MESSAGE =
            "Matchers using \".not\" can't generate new baselines";
    static final String INLINE_MISSING_MESSAGE =
            "A snapshot is not provided, generating new baseline.";
    static final String INLINE_UPDATE_MESSAGE =
            "Inline snapshot differs; replace it with the suggested baseline.";
    static final String ELEMENT_NOT_FOUND = "<element not found>";

    private final UpdateMode updateMode;
    private final BaselineStore baselineStore;
    private final Regexifier regexifier;
    private final TreeMatcher matcher;

    public static class AriaSnapshotAssertionBuilder {
        private UpdateMode updateMode = UpdateMode.NONE;
        private BaselineStore baselineStore;
        private Regexifier regexifier = new Regexifier();
        private boolean descendantSearch = true;

        public AriaSnapshotAssertionBuilder withUpdateMode(UpdateMode updateMode) {
            this.updateMode = updateMode;
            return this;
        }

        public AriaSnapshotAssertionBuilder withBaselineStore(BaselineStore baselineStore) {
            this.baselineStore = baselineStore;
            return this;
        }

        public AriaSnapshotAssertionBuilder withRegexifier(Regexifier regexifier) {
            this.regexifier = regexifier;
            return this;
        }

        /** Whether the template may match below the captured root; on by default. */
        public AriaSnapshotAssertionBuilder withDescendantSearch(boolean descendantSearch) {
            this.descendantSearch = descendantSearch;
            return this;
        }

        public AriaSnapshotAssertion build() {
            return new AriaSnapshotAssertion(this);
        }
    }

    private AriaSnapshotAssertion(AriaSnapshotAssertionBuilder builder) {
        this.updateMode = builder.updateMode;
        this.baselineStore = builder.baselineStore;
        this.regexifier = builder.regexifier;
        this.matcher = new TreeMatcher(builder.descendantSearch);
    }

    public static AriaSnapshotAssertionBuilder builder() {
        return new AriaSnapshotAssertionBuilder();
    }

    public UpdateMode updateMode() {
        return updateMode;
    }

    /**
     * Asserts against a template given inline. A blank template counts as missing.
     *
     * @throws net.boyechko.aria.snapshot.template.TemplateSyntaxException if the template is malformed
     */
    public AssertionOutcome assertInline(String expected, CaptureResult capture, boolean negated) {
        String text = expected == null ? "" : expected;
        return evaluate(text, capture, negated, null);
    }

    /**
     * Asserts against the baseline stored under {@code name}.
     *
     * @throws IllegalStateException if no baseline store is configured
     * @throws net.boyechko.aria.snapshot.template.TemplateSyntaxException if the baseline is malformed
     */
    public AssertionOutcome assertBaseline(String name, CaptureResult capture, boolean negated) {
        if (baselineStore == null) {
            throw new IllegalStateException("No baseline store configured");
        }
        Optional<String> stored = baselineStore.read(name);
        return evaluate(stored.orElse(""), capture, negated, name);
    }

    private AssertionOutcome evaluate(
            String expectedText, CaptureResult capture, boolean negated, String baselineName) {
        Objects.requireNonNull(capture, "capture");
        boolean generateMissing = updateMode == UpdateMode.MISSING && expectedText.isBlank();
        if (generateMissing) {
            if (negated) {
                return AssertionOutcome.failed(NEGATED_GENERATION_MESSAGE, "", null);
            }
            expectedText = GENERATING_TEMPLATE;
        }

        String expected = TemplateParser.unshift(expectedText);
        TemplateNode template = TemplateParser.parse(expectedText);

        if (capture instanceof CaptureResult.ElementNotFound notFound) {
            logger.debug("No element found for {}", notFound.locator());
            return AssertionOutcome.failed(
                    "Expected: " + expected + "\nReceived: " + ELEMENT_NOT_FOUND, expected, null);
        }
        AriaNode snapshot = ((CaptureResult.Captured) capture).root();

        MatchResult result = matcher.match(template, snapshot);
        String raw = AriaRenderer.render(snapshot);
        String regex = regexifier.render(snapshot);

        boolean shouldUpdate =
                !negated
                        && (updateMode == UpdateMode.ALL
                                || (updateMode == UpdateMode.CHANGED && !result.matched())
                                || generateMissing);
        if (shouldUpdate) {
            return update(baselineName, expected, regex);
        }

        boolean pass = result.matched() != negated;
        String received = result.matched() ? raw : regex;
        if (pass) {
            return AssertionOutcome.passed(expected, received);
        }
        String message =
                result.matched()
                        ? "Expected: not " + expected + "\nReceived: " + raw
                        : DiffFormatter.printDiff(expected, regex);
        return AssertionOutcome.failed(message, expected, received);
    }

    private AssertionOutcome update(String baselineName, String expected, String regex) {
        if (baselineName != null) {
            baselineStore.write(baselineName, regex);
            String location = baselineStore.describe(baselineName);
            if (updateMode == UpdateMode.MISSING) {
                return AssertionOutcome.failed(
                        "A snapshot doesn't exist at " + location + ", writing actual.",
                        expected,
                        regex);
            }
            logger.info("A snapshot is generated at {}.", location);
            return AssertionOutcome.passed(expected, regex);
        }
        String message =
                updateMode == UpdateMode.MISSING ? INLINE_MISSING_MESSAGE : INLINE_UPDATE_MESSAGE;
        return AssertionOutcome.failed(message, expected, regex).withSuggestedBaseline(regex);
    }
}
