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

import net.boyechko.aria.snapshot.template.TemplateNode;
import net.boyechko.aria.snapshot.template.TextMatcher;
import net.boyechko.aria.snapshot.template.TextNormalizer;
import net.boyechko.aria.snapshot.tree.AriaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a captured tree into a template in which names and text with dynamic-looking content are
 * regexes. Used for the received side of a diff and for suggested baselines, never for matching.
 */
public class Regexifier {
    private static final Logger logger = LoggerFactory.getLogger(Regexifier.class);

    private final RegexifyPolicy policy;

    public Regexifier() {
        this(RegexifyPolicy.defaults());
    }

    public Regexifier(RegexifyPolicy policy) {
        this.policy = policy;
    }

    public TemplateNode regexify(AriaNode snapshot) {
        return AriaRenderer.toTemplate(snapshot, this::bestGuess);
    }

    /** Renders the regexified form of {@code snapshot} in the template language. */
    public String render(AriaNode snapshot) {
        return AriaRenderer.render(regexify(snapshot));
    }

    /** Returns a regex matcher when the policy finds dynamic content, else the literal text. */
    public TextMatcher bestGuess(String text) {
        String normalized = TextNormalizer.normalize(text);
        return policy.toRegexSource(normalized)
                .map(
                        source -> {
                            logger.debug("Regexified '{}' as /{}/", normalized, source);
                            return TextMatcher.regex(source);
                        })
                .orElseGet(() -> TextMatcher.literal(normalized));
    }
}
