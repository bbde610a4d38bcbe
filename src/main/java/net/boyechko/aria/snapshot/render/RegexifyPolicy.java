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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered rules recognizing dynamic-looking substrings (sizes, durations, grouped and decimal
 * numbers). At each position of a value the first rule that matches wins; everything between
 * matches is kept as escaped literal text.
 */
public final class RegexifyPolicy {
    private static final String REGEX_SPECIALS = ".*+?^${}()|[]\\/";

    /**
     * A named recognizer.
     *
     * @param name identifies the rule for replacement or removal
     * @param pattern what to recognize; {@code \b} sees the characters around the match
     * @param replacement regex source emitted in place of the match
     */
    public record Rule(String name, Pattern pattern, String replacement) {
        public Rule {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(replacement, "replacement");
        }

        public static Rule of(String name, String regex, String replacement) {
            return new Rule(name, Pattern.compile(regex), replacement);
        }
    }

    private static final List<Rule> DEFAULT_RULES =
            List.of(
                    Rule.of("size", "\\b[\\d,.]+[bkmBKM]+\\b", "[\\d,.]+[bkmBKM]+"),
                    Rule.of("duration", "\\b\\d+[hmsp]+\\b", "\\d+[hmsp]+"),
                    Rule.of("fractional-duration", "\\b[\\d,.]+[hmsp]+\\b", "[\\d,.]+[hmsp]+"),
                    Rule.of("grouped-number", "\\b\\d+,\\d+\\b", "\\d+,\\d+"),
                    Rule.of("precise-decimal", "\\b\\d+\\.\\d{2,}\\b", "\\d+\\.\\d+"),
                    Rule.of("large-decimal", "\\b\\d{2,}\\.\\d+\\b", "\\d+\\.\\d+"),
                    Rule.of("integer", "\\b\\d{2,}\\b", "\\d+"));

    private static final RegexifyPolicy DEFAULTS = new RegexifyPolicy(DEFAULT_RULES);

    private final List<Rule> rules;

    private RegexifyPolicy(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RegexifyPolicy defaults() {
        return DEFAULTS;
    }

    /** Starts an empty policy; call {@link Builder#withDefaults()} to extend the default rules. */
    public static Builder builder() {
        return new Builder();
    }

    public List<Rule> rules() {
        return rules;
    }

    /**
     * Returns the regex source describing {@code text}, or empty when no rule matched anywhere and
     * the value should stay literal.
     */
    public Optional<String> toRegexSource(String text) {
        List<Matcher> matchers = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(text);
            matcher.useTransparentBounds(true);
            matcher.useAnchoringBounds(false);
            matchers.add(matcher);
        }

        StringBuilder source = new StringBuilder();
        boolean substituted = false;
        int pos = 0;
        scan:
        while (pos < text.length()) {
            for (int i = 0; i < matchers.size(); i++) {
                Matcher matcher = matchers.get(i);
                matcher.region(pos, text.length());
                if (matcher.lookingAt() && matcher.end() > pos) {
                    source.append(rules.get(i).replacement());
                    substituted = true;
                    pos = matcher.end();
                    continue scan;
                }
            }
            appendEscaped(source, text.charAt(pos++));
        }
        return substituted ? Optional.of(source.toString()) : Optional.empty();
    }

    /** Escapes {@code text} so that it reads as literal regex source between {@code /} delimiters. */
    static String escape(String text) {
        StringBuilder source = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            appendEscaped(source, text.charAt(i));
        }
        return source.toString();
    }

    private static void appendEscaped(StringBuilder source, char c) {
        if (REGEX_SPECIALS.indexOf(c) >= 0) {
            source.append('\\');
        }
        source.append(c);
    }

    public static final class Builder {
        private final List<Rule> rules = new ArrayList<>();

        private Builder() {}

        public Builder withDefaults() {
            DEFAULT_RULES.forEach(this::withRule);
            return this;
        }

        /** Adds a rule, replacing any rule of the same name in place. */
        public Builder withRule(Rule rule) {
            for (int i = 0; i < rules.size(); i++) {
                if (rules.get(i).name().equals(rule.name())) {
                    rules.set(i, rule);
                    return this;
                }
            }
            rules.add(rule);
            return this;
        }

        public Builder withRule(String name, String regex, String replacement) {
            return withRule(Rule.of(name, regex, replacement));
        }

        public Builder withoutRule(String name) {
            rules.removeIf(rule -> rule.name().equals(name));
            return this;
        }

        public RegexifyPolicy build() {
            return new RegexifyPolicy(rules);
        }
    }
}
