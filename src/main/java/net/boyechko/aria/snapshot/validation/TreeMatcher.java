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

import java.util.List;
import java.util.Map;
import net.boyechko.aria.snapshot.template.ContainerMode;
import net.boyechko.aria.snapshot.template.TemplateNode;
import net.boyechko.aria.snapshot.template.TextMatcher;
import net.boyechko.aria.snapshot.template.TextNormalizer;
import net.boyechko.aria.snapshot.tree.AriaAttribute;
import net.boyechko.aria.snapshot.tree.AriaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a parsed template matches a captured accessibility tree.
 *
 * <p>The template root stands for the list of top-level items; it is matched against the children
 * of the captured root under the root's {@code /children} mode. With descendant search enabled the
 * same list may instead match the children of any descendant, so a template can describe a
 * fragment nested anywhere below the captured element.
 */
public class TreeMatcher {
    private static final Logger logger = LoggerFactory.getLogger(TreeMatcher.class);

    /** Template role that stands for any element role. */
    public static final String WILDCARD_ROLE = "none";

    private final boolean searchDescendants;

    public TreeMatcher() {
        this(false);
    }

    public TreeMatcher(boolean searchDescendants) {
        this.searchDescendants = searchDescendants;
    }

    /** Returns whether the template's top-level items match the children of {@code snapshot}. */
    public boolean matches(TemplateNode template, AriaNode snapshot) {
        return match(template, snapshot).matched();
    }

    public MatchResult match(TemplateNode template, AriaNode snapshot) {
        AriaNode location = findMatch(template, snapshot);
        MatchResult result =
                location != null
                        ? MatchResult.matched(snapshot, location)
                        : MatchResult.mismatched(snapshot);
        logger.debug("Template {} the captured tree", result.matched() ? "matched" : "did not match");
        return result;
    }

    private AriaNode findMatch(TemplateNode template, AriaNode candidate) {
        if (matchesRoot(template, candidate)) {
            return candidate;
        }
        if (!searchDescendants) {
            return null;
        }
        for (AriaNode child : candidate.children()) {
            if (child.isText()) continue;
            AriaNode found = findMatch(template, child);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private boolean matchesRoot(TemplateNode template, AriaNode candidate) {
        if (template.isFragment()) {
            ContainerMode mode = effectiveMode(template, ContainerMode.CONTAIN);
            return matchesChildren(template.effectiveChildren(), candidate.children(), mode);
        }
        return matchesNode(template, candidate, ContainerMode.CONTAIN);
    }

    /**
     * Node-level predicate: role, name, attributes and url of {@code template} hold for {@code
     * node}, and its children match under the effective mode. A {@link #WILDCARD_ROLE} template
     * accepts any element role but never a text node.
     */
    boolean matchesNode(TemplateNode template, AriaNode node, ContainerMode parentMode) {
        if (template.isText()) {
            return node.isText() && matchesText(template.text(), node.name());
        }
        if (!template.isFragment()) {
            if (node.isText()) return false;
            if (!WILDCARD_ROLE.equals(template.role()) && !template.role().equals(node.role())) {
                return false;
            }
            if (template.name() != null && !matchesText(template.name(), node.name())) return false;
        }
        for (Map.Entry<AriaAttribute, Object> expected : template.attributes().asMap().entrySet()) {
            if (!expected.getValue().equals(node.attributes().get(expected.getKey()))) {
                return false;
            }
        }
        TextMatcher url = template.url();
        if (url != null && (node.url() == null || !url.matches(node.url()))) {
            return false;
        }
        ContainerMode mode = effectiveMode(template, parentMode);
        return matchesChildren(template.effectiveChildren(), node.children(), mode);
    }

    private boolean matchesChildren(
            List<TemplateNode> expected, List<AriaNode> actual, ContainerMode mode) {
        if (mode == ContainerMode.CONTAIN) {
            int next = 0;
            for (TemplateNode child : expected) {
                while (next < actual.size() && !matchesNode(child, actual.get(next), mode)) {
                    next++;
                }
                if (next == actual.size()) {
                    return false;
                }
                next++;
            }
            return true;
        }
        if (expected.size() != actual.size()) {
            return false;
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!matchesNode(expected.get(i), actual.get(i), mode)) {
                return false;
            }
        }
        return true;
    }

    /** The declared mode wins; otherwise deep-equal is inherited and anything else is contain. */
    private static ContainerMode effectiveMode(TemplateNode template, ContainerMode parentMode) {
        if (template.containerMode() != null) {
            return template.containerMode();
        }
        return parentMode == ContainerMode.DEEP_EQUAL ? ContainerMode.DEEP_EQUAL : ContainerMode.CONTAIN;
    }

    private static boolean matchesText(TextMatcher matcher, String value) {
        if (matcher instanceof TextMatcher.Literal) {
            return matcher.matches(TextNormalizer.normalize(value));
        }
        return matcher.matches(value);
    }
}
