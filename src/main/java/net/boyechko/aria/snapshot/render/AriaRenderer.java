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
import java.util.Map;
import java.util.function.Function;
import net.boyechko.aria.snapshot.template.TemplateNode;
import net.boyechko.aria.snapshot.template.TextMatcher;
import net.boyechko.aria.snapshot.template.TextNormalizer;
import net.boyechko.aria.snapshot.tree.AriaAttribute;
import net.boyechko.aria.snapshot.tree.AriaNode;

/**
 * Writes template trees, and captured trees viewed as templates, back into the template language.
 * Output uses two-space indentation and no trailing newline.
 */
public final class AriaRenderer {
    private static final String INDENT = "  ";

    private AriaRenderer() {}

    public static String render(TemplateNode root) {
        List<String> lines = new ArrayList<>();
        if (root.isFragment()) {
            renderBlock(root, "", lines);
        } else {
            renderNode(root, "", lines);
        }
        return String.join("\n", lines);
    }

    /** Renders a captured tree with literal names and text. */
    public static String render(AriaNode root) {
        return render(toTemplate(root, AriaRenderer::literal));
    }

    /**
     * Converts a captured tree into the template that describes it exactly. {@code textMapper}
     * turns names and text into matchers; urls always stay literal. A node whose only child is
     * text collapses into the {@code role: text} shorthand.
     */
    public static TemplateNode toTemplate(AriaNode node, Function<String, TextMatcher> textMapper) {
        if (node.isText()) {
            return TemplateNode.textNode(textMapper.apply(node.name()), null);
        }
        TemplateNode.Builder builder = TemplateNode.builder(node.role());
        if (!node.isFragment() && !TextNormalizer.normalize(node.name()).isEmpty()) {
            builder.withName(textMapper.apply(node.name()));
        }
        for (Map.Entry<AriaAttribute, Object> attribute : node.attributes().asMap().entrySet()) {
            builder.withAttribute(attribute.getKey(), attribute.getValue());
        }
        if (node.url() != null) {
            builder.withProperty(TemplateNode.URL_PROPERTY, literal(node.url()));
        }

        List<AriaNode> children =
                node.children().stream()
                        .filter(c -> !c.isText() || !TextNormalizer.normalize(c.name()).isEmpty())
                        .toList();
        if (children.size() == 1 && children.get(0).isText() && repeatsName(node, children.get(0))) {
            children = List.of();
        }
        if (!node.isFragment() && children.size() == 1 && children.get(0).isText()) {
            builder.withText(textMapper.apply(children.get(0).name()));
        } else {
            for (AriaNode child : children) {
                builder.withChild(toTemplate(child, textMapper));
            }
        }
        return builder.build();
    }

    /** A lone text child that repeats the node's name adds nothing to the rendering. */
    private static boolean repeatsName(AriaNode node, AriaNode text) {
        String name = TextNormalizer.normalize(node.name());
        return !name.isEmpty() && name.equals(TextNormalizer.normalize(text.name()));
    }

    private static TextMatcher literal(String value) {
        return TextMatcher.literal(TextNormalizer.normalize(value));
    }

    private static void renderNode(TemplateNode node, String indent, List<String> lines) {
        if (node.isText()) {
            lines.add(indent + "- text: " + renderText(node.text()));
            return;
        }
        String key = renderKey(node);
        boolean hasBlock =
                !node.children().isEmpty()
                        || node.containerMode() != null
                        || !node.properties().isEmpty();
        if (!hasBlock) {
            String text = node.text() != null ? ": " + renderText(node.text()) : "";
            lines.add(indent + "- " + key + text);
            return;
        }
        lines.add(indent + "- " + key + ":");
        String inner = indent + INDENT;
        renderBlock(node, inner, lines);
    }

    /** Directives first, then the text shorthand as a text item, then the children. */
    private static void renderBlock(TemplateNode node, String indent, List<String> lines) {
        if (node.containerMode() != null) {
            lines.add(indent + "- /children: " + node.containerMode().key());
        }
        for (Map.Entry<String, TextMatcher> property : node.properties().entrySet()) {
            lines.add(indent + "- /" + property.getKey() + ": " + renderText(property.getValue()));
        }
        if (node.text() != null && !node.isText()) {
            lines.add(indent + "- text: " + renderText(node.text()));
        }
        for (TemplateNode child : node.children()) {
            renderNode(child, indent, lines);
        }
    }

    private static String renderKey(TemplateNode node) {
        StringBuilder key = new StringBuilder(node.role());
        if (node.name() != null) {
            key.append(' ').append(renderName(node.name()));
        }
        for (Map.Entry<AriaAttribute, Object> attribute : node.attributes().asMap().entrySet()) {
            String value = String.valueOf(attribute.getValue());
            key.append(" [").append(attribute.getKey().key());
            if (!"true".equals(value)) {
                key.append('=').append(value);
            }
            key.append(']');
        }
        return key.toString();
    }

    private static String renderName(TextMatcher name) {
        if (name instanceof TextMatcher.Regex regex) {
            return "/" + regex.source() + "/";
        }
        return YamlScalars.quote(((TextMatcher.Literal) name).value());
    }

    private static String renderText(TextMatcher text) {
        if (text instanceof TextMatcher.Regex regex) {
            return YamlScalars.escapeIfNeeded("/" + regex.source() + "/");
        }
        String value = ((TextMatcher.Literal) text).value();
        if (value.length() >= 2 && value.startsWith("/") && value.endsWith("/")) {
            // bare /x/ reads back as a regex, so pin it to the exact value
            return YamlScalars.escapeIfNeeded("/^" + RegexifyPolicy.escape(value) + "$/");
        }
        return YamlScalars.escapeIfNeeded(value);
    }
}
