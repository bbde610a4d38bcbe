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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.boyechko.aria.snapshot.tree.AriaAttribute;
import net.boyechko.aria.snapshot.tree.AriaAttributes;
import net.boyechko.aria.snapshot.tree.AriaNode;

/**
 * One expected element of a parsed template. The parser returns a root node with role {@value
 * AriaNode#FRAGMENT_ROLE} whose children are the top-level template items; text items have role
 * {@value AriaNode#TEXT_ROLE} and carry their value in {@link #text()}.
 */
public final class TemplateNode {
    public static final String URL_PROPERTY = "url";

    private final String role;
    private final TextMatcher name;
    private final TextMatcher text;
    private final AriaAttributes attributes;
    private final List<TemplateNode> children;
    private final ContainerMode containerMode;
    private final Map<String, TextMatcher> properties;
    private final SourcePosition position;

    private TemplateNode(Builder builder) {
        this.role = builder.role;
        this.name = builder.name;
        this.text = builder.text;
        this.attributes = builder.attributes;
        this.children = List.copyOf(builder.children);
        this.containerMode = builder.containerMode;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
        this.position = builder.position;
    }

    public static Builder builder(String role) {
        return new Builder(role);
    }

    /** Creates a text item such as {@code - text: Hello} or {@code - "Hello"}. */
    public static TemplateNode textNode(TextMatcher text, SourcePosition position) {
        return new Builder(AriaNode.TEXT_ROLE).withText(text).at(position).build();
    }

    public String role() {
        return role;
    }

    /** Returns the name matcher, or null when any name is accepted. */
    public TextMatcher name() {
        return name;
    }

    /** Returns the text matcher of a leaf ({@code role: text}) or text item, else null. */
    public TextMatcher text() {
        return text;
    }

    public AriaAttributes attributes() {
        return attributes;
    }

    public List<TemplateNode> children() {
        return children;
    }

    /** Returns the declared {@code /children} mode, or null when the mode is inherited. */
    public ContainerMode containerMode() {
        return containerMode;
    }

    public Map<String, TextMatcher> properties() {
        return properties;
    }

    public TextMatcher url() {
        return properties.get(URL_PROPERTY);
    }

    /** Returns where the item was declared, or null for nodes built in code. */
    public SourcePosition position() {
        return position;
    }

    public boolean isFragment() {
        return AriaNode.FRAGMENT_ROLE.equals(role);
    }

    public boolean isText() {
        return AriaNode.TEXT_ROLE.equals(role);
    }

    /**
     * Returns the children to match against captured children. The leaf shorthand {@code role:
     * text} expands to a single text child.
     */
    public List<TemplateNode> effectiveChildren() {
        if (text == null || isText()) {
            return children;
        }
        List<TemplateNode> expanded = new ArrayList<>(children.size() + 1);
        expanded.add(textNode(text, position));
        expanded.addAll(children);
        return expanded;
    }

    /** Structural equality; source positions are ignored. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemplateNode other)) return false;
        return role.equals(other.role)
                && Objects.equals(name, other.name)
                && Objects.equals(text, other.text)
                && attributes.equals(other.attributes)
                && children.equals(other.children)
                && containerMode == other.containerMode
                && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, name, text, attributes, children, containerMode, properties);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(role);
        if (name != null) sb.append(' ').append(name);
        if (!attributes.isEmpty()) sb.append(' ').append(attributes);
        if (text != null) sb.append(": ").append(text);
        if (containerMode != null) sb.append(" /children=").append(containerMode.key());
        if (!children.isEmpty()) sb.append(' ').append(children);
        return sb.toString();
    }

    public static final class Builder {
        private final String role;
        private TextMatcher name;
        private TextMatcher text;
        private AriaAttributes attributes = AriaAttributes.empty();
        private final List<TemplateNode> children = new ArrayList<>();
        private ContainerMode containerMode;
        private final Map<String, TextMatcher> properties = new LinkedHashMap<>();
        private SourcePosition position;

        private Builder(String role) {
            if (role == null || role.isEmpty()) {
                throw new IllegalArgumentException("Role is required");
            }
            this.role = role;
        }

        public String role() {
            return role;
        }

        public Builder withName(TextMatcher name) {
            this.name = name;
            return this;
        }

        public Builder withText(TextMatcher text) {
            this.text = text;
            return this;
        }

        public Builder withAttribute(AriaAttribute attribute, Object value) {
            this.attributes = attributes.with(attribute, value);
            return this;
        }

        public Builder withChild(TemplateNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder withContainerMode(ContainerMode mode) {
            this.containerMode = mode;
            return this;
        }

        public Builder withProperty(String key, TextMatcher value) {
            properties.put(key, Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder at(SourcePosition position) {
            this.position = position;
            return this;
        }

        public TemplateNode build() {
            return new TemplateNode(this);
        }
    }
}
