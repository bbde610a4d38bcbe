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
package net.boyechko.aria.snapshot.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One node of a captured accessibility tree. Text content is represented as child nodes with role
 * {@value #TEXT_ROLE} whose name holds the text; the captured root has role {@value
 * #FRAGMENT_ROLE}.
 */
public final class AriaNode {
    public static final String TEXT_ROLE = "text";
    public static final String FRAGMENT_ROLE = "fragment";

    private final String role;
    private final String name;
    private final AriaAttributes attributes;
    private final List<AriaNode> children;
    private final String url; // null when the node has no link target

    private AriaNode(Builder builder) {
        this.role = builder.role;
        this.name = builder.name;
        this.attributes = builder.attributes;
        this.children = List.copyOf(builder.children);
        this.url = builder.url;
    }

    public static Builder builder(String role) {
        return new Builder(role);
    }

    /** Creates a text node holding {@code content}. */
    public static AriaNode text(String content) {
        return new Builder(TEXT_ROLE).withName(content).build();
    }

    /** Creates the root of a captured tree. */
    public static AriaNode fragment(AriaNode... children) {
        return fragment(List.of(children));
    }

    public static AriaNode fragment(List<AriaNode> children) {
        return new Builder(FRAGMENT_ROLE).withChildren(children).build();
    }

    public String role() {
        return role;
    }

    /** Returns the accessible name, or the content of a text node; never null. */
    public String name() {
        return name;
    }

    public AriaAttributes attributes() {
        return attributes;
    }

    public List<AriaNode> children() {
        return children;
    }

    public String url() {
        return url;
    }

    public boolean isText() {
        return TEXT_ROLE.equals(role);
    }

    public boolean isFragment() {
        return FRAGMENT_ROLE.equals(role);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AriaNode other)) return false;
        return role.equals(other.role)
                && name.equals(other.name)
                && attributes.equals(other.attributes)
                && children.equals(other.children)
                && Objects.equals(url, other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, name, attributes, children, url);
    }

    /** Returns a compact bracket notation, e.g. {@code list[listitem["One"]]}. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isText()) {
            return sb.append('"').append(name).append('"').toString();
        }
        sb.append(role);
        if (!name.isEmpty()) {
            sb.append(" \"").append(name).append('"');
        }
        if (!children.isEmpty()) {
            sb.append('[');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(children.get(i));
            }
            sb.append(']');
        }
        return sb.toString();
    }

    public static final class Builder {
        private final String role;
        private String name = "";
        private AriaAttributes attributes = AriaAttributes.empty();
        private final List<AriaNode> children = new ArrayList<>();
        private String url;

        private Builder(String role) {
            if (role == null || role.isEmpty()) {
                throw new IllegalArgumentException("Role is required");
            }
            this.role = role;
        }

        public Builder withName(String name) {
            this.name = name != null ? name : "";
            return this;
        }

        public Builder withAttribute(AriaAttribute attribute, Object value) {
            this.attributes = attributes.with(attribute, value);
            return this;
        }

        public Builder withAttributes(AriaAttributes attributes) {
            this.attributes = Objects.requireNonNull(attributes, "attributes");
            return this;
        }

        public Builder withUrl(String url) {
            this.url = url;
            return this;
        }

        public Builder withChild(AriaNode child) {
            children.add(Objects.requireNonNull(child, "child"));
            return this;
        }

        public Builder withChildren(List<AriaNode> children) {
            for (AriaNode child : children) {
                withChild(child);
            }
            return this;
        }

        /** Appends a text child. */
        public Builder withText(String content) {
            return withChild(AriaNode.text(content));
        }

        public AriaNode build() {
            return new AriaNode(this);
        }
    }
}
