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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.aria.snapshot.validation.AttributeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Builds a captured accessibility tree from a YAML description. The document is a list of entries;
 * a scalar entry is a text node, a mapping entry describes an element:
 *
 * <pre>
 * - role: heading
 *   name: Section Title
 *   level: 2
 * - role: list
 *   children:
 *     - role: listitem
 *       children: [One]
 * </pre>
 *
 * <p>Mapping keys are {@code role} (required), {@code name}, {@code url}, {@code children} and any
 * attribute key of {@link AriaAttribute}. Plain scalars are read as strings, so {@code No}, {@code
 * off} and {@code 007} keep their spelling.
 */
public final class SnapshotLoader {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotLoader.class);

    private static final Set<String> STRUCTURAL_KEYS = Set.of("role", "name", "url", "children");

    private SnapshotLoader() {}

    /** Parses a YAML snapshot description into a tree rooted at a fragment node. */
    public static AriaNode fromYaml(String yamlText) {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        Yaml yaml =
                new Yaml(
                        new SafeConstructor(loaderOptions),
                        new Representer(dumperOptions),
                        dumperOptions,
                        loaderOptions,
                        new StringResolver());
        Object document = yaml.load(yamlText);
        if (document == null) {
            return AriaNode.fragment();
        }
        if (!(document instanceof List<?> entries)) {
            throw new IllegalArgumentException(
                    "Snapshot must be a YAML sequence, got " + document.getClass().getSimpleName());
        }
        AriaNode root = AriaNode.fragment(toNodes(entries, ""));
        logger.debug("Loaded snapshot with {} top-level nodes", root.children().size());
        return root;
    }

    public static AriaNode fromFile(Path path) {
        try {
            return fromYaml(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + path, e);
        }
    }

    /**
     * Load a snapshot from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static AriaNode fromResource(String resourcePath) {
        try (InputStream in = SnapshotLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return fromYaml(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot resource " + resourcePath, e);
        }
    }

    private static List<AriaNode> toNodes(List<?> entries, String parentPath) {
        List<AriaNode> nodes = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            nodes.add(toNode(entries.get(i), parentPath + "/" + i));
        }
        return nodes;
    }

    private static AriaNode toNode(Object entry, String path) {
        if (entry == null) {
            throw new IllegalArgumentException("Empty snapshot entry at " + path);
        }
        if (!(entry instanceof Map<?, ?> map)) {
            return AriaNode.text(String.valueOf(entry));
        }

        Object role = map.get("role");
        if (isBlank(role)) {
            throw new IllegalArgumentException("Snapshot entry at " + path + " has no role");
        }
        AriaNode.Builder builder = AriaNode.builder(String.valueOf(role));
        if (!isBlank(map.get("name"))) {
            builder.withName(String.valueOf(map.get("name")));
        }
        if (!isBlank(map.get("url"))) {
            builder.withUrl(String.valueOf(map.get("url")));
        }

        for (Map.Entry<?, ?> field : map.entrySet()) {
            String key = String.valueOf(field.getKey());
            if (STRUCTURAL_KEYS.contains(key)) continue;
            AriaAttribute attribute =
                    AriaAttribute.fromKey(key)
                            .orElseThrow(
                                    () ->
                                            new IllegalArgumentException(
                                                    "Unsupported key '"
                                                            + key
                                                            + "' in snapshot entry at "
                                                            + path));
            Object value = AttributeValidator.validate(attribute, String.valueOf(field.getValue()));
            builder.withAttribute(attribute, value);
        }

        Object children = map.get("children");
        if (children instanceof List<?> list) {
            builder.withChildren(toNodes(list, path));
        } else if (!isBlank(children)) {
            throw new IllegalArgumentException(
                    "Children of snapshot entry at " + path + " must be a list");
        }
        return builder.build();
    }

    private static boolean isBlank(Object value) {
        return value == null || "".equals(value);
    }

    /** Resolves every plain scalar to a string; the snapshot has no typed scalars of its own. */
    private static final class StringResolver extends Resolver {
        @Override
        protected void addImplicitResolvers() {}
    }
}
