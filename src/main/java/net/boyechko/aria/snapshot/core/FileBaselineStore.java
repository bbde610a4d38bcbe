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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores baselines as {@code <name>.aria.yml} files in one directory. A legacy {@code <name>.yml}
 * file is used instead when only it exists.
 */
public class FileBaselineStore implements BaselineStore {
    private static final Logger logger = LoggerFactory.getLogger(FileBaselineStore.class);

    public static final String EXTENSION = ".aria.yml";
    public static final String LEGACY_EXTENSION = ".yml";

    private final Path directory;

    public FileBaselineStore(Path directory) {
        this.directory = directory;
    }

    /** Returns the file that backs {@code name}, preferring the current extension. */
    public Path resolve(String name) {
        Path current = directory.resolve(name + EXTENSION);
        Path legacy = directory.resolve(name + LEGACY_EXTENSION);
        return !Files.exists(current) && Files.exists(legacy) ? legacy : current;
    }

    @Override
    public Optional<String> read(String name) {
        Path file = resolve(name);
        if (!Files.exists(file)) {
            logger.debug("No baseline at {}", file);
            return Optional.empty();
        }
        if (!file.getFileName().toString().endsWith(EXTENSION)) {
            logger.warn("Using legacy baseline {}; rename it to {}{}", file, name, EXTENSION);
        }
        try {
            logger.debug("Reading baseline {}", file);
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read baseline " + file, e);
        }
    }

    @Override
    public void write(String name, String content) {
        Path file = resolve(name);
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, content.endsWith("\n") ? content : content + "\n");
            logger.info("Wrote baseline {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write baseline " + file, e);
        }
    }

    @Override
    public String describe(String name) {
        return resolve(name).toString();
    }
}
