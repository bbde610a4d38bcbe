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
package net.boyechko.aria.snapshot.ui.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.boyechko.aria.snapshot.core.AriaSnapshotAssertion;
import net.boyechko.aria.snapshot.core.AssertionOutcome;
import net.boyechko.aria.snapshot.core.FileBaselineStore;
import net.boyechko.aria.snapshot.core.UpdateMode;
import net.boyechko.aria.snapshot.core.VerbosityLevel;
import net.boyechko.aria.snapshot.render.AriaRenderer;
import net.boyechko.aria.snapshot.render.DiffFormatter;
import net.boyechko.aria.snapshot.render.Regexifier;
import net.boyechko.aria.snapshot.template.TemplateParser;
import net.boyechko.aria.snapshot.template.TemplateSyntaxException;
import net.boyechko.aria.snapshot.tree.AriaNode;
import net.boyechko.aria.snapshot.tree.CaptureResult;
import net.boyechko.aria.snapshot.tree.SnapshotLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Checks a captured snapshot (YAML) against an expected template file. */
public class AriaSnapshotCLI {
    private static final Logger logger = LoggerFactory.getLogger(AriaSnapshotCLI.class);

    static final int EXIT_PASS = 0;
    static final int EXIT_FAIL = 1;

    /** What to print instead of, or as, the assertion. */
    public enum OutputMode {
        MATCH,
        RENDER,
        REGEX
    }

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path expectedPath,
            Path snapshotPath,
            boolean negated,
            UpdateMode updateMode,
            OutputMode outputMode,
            boolean unifiedDiff,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (snapshotPath == null) {
                throw new IllegalArgumentException("Snapshot path is required");
            }
            if (outputMode == OutputMode.MATCH && expectedPath == null) {
                throw new IllegalArgumentException("Expected template path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        Path firstPath;
        Path secondPath;
        boolean negated;
        UpdateMode updateMode = UpdateMode.NONE;
        OutputMode outputMode = OutputMode.MATCH;
        boolean unifiedDiff;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (firstPath == null) {
                throw new CLIException("No snapshot file specified");
            }
            // --render and --regex take only the snapshot
            Path expectedPath = outputMode == OutputMode.MATCH ? firstPath : null;
            Path snapshotPath = outputMode == OutputMode.MATCH ? secondPath : firstPath;
            if (outputMode == OutputMode.MATCH && snapshotPath == null) {
                throw new CLIException("No snapshot file specified");
            }
            if (outputMode != OutputMode.MATCH && secondPath != null) {
                throw new CLIException("Too many files specified");
            }
            if (!Files.exists(snapshotPath)) {
                throw new CLIException("File not found: " + snapshotPath);
            }
            if (expectedPath != null && updateMode == UpdateMode.NONE && !Files.exists(expectedPath)) {
                throw new CLIException("File not found: " + expectedPath);
            }
            if (updateMode != UpdateMode.NONE && baselineName(expectedPath) == null) {
                throw new CLIException(
                        "--update requires an expected file ending in "
                                + FileBaselineStore.EXTENSION
                                + " or "
                                + FileBaselineStore.LEGACY_EXTENSION);
            }
            return new CLIConfig(
                    expectedPath,
                    snapshotPath,
                    negated,
                    updateMode,
                    outputMode,
                    unifiedDiff,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the command and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return EXIT_PASS;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            return execute(config, out, err);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAIL;
        } catch (TemplateSyntaxException e) {
            logger.error("Template error at {}", e.position());
            err.println("✗ " + e.formatted());
            return EXIT_FAIL;
        } catch (IllegalArgumentException | UncheckedIOException e) {
            logger.error("Failed to run assertion", e);
            err.println("✗ " + e.getMessage());
            return EXIT_FAIL;
        }
    }

    static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No files specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (String arg : args) {
            if (arg.startsWith("--update=")) {
                String key = arg.substring("--update=".length());
                b.updateMode =
                        UpdateMode.fromKey(key)
                                .orElseThrow(
                                        () ->
                                                new CLIException(
                                                        "Unknown update mode: "
                                                                + key
                                                                + " (expected none, missing,"
                                                                + " changed or all)"));
            } else {
                switch (arg) {
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-n", "--not" -> b.negated = true;
                    case "--render" -> b.outputMode = OutputMode.RENDER;
                    case "--regex" -> b.outputMode = OutputMode.REGEX;
                    case "--diff" -> b.unifiedDiff = true;
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new CLIException("Unknown option: " + arg);
                        } else if (b.firstPath == null) {
                            b.firstPath = Paths.get(arg);
                        } else if (b.secondPath == null) {
                            b.secondPath = Paths.get(arg);
                        } else {
                            throw new CLIException("Too many files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    static void configureLogging(VerbosityLevel verbosity) {
        ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger)
                        LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(verbosity.logLevel());
    }

    private static int execute(CLIConfig config, PrintStream out, PrintStream err) {
        AriaNode snapshot = SnapshotLoader.fromFile(config.snapshotPath());
        Regexifier regexifier = new Regexifier();

        if (config.outputMode() == OutputMode.RENDER) {
            out.println(AriaRenderer.render(snapshot));
            return EXIT_PASS;
        }
        if (config.outputMode() == OutputMode.REGEX) {
            out.println(regexifier.render(snapshot));
            return EXIT_PASS;
        }

        AriaSnapshotAssertion.AriaSnapshotAssertionBuilder builder =
                AriaSnapshotAssertion.builder()
                        .withUpdateMode(config.updateMode())
                        .withRegexifier(regexifier);
        AssertionOutcome outcome;
        String baselineName = baselineName(config.expectedPath());
        if (config.updateMode() != UpdateMode.NONE) {
            Path directory = config.expectedPath().toAbsolutePath().getParent();
            AriaSnapshotAssertion assertion =
                    builder.withBaselineStore(new FileBaselineStore(directory)).build();
            outcome = assertion.assertBaseline(
                    baselineName, CaptureResult.captured(snapshot), config.negated());
        } else {
            AriaSnapshotAssertion assertion = builder.build();
            outcome =
                    assertion.assertInline(
                            readExpected(config.expectedPath()),
                            CaptureResult.captured(snapshot),
                            config.negated());
        }

        if (outcome.pass()) {
            out.println("✓ Snapshot matches " + config.expectedPath());
            return EXIT_PASS;
        }
        err.println("✗ Snapshot does not match " + config.expectedPath());
        err.println();
        if (config.unifiedDiff() && outcome.received() != null && !config.negated()) {
            err.println(DiffFormatter.unifiedDiff(outcome.expected(), outcome.received()));
        } else {
            err.println(outcome.message());
        }
        return EXIT_FAIL;
    }

    private static String readExpected(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /** Returns the baseline name of an expected file, or null if it has no baseline extension. */
    static String baselineName(Path expectedPath) {
        if (expectedPath == null) return null;
        String fileName = expectedPath.getFileName().toString();
        if (fileName.endsWith(FileBaselineStore.EXTENSION)) {
            return fileName.substring(0, fileName.length() - FileBaselineStore.EXTENSION.length());
        }
        if (fileName.endsWith(FileBaselineStore.LEGACY_EXTENSION)) {
            return fileName.substring(
                    0, fileName.length() - FileBaselineStore.LEGACY_EXTENSION.length());
        }
        return null;
    }

    static String usageMessage() {
        return "Usage: aria-snapshot [-q|-v|-vv] [-n] [--update=<mode>] [--diff]"
                + " <expected.aria.yml> <snapshot.yml>\n"
                + "       aria-snapshot --render|--regex <snapshot.yml>\n"
                + "  -h, --help        Show this help message\n"
                + "  -q, --quiet       Only log errors\n"
                + "  -v, --verbose     Log baseline updates\n"
                + "  -vv, --debug      Log parser and matcher details\n"
                + "  -n, --not         Expect the snapshot NOT to match\n"
                + "  --update=<mode>   Rewrite the expected file: none, missing, changed or all\n"
                + "  --render          Print the snapshot in template form and exit\n"
                + "  --regex           Print the suggested baseline (dynamic text as regex) and exit\n"
                + "  --diff            Show a unified diff instead of the annotated one\n"
                + "Exit code is 0 when the assertion holds, 1 otherwise.";
    }
}
