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

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import java.util.ArrayList;
import java.util.List;

/** Line diffs between an expected template and a rendered captured tree. */
public final class DiffFormatter {
    private static final int CONTEXT_LINES = 2;

    private DiffFormatter() {}

    /** Standard unified diff with {@code ---/+++/@@} headers; empty when the texts are equal. */
    public static String unifiedDiff(String expected, String received) {
        List<String> expectedLines = expected.lines().toList();
        List<String> receivedLines = received.lines().toList();
        Patch<String> patch = DiffUtils.diff(expectedLines, receivedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> diff =
                UnifiedDiffUtils.generateUnifiedDiff(
                        "expected", "received", expectedLines, patch, CONTEXT_LINES);
        return String.join("\n", diff);
    }

    /**
     * Full annotated diff: a {@code - Expected  - N} / {@code + Received  + M} header, then every
     * line prefixed with {@code "- "}, {@code "+ "} or two spaces.
     */
    public static String printDiff(String expected, String received) {
        List<String> expectedLines = expected.lines().toList();
        List<String> receivedLines = received.lines().toList();
        Patch<String> patch = DiffUtils.diff(expectedLines, receivedLines);

        List<String> body = new ArrayList<>();
        int removed = 0;
        int added = 0;
        int next = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            int start = delta.getSource().getPosition();
            while (next < start) {
                body.add("  " + expectedLines.get(next++));
            }
            for (String line : delta.getSource().getLines()) {
                body.add("- " + line);
                removed++;
            }
            for (String line : delta.getTarget().getLines()) {
                body.add("+ " + line);
                added++;
            }
            next = start + delta.getSource().size();
        }
        while (next < expectedLines.size()) {
            body.add("  " + expectedLines.get(next++));
        }

        return "- Expected  - "
                + removed
                + "\n+ Received  + "
                + added
                + "\n\n"
                + String.join("\n", body);
    }
}
