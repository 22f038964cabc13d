package com.raditha.staleflag.rewrite;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for dry-run previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    /**
     * Generate a unified diff between the original and rewritten text of a unit.
     *
     * @param unitName  name shown in the diff header
     * @param original  text before the cleanup
     * @param rewritten text after the cleanup
     * @return Unified diff as string, empty when nothing changed
     */
    public String generateUnifiedDiff(String unitName, String original, String rewritten) {
        return generateUnifiedDiff(unitName, original, rewritten, 3);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(String unitName, String original, String rewritten, int contextLines) {
        List<String> before = Arrays.asList(original.split("\n", -1));
        List<String> after = Arrays.asList(rewritten.split("\n", -1));

        Patch<String> patch = DiffUtils.diff(before, after);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + unitName,
                "b/" + unitName,
                before,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}
