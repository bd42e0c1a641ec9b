package com.prpilot.orchestrator.diff;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import com.prpilot.orchestrator.model.ChangeOperation;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented diffs between original and proposed file content.
 *
 * A missing side is treated as an empty file, so a create diffs against
 * nothing and a delete diffs to nothing. Output depends only on the inputs.
 */
public final class DiffCalculator {

    private static final int    CONTEXT_LINES = 3;
    static final String         NO_NEWLINE    = "\\ No newline at end of file";

    private DiffCalculator() {}

    public static FileDiff calculateDiff(String path, String original, String proposed) {
        List<String> originalLines = toLines(original);
        List<String> proposedLines = toLines(proposed);

        Patch<String> patch = DiffUtils.diff(originalLines, proposedLines);

        int additions = 0;
        int deletions = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            deletions += delta.getSource().size();
            additions += delta.getTarget().size();
        }

        List<String> unified = patch.getDeltas().isEmpty()
                ? List.of()
                : UnifiedDiffUtils.generateUnifiedDiff(
                        original == null ? "/dev/null" : "a/" + path,
                        proposed == null ? "/dev/null" : "b/" + path,
                        originalLines, patch, CONTEXT_LINES)
                        .stream()
                        .flatMap(String::lines)
                        .toList();

        return new FileDiff(path, changeType(original, proposed), unified, additions, deletions);
    }

    private static ChangeOperation changeType(String original, String proposed) {
        if (original == null) return ChangeOperation.CREATE;
        if (proposed == null) return ChangeOperation.DELETE;
        return ChangeOperation.MODIFY;
    }

    /**
     * An unterminated last line carries git's marker, so "a" and "a\n"
     * differ by one line and the marker shows up in the unified output.
     */
    private static List<String> toLines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>(content.lines().toList());
        char last = content.charAt(content.length() - 1);
        if (last != '\n' && last != '\r') {
            int end = lines.size() - 1;
            lines.set(end, lines.get(end) + "\n" + NO_NEWLINE);
        }
        return lines;
    }
}
