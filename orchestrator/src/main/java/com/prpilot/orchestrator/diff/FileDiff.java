package com.prpilot.orchestrator.diff;

import com.prpilot.orchestrator.model.ChangeOperation;

import java.util.List;

/**
 * Line diff of one file.
 *
 * @param unifiedLines unified-format patch lines; empty when nothing changed
 */
public record FileDiff(
        String path,
        ChangeOperation changeType,
        List<String> unifiedLines,
        int additions,
        int deletions
) {
    public FileDiff {
        unifiedLines = List.copyOf(unifiedLines);
    }

    public boolean isEmpty() {
        return additions == 0 && deletions == 0;
    }

    public String unified() {
        return String.join("\n", unifiedLines);
    }
}
