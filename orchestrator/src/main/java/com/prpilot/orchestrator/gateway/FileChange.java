package com.prpilot.orchestrator.gateway;

import com.prpilot.orchestrator.model.ChangeEntry;
import com.prpilot.orchestrator.model.ChangeOperation;

/**
 * One file in a commit. {@code content} is null for deletions.
 */
public record FileChange(String path, String content) {

    public static FileChange of(ChangeEntry entry) {
        return new FileChange(entry.path(),
                entry.operation() == ChangeOperation.DELETE ? null : entry.proposedContent());
    }

    public boolean isDeletion() {
        return content == null;
    }
}
