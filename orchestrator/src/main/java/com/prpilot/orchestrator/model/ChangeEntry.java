package com.prpilot.orchestrator.model;

import java.util.List;

/**
 * One proposed per-file operation. Immutable: the validator returns copies
 * carrying its verdict instead of mutating the generator's output.
 */
public record ChangeEntry(
        String id,
        String requestId,
        String path,
        ChangeOperation operation,
        String originalContent,
        String proposedContent,
        String summary,
        ValidationStatus validationStatus,
        List<String> validationMessages
) {
    public ChangeEntry {
        validationMessages = validationMessages == null ? List.of() : List.copyOf(validationMessages);
    }

    /** A fresh, not yet validated entry. */
    public static ChangeEntry proposed(String id, String requestId, String path, ChangeOperation operation,
                                       String originalContent, String proposedContent, String summary) {
        return new ChangeEntry(id, requestId, path, operation, originalContent, proposedContent,
                summary, null, List.of());
    }

    public ChangeEntry withVerdict(ValidationStatus status, List<String> messages) {
        return new ChangeEntry(id, requestId, path, operation, originalContent, proposedContent,
                summary, status, messages);
    }
}
