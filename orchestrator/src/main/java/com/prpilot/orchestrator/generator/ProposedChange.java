package com.prpilot.orchestrator.generator;

import com.prpilot.orchestrator.model.ChangeOperation;

public record ProposedChange(
        String path,
        ChangeOperation operation,
        String originalContent,
        String proposedContent,
        String summary
) {
    public static ProposedChange create(String path, String content, String summary) {
        return new ProposedChange(path, ChangeOperation.CREATE, null, content, summary);
    }
}
