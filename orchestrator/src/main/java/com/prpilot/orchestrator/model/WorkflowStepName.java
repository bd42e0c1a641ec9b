package com.prpilot.orchestrator.model;

import java.util.List;

/** The six steps of a workflow run, in execution order. */
public enum WorkflowStepName {
    ANALYZE_REPOSITORY("analyze_repository"),
    GENERATE_CHANGES("generate_changes"),
    VALIDATE_CHANGES("validate_changes"),
    PREPARE_BRANCH("create_branch"),
    COMMIT_CHANGES("commit_changes"),
    CREATE_PULL_REQUEST("create_pull_request");

    public static final List<WorkflowStepName> SEQUENCE = List.of(values());

    private final String wireName;

    WorkflowStepName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
