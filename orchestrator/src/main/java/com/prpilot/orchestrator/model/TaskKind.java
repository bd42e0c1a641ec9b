package com.prpilot.orchestrator.model;

public enum TaskKind {
    PR_CREATION,
    REPOSITORY_ANALYSIS
}
