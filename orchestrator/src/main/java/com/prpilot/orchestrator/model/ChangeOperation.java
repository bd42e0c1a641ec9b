package com.prpilot.orchestrator.model;

public enum ChangeOperation {
    CREATE,
    MODIFY,
    DELETE
}
