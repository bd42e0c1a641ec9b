package com.prpilot.orchestrator.model;

public enum CompletionStatus {
    SUCCESS,   // PR open and fully decorated
    PARTIAL,   // PR open but labels could not be applied
    FAILED
}
