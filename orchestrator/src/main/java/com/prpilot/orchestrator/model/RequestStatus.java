package com.prpilot.orchestrator.model;

public enum RequestStatus {
    PENDING,      // accepted, not yet picked up
    PROCESSING,   // orchestrator is running the workflow
    COMPLETED,    // PR submitted
    FAILED;       // terminal failure, see the request's error

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
