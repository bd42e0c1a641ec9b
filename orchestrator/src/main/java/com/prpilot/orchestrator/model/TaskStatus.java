package com.prpilot.orchestrator.model;

public enum TaskStatus {
    PROCESSING,
    COMPLETED,
    FAILED
}
