package com.prpilot.orchestrator.model;

public enum StepStatus {
    PENDING,     // started, not finished
    COMPLETED,
    FAILED
}
