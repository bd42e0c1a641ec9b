package com.prpilot.orchestrator.api.dto;

import com.prpilot.orchestrator.model.WorkflowStep;

import java.time.Instant;
import java.util.Map;

public record StepResponse(
        String name,
        String status,
        Map<String, String> result,
        String errorMessage,
        String errorCode,
        Instant startedAt,
        Instant finishedAt,
        Instant timestamp
) {
    public static StepResponse from(WorkflowStep step) {
        return new StepResponse(
                step.getName().wireName(),
                step.getStatus().name().toLowerCase(),
                step.getResult(),
                step.getErrorMessage(),
                step.getErrorCode() == null ? null : step.getErrorCode().code(),
                step.getStartedAt(),
                step.getFinishedAt(),
                step.getTimestamp());
    }
}
