package com.prpilot.orchestrator.api.dto;

import com.prpilot.orchestrator.model.BackgroundTask;
import com.prpilot.orchestrator.model.RepositoryAnalysis;

import java.time.Instant;

/** Response body for GET /api/tasks/{taskId}. */
public record TaskResponse(
        String taskId,
        String kind,
        String status,
        Instant startedAt,
        int progressPercent,
        Instant completedAt,
        String requestId,
        Object result,
        ErrorResponse.ErrorBody error
) {
    public static TaskResponse from(BackgroundTask task) {
        Object result = task.getResult();
        if (result instanceof RepositoryAnalysis analysis) {
            result = AnalysisResponse.from(analysis);
        }
        return new TaskResponse(
                task.getId(),
                task.getKind().name().toLowerCase(),
                task.getStatus().name().toLowerCase(),
                task.getStartedAt(),
                task.getProgressPercent(),
                task.getCompletedAt(),
                task.getRequestId(),
                result,
                task.getError() == null ? null : ErrorResponse.ErrorBody.from(task.getError()));
    }
}
