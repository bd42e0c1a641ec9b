package com.prpilot.orchestrator.api.dto;

import com.prpilot.orchestrator.model.PrRequest;
import com.prpilot.orchestrator.model.WorkflowRun;

import java.time.Instant;
import java.util.List;

/** Response body for GET /api/pr/{requestId}: the request plus its run's ordered steps. */
public record PrStatusResponse(
        String requestId,
        String status,
        String repositoryLocator,
        String freeTextRequest,
        boolean autoMerge,
        Instant createdAt,
        Instant updatedAt,
        String prUrl,
        ErrorResponse.ErrorBody error,
        Workflow workflow
) {
    public record Workflow(String workflowId,
                           String completion,
                           String branchName,
                           String baseBranch,
                           String prTitle,
                           String prUrl,
                           Integer prNumber,
                           List<String> committedFiles,
                           Instant createdAt,
                           Instant completedAt,
                           List<StepResponse> steps) {

        public static Workflow from(WorkflowRun run) {
            return new Workflow(
                    run.getId(),
                    run.getCompletion() == null ? null : run.getCompletion().name().toLowerCase(),
                    run.getBranchName(),
                    run.getBaseBranch(),
                    run.getPrTitle(),
                    run.getPrUrl(),
                    run.getPrNumber(),
                    run.getCommittedFiles(),
                    run.getCreatedAt(),
                    run.getCompletedAt(),
                    run.getSteps().stream().map(StepResponse::from).toList());
        }
    }

    public static PrStatusResponse from(PrRequest request, WorkflowRun run) {
        return new PrStatusResponse(
                request.getId(),
                request.getStatus().name().toLowerCase(),
                request.getRepository().toString(),
                request.getFreeTextRequest(),
                request.getOptions().autoMerge(),
                request.getCreatedAt(),
                request.getUpdatedAt(),
                request.getPrUrl(),
                request.getError() == null ? null : ErrorResponse.ErrorBody.from(request.getError()),
                run == null ? null : Workflow.from(run));
    }
}
