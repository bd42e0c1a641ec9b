package com.prpilot.orchestrator.api;

import com.prpilot.orchestrator.api.dto.ErrorResponse;
import com.prpilot.orchestrator.api.dto.PrAcceptedResponse;
import com.prpilot.orchestrator.api.dto.PrStatusResponse;
import com.prpilot.orchestrator.api.dto.SubmitPrRequest;
import com.prpilot.orchestrator.api.dto.TaskAcceptedResponse;
import com.prpilot.orchestrator.error.NotFoundException;
import com.prpilot.orchestrator.model.BackgroundTask;
import com.prpilot.orchestrator.model.CompletionStatus;
import com.prpilot.orchestrator.model.ErrorDetail;
import com.prpilot.orchestrator.model.PrRequest;
import com.prpilot.orchestrator.model.WorkflowRun;
import com.prpilot.orchestrator.service.BackgroundTaskRunner;
import com.prpilot.orchestrator.service.PrWorkflowService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * REST API for pull-request workflows.
 *
 * POST /api/pr                run a workflow and answer once it is terminal
 * POST /api/pr/async          queue a workflow, answer 202 with a task handle
 * GET  /api/pr/{requestId}    the request plus its run's ordered steps
 */
@RestController
@RequestMapping("/api/pr")
public class PrController {

    private final PrWorkflowService    workflowService;
    private final BackgroundTaskRunner taskRunner;

    public PrController(PrWorkflowService workflowService, BackgroundTaskRunner taskRunner) {
        this.workflowService = workflowService;
        this.taskRunner      = taskRunner;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/pr \
     *     -H "Content-Type: application/json" \
     *     -d '{"freeTextRequest":"Add hello.py printing Hello World","repositoryLocator":"github.com/example/demo"}'
     *
     * 201 when the PR was opened; otherwise the status that matches the
     * failure classification, with the same body plus an error.
     */
    @PostMapping
    public ResponseEntity<PrAcceptedResponse> submit(@RequestBody SubmitPrRequest body) {
        PrWorkflowService.Accepted accepted = workflowService.submitBlocking(body.toSubmission());
        PrRequest   request = accepted.request();
        WorkflowRun run     = accepted.run();

        PrAcceptedResponse response = toAccepted(request, run);
        HttpStatus status = run.getCompletion() == CompletionStatus.FAILED
                ? ApiExceptionHandler.statusFor(run.getFailure().code())
                : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/async")
    public ResponseEntity<TaskAcceptedResponse> submitAsync(@RequestBody SubmitPrRequest body) {
        BackgroundTask task = taskRunner.submitPrCreation(body.toSubmission());
        return ResponseEntity.accepted().body(new TaskAcceptedResponse(
                task.getId(), task.getStatus().name().toLowerCase(),
                "/api/tasks/" + task.getId(), task.getRequestId()));
    }

    @GetMapping("/{requestId}")
    public PrStatusResponse getRequest(@PathVariable String requestId) {
        PrRequest request = workflowService.findRequest(requestId)
                .orElseThrow(() -> new NotFoundException("Request not found: " + requestId));
        return PrStatusResponse.from(request, workflowService.findRun(requestId).orElse(null));
    }

    // ------------------------------------------------------------------
    // Mapping
    // ------------------------------------------------------------------

    static PrAcceptedResponse toAccepted(PrRequest request, WorkflowRun run) {
        ErrorDetail failure = run.getFailure();
        CompletionStatus completion = run.getCompletion();

        String message;
        List<String> nextSteps = new ArrayList<>();
        if (completion == CompletionStatus.FAILED) {
            String at = run.currentStep().map(s -> s.getName().wireName()).orElse("submission");
            message = "Workflow failed at " + at + ": " + failure.message();
            nextSteps.addAll(failure.suggestions());
            if (run.getBranchName() != null) {
                nextSteps.add("Branch '" + run.getBranchName() + "' was left on the remote for manual follow-up");
            }
        } else {
            message = completion == CompletionStatus.PARTIAL
                    ? "Pull request created, but labels could not be applied"
                    : "Pull request created";
            nextSteps.add("Review the pull request at " + run.getPrUrl());
            nextSteps.add("Request a review from a maintainer before merging");
            if (request.getOptions().autoMerge()) {
                nextSteps.add("Auto-merge was requested; merging is left to the repository's branch protection rules");
            }
            if (completion == CompletionStatus.PARTIAL) {
                nextSteps.add("Apply labels manually: " + failure.message());
            }
        }

        PrAcceptedResponse.WorkflowDetails details = new PrAcceptedResponse.WorkflowDetails(
                run.getBranchName(),
                run.getBaseBranch(),
                run.getPrTitle(),
                run.getPrDescription(),
                run.getPrUrl(),
                completion == null ? null : completion.name().toLowerCase(),
                nextSteps);

        return new PrAcceptedResponse(
                request.getId(),
                run.getId(),
                request.getStatus().name().toLowerCase(),
                message,
                details,
                completion == CompletionStatus.FAILED ? ErrorResponse.ErrorBody.from(failure) : null);
    }
}
