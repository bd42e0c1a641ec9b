package com.prpilot.orchestrator.api.dto;

import java.util.List;

/** Response body for POST /api/pr once the workflow is terminal. */
public record PrAcceptedResponse(
        String requestId,
        String workflowId,
        String status,
        String message,
        WorkflowDetails workflowDetails,
        ErrorResponse.ErrorBody error
) {
    public record WorkflowDetails(String branchName,
                                  String baseBranch,
                                  String prTitle,
                                  String prDescription,
                                  String prUrl,
                                  String completion,
                                  List<String> nextSteps) {}
}
