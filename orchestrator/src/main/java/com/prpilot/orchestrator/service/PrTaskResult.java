package com.prpilot.orchestrator.service;

import com.prpilot.orchestrator.model.CompletionStatus;

/** What a finished PR-creation task reports to pollers. */
public record PrTaskResult(
        String requestId,
        String workflowId,
        CompletionStatus completion,
        String branchName,
        String prUrl,
        Integer prNumber
) {}
