package com.prpilot.orchestrator.api.dto;

/**
 * Response body for the async submission endpoints (HTTP 202).
 *
 * @param requestId only set for PR-creation tasks
 */
public record TaskAcceptedResponse(String taskId, String status, String statusPollingLocation, String requestId) {}
