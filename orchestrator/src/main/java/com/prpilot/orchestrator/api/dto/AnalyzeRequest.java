package com.prpilot.orchestrator.api.dto;

/** Request body for POST /api/repositories/analyze(/async). */
public record AnalyzeRequest(String repositoryLocator) {}
