package com.prpilot.orchestrator.generator;

import com.prpilot.orchestrator.model.RepositoryAnalysis;

/**
 * @param baseBranch ref the generator reads existing files from
 */
public record GenerationRequest(
        String requestId,
        String freeTextRequest,
        RepositoryAnalysis analysis,
        String baseBranch
) {}
