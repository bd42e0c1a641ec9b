package com.prpilot.orchestrator.api.dto;

import com.prpilot.orchestrator.model.RepositoryAnalysis;

import java.util.List;
import java.util.Map;

public record AnalysisResponse(
        String repository,
        String description,
        String defaultBranch,
        String primaryLanguage,
        Map<String, Long> languages,
        List<String> frameworks,
        int filesCount,
        String readmeExcerpt
) {
    public static AnalysisResponse from(RepositoryAnalysis a) {
        return new AnalysisResponse(
                a.repository().toString(),
                a.description(),
                a.defaultBranch(),
                a.primaryLanguage(),
                a.languages(),
                a.frameworks(),
                a.files().size(),
                a.readmeExcerpt());
    }
}
