package com.prpilot.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Context gathered by the analyze step and handed to the code generator.
 *
 * @param languages  bytes of code per language, as reported by the remote
 * @param frameworks best-effort detection from marker files
 */
public record RepositoryAnalysis(
        RepositoryLocator repository,
        String description,
        String defaultBranch,
        Map<String, Long> languages,
        String primaryLanguage,
        List<String> frameworks,
        List<String> files,
        String readmeExcerpt
) {
    public RepositoryAnalysis {
        languages  = languages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(languages));
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
        files      = files == null ? List.of() : List.copyOf(files);
    }

    public boolean containsFile(String path) {
        return files.contains(path);
    }
}
