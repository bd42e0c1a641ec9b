package com.prpilot.orchestrator.gateway;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Repository metadata as reported by the remote.
 *
 * @param languages     bytes of code per language
 * @param readmeExcerpt first part of the README, or null when there is none
 */
public record RepositorySummary(
        String fullName,
        String description,
        String defaultBranch,
        String htmlUrl,
        boolean privateRepository,
        String primaryLanguage,
        Map<String, Long> languages,
        String readmeExcerpt
) {
    public RepositorySummary {
        languages = languages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(languages));
    }
}
