package com.prpilot.orchestrator.service;

import com.prpilot.orchestrator.gateway.RepositoryGateway;
import com.prpilot.orchestrator.gateway.RepositorySummary;
import com.prpilot.orchestrator.model.RepositoryAnalysis;
import com.prpilot.orchestrator.model.RepositoryLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds the repository context the generator works from: remote metadata,
 * the file listing at the base ref and a best-effort guess at build tools and
 * frameworks from well-known marker files.
 */
@Service
public class RepositoryAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RepositoryAnalyzer.class);

    // Marker file name -> framework/tool label. Checked against file names at any depth.
    private static final Map<String, String> MARKER_FILES = new LinkedHashMap<>();
    static {
        MARKER_FILES.put("pom.xml",            "Maven");
        MARKER_FILES.put("build.gradle",       "Gradle");
        MARKER_FILES.put("build.gradle.kts",   "Gradle");
        MARKER_FILES.put("package.json",       "Node.js");
        MARKER_FILES.put("requirements.txt",   "pip");
        MARKER_FILES.put("pyproject.toml",     "Python packaging");
        MARKER_FILES.put("manage.py",          "Django");
        MARKER_FILES.put("Cargo.toml",         "Cargo");
        MARKER_FILES.put("go.mod",             "Go modules");
        MARKER_FILES.put("Gemfile",            "Bundler");
        MARKER_FILES.put("composer.json",      "Composer");
        MARKER_FILES.put("Dockerfile",         "Docker");
        MARKER_FILES.put("angular.json",       "Angular");
        MARKER_FILES.put("next.config.js",     "Next.js");
        MARKER_FILES.put("vite.config.ts",     "Vite");
        MARKER_FILES.put("vite.config.js",     "Vite");
    }

    // Path fragment -> framework label, for things recognisable from layout.
    private static final Map<String, String> MARKER_PATHS = new LinkedHashMap<>();
    static {
        MARKER_PATHS.put("src/main/resources/application", "Spring Boot");
        MARKER_PATHS.put(".github/workflows/",             "GitHub Actions");
    }

    private final RepositoryGateway gateway;

    public RepositoryAnalyzer(RepositoryGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * @param ref branch to list files from; null means the repository's default branch
     */
    public RepositoryAnalysis analyze(RepositoryLocator repo, String ref) {
        RepositorySummary summary = gateway.getRepositorySummary(repo);
        String effectiveRef = ref != null ? ref : summary.defaultBranch();
        List<String> files = gateway.listFiles(repo, effectiveRef);
        List<String> frameworks = detectFrameworks(files);

        log.info("Analyzed {}: {} files, primary language {}, frameworks {}",
                repo, files.size(), summary.primaryLanguage(), frameworks);

        return new RepositoryAnalysis(repo, summary.description(), summary.defaultBranch(),
                summary.languages(), summary.primaryLanguage(), frameworks, files, summary.readmeExcerpt());
    }

    static List<String> detectFrameworks(List<String> files) {
        Set<String> names = files.stream()
                .map(f -> f.substring(f.lastIndexOf('/') + 1))
                .collect(Collectors.toSet());

        List<String> found = new ArrayList<>();
        MARKER_FILES.forEach((marker, label) -> {
            if (names.contains(marker) && !found.contains(label)) found.add(label);
        });
        MARKER_PATHS.forEach((fragment, label) -> {
            Predicate<String> hit = f -> f.startsWith(fragment) || f.contains("/" + fragment);
            if (files.stream().anyMatch(hit) && !found.contains(label)) found.add(label);
        });
        return found;
    }
}
