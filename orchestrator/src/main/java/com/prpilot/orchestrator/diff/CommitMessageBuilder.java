package com.prpilot.orchestrator.diff;

import com.prpilot.orchestrator.model.ChangeEntry;
import com.prpilot.orchestrator.model.ChangeOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds commit messages with a fixed shape:
 * <pre>
 *   Summary line, imperative, at most 72 chars
 *
 *   - path/one
 *   - path/two
 *
 *   Request-Id: req-…
 * </pre>
 * Long summaries are truncated, never rejected.
 */
public final class CommitMessageBuilder {

    public static final int MAX_SUMMARY_LENGTH = 72;

    private static final String ELLIPSIS = "...";
    private static final int    MAX_NAMED_FILES = 3;

    private CommitMessageBuilder() {}

    public static String buildCommitMessage(String summary, List<String> filesTouched, String requestId) {
        StringBuilder sb = new StringBuilder(summaryLine(summary));
        if (!filesTouched.isEmpty()) {
            sb.append("\n\n");
            sb.append(filesTouched.stream().map(f -> "- " + f).collect(Collectors.joining("\n")));
        }
        if (requestId != null) {
            sb.append("\n\nRequest-Id: ").append(requestId);
        }
        return sb.toString();
    }

    /**
     * Uses the caller's summary if there is one, otherwise synthesises
     * "Add x.py, update y.py" style text from the operations.
     */
    public static String buildCommitMessage(String summary, List<ChangeEntry> changes, String requestId,
                                            boolean synthesiseWhenBlank) {
        String effective = summary;
        if ((effective == null || effective.isBlank()) && synthesiseWhenBlank) {
            effective = synthesiseSummary(changes);
        }
        return buildCommitMessage(effective, changes.stream().map(ChangeEntry::path).toList(), requestId);
    }

    static String summaryLine(String summary) {
        String s = summary == null ? "" : summary.strip().replaceAll("\\s+", " ");
        if (s.isEmpty()) {
            s = "Update files";
        }
        s = s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
        while (s.endsWith(".")) {
            s = s.substring(0, s.length() - 1);
        }
        if (s.length() > MAX_SUMMARY_LENGTH) {
            s = s.substring(0, MAX_SUMMARY_LENGTH - ELLIPSIS.length()).stripTrailing() + ELLIPSIS;
        }
        return s;
    }

    static String synthesiseSummary(List<ChangeEntry> changes) {
        Map<ChangeOperation, List<String>> byOp = new TreeMap<>();
        for (ChangeEntry c : changes) {
            byOp.computeIfAbsent(c.operation(), k -> new ArrayList<>()).add(fileName(c.path()));
        }
        return byOp.entrySet().stream()
                .map(e -> verb(e.getKey()) + " " + describe(e.getValue()))
                .collect(Collectors.joining(", "));
    }

    private static String verb(ChangeOperation op) {
        return switch (op) {
            case CREATE -> "add";
            case MODIFY -> "update";
            case DELETE -> "remove";
        };
    }

    private static String describe(List<String> names) {
        return names.size() <= MAX_NAMED_FILES ? String.join(", ", names) : names.size() + " files";
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
