package com.prpilot.orchestrator.model;

import java.util.List;

/**
 * Caller-supplied knobs for one submission. Blank strings are normalised to
 * null so "absent" has exactly one representation downstream.
 *
 * @param baseBranch null means "use the repository's default branch"
 */
public record PrRequestOptions(
        String branchName,
        String prTitle,
        String prDescription,
        String baseBranch,
        boolean autoMerge,
        List<String> labels
) {
    public PrRequestOptions {
        branchName    = blankToNull(branchName);
        prTitle       = blankToNull(prTitle);
        prDescription = blankToNull(prDescription);
        baseBranch    = blankToNull(baseBranch);
        labels = labels == null ? List.of()
                : labels.stream().filter(l -> l != null && !l.isBlank()).map(String::trim).distinct().toList();
    }

    public static PrRequestOptions defaults() {
        return new PrRequestOptions(null, null, null, null, false, List.of());
    }

    public boolean hasFixedBranchName() {
        return branchName != null;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
