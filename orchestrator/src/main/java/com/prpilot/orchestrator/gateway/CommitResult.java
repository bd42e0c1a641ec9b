package com.prpilot.orchestrator.gateway;

import java.util.List;

/**
 * @param commitSha       the last commit created
 * @param committedPaths  every path that landed on the branch, in commit order
 */
public record CommitResult(String branch, String commitSha, List<String> committedPaths) {

    public CommitResult {
        committedPaths = List.copyOf(committedPaths);
    }
}
