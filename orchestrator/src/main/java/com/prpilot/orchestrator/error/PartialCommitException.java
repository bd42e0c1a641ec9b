package com.prpilot.orchestrator.error;

import java.util.List;
import java.util.Map;

/**
 * Some files landed on the branch before the commit sequence failed.
 * Nothing is rolled back; the committed paths are reported exactly.
 */
public class PartialCommitException extends PrFlowException {

    private final List<String> committedPaths;
    private final String       failedPath;

    public PartialCommitException(String branch, List<String> committedPaths,
                                  String failedPath, Throwable cause) {
        super(ErrorCode.PARTIAL_COMMIT,
                "Committed " + committedPaths.size() + " file(s) to '" + branch
                        + "' before failing on '" + failedPath + "'",
                false,
                List.of("Inspect branch '" + branch + "' and finish or delete it manually",
                        "Resubmit the request once the remote is healthy"),
                Map.of("branchName", branch,
                       "committedFiles", List.copyOf(committedPaths),
                       "failedFile", failedPath),
                cause);
        this.committedPaths = List.copyOf(committedPaths);
        this.failedPath     = failedPath;
    }

    public List<String> getCommittedPaths() { return committedPaths; }
    public String getFailedPath()           { return failedPath; }
}
