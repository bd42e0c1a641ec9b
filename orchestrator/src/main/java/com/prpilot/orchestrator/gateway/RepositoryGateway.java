package com.prpilot.orchestrator.gateway;

import com.prpilot.orchestrator.model.RepositoryLocator;

import java.util.List;

/**
 * The only authenticated boundary to the remote version-control service.
 *
 * Implementations own retry, backoff and rate-limit handling; callers only
 * ever see the classified exceptions under
 * {@link com.prpilot.orchestrator.error.PrFlowException}, after retries
 * have been exhausted.
 */
public interface RepositoryGateway {

    RepositorySummary getRepositorySummary(RepositoryLocator repo);

    /** Paths of every file reachable from {@code ref}. */
    List<String> listFiles(RepositoryLocator repo, String ref);

    /** @throws com.prpilot.orchestrator.error.NotFoundException if the file does not exist */
    String getFileContent(RepositoryLocator repo, String path, String ref);

    boolean branchExists(RepositoryLocator repo, String branch);

    /**
     * Creates {@code branch} at the head of {@code baseBranch}.
     *
     * @throws com.prpilot.orchestrator.error.NameCollisionException if the branch already exists
     */
    BranchRef createBranch(RepositoryLocator repo, String branch, String baseBranch);

    /**
     * Lands every file on {@code branch}.
     *
     * @throws com.prpilot.orchestrator.error.PartialCommitException if some files
     *         landed before the sequence failed
     */
    CommitResult commitFiles(RepositoryLocator repo, String branch, List<FileChange> files, String message);

    /** Creates or overwrites one file in its own commit. */
    CommitResult updateFile(RepositoryLocator repo, String branch, String path, String content, String message);

    CommitResult deleteFile(RepositoryLocator repo, String branch, String path, String message);

    /** Opens a PR, or returns the already open one for the same head and base. */
    PullRequestInfo createPullRequest(RepositoryLocator repo, PullRequestSpec request);

    void addLabels(RepositoryLocator repo, int pullRequestNumber, List<String> labels);
}
