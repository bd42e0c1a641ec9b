package com.prpilot.orchestrator.model;

import com.prpilot.orchestrator.error.ErrorCode;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Execution record for one request's step sequence.
 *
 * Written by exactly one thread (the one running the orchestrator) and read
 * by any number of pollers, hence the copy-on-write step list and volatile
 * fields. Timestamps come from the injected clock but are clamped so they
 * never go backwards, even if the wall clock does. Once the completion is
 * set the run rejects every further mutation.
 */
public class WorkflowRun {

    private final String  id;
    private final String  requestId;
    private final Clock   clock;
    private final Instant createdAt;

    private final List<WorkflowStep> steps = new CopyOnWriteArrayList<>();
    private final List<String> committedFiles = new CopyOnWriteArrayList<>();

    private Instant lastInstant;

    private volatile String           branchName;
    private volatile String           baseBranch;
    private volatile String           prTitle;
    private volatile String           prDescription;
    private volatile String           prUrl;
    private volatile Integer          prNumber;
    private volatile CompletionStatus completion;
    private volatile ErrorDetail      failure;
    private volatile Instant          completedAt;

    public WorkflowRun(String id, String requestId, Clock clock) {
        this.id          = id;
        this.requestId   = requestId;
        this.clock       = clock;
        this.createdAt   = clock.instant();
        this.lastInstant = createdAt;
    }

    // ------------------------------------------------------------------
    // Step recording
    // ------------------------------------------------------------------

    public synchronized WorkflowStep startStep(WorkflowStepName name) {
        requireOpen();
        WorkflowStep current = currentStep().orElse(null);
        if (current != null && current.getStatus() == StepStatus.PENDING) {
            throw new IllegalStateException(
                    "Step " + current.getName().wireName() + " is still running");
        }
        WorkflowStep step = new WorkflowStep(name, now());
        steps.add(step);
        return step;
    }

    public synchronized void completeStep(WorkflowStep step, Map<String, String> result) {
        requireOpen();
        step.complete(result, now());
    }

    public synchronized void failStep(WorkflowStep step, ErrorCode code, String message) {
        requireOpen();
        step.fail(code, message, now());
    }

    // ------------------------------------------------------------------
    // Outcome
    // ------------------------------------------------------------------

    public synchronized void recordBranch(String branchName, String baseBranch) {
        requireOpen();
        this.branchName = branchName;
        this.baseBranch = baseBranch;
    }

    public synchronized void recordBaseBranch(String baseBranch) {
        requireOpen();
        this.baseBranch = baseBranch;
    }

    public synchronized void recordCommittedFiles(List<String> paths) {
        requireOpen();
        committedFiles.clear();
        committedFiles.addAll(paths);
    }

    public synchronized void recordPullRequestDraft(String title, String description) {
        requireOpen();
        this.prTitle       = title;
        this.prDescription = description;
    }

    public synchronized void recordPullRequest(int number, String url) {
        requireOpen();
        this.prNumber = number;
        this.prUrl    = url;
    }

    public synchronized void finish(CompletionStatus completion, ErrorDetail failure) {
        requireOpen();
        if (completion == CompletionStatus.FAILED && failure == null) {
            throw new IllegalArgumentException("A failed run needs a failure record");
        }
        this.failure     = failure;
        this.completedAt = now();
        this.completion  = completion;
    }

    private void requireOpen() {
        if (completion != null) {
            throw new IllegalStateException("Workflow run " + id + " is already " + completion);
        }
    }

    private Instant now() {
        Instant t = clock.instant();
        if (t.isBefore(lastInstant)) {
            t = lastInstant;
        }
        lastInstant = t;
        return t;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String getId()                     { return id; }
    public String getRequestId()              { return requestId; }
    public Instant getCreatedAt()             { return createdAt; }
    public List<WorkflowStep> getSteps()      { return List.copyOf(steps); }
    public List<String> getCommittedFiles()   { return List.copyOf(committedFiles); }
    public String getBranchName()             { return branchName; }
    public String getBaseBranch()             { return baseBranch; }
    public String getPrTitle()                { return prTitle; }
    public String getPrDescription()          { return prDescription; }
    public String getPrUrl()                  { return prUrl; }
    public Integer getPrNumber()              { return prNumber; }
    public CompletionStatus getCompletion()   { return completion; }
    public ErrorDetail getFailure()           { return failure; }
    public Instant getCompletedAt()           { return completedAt; }

    public boolean isFinished() {
        return completion != null;
    }

    public long completedStepCount() {
        return steps.stream().filter(s -> s.getStatus() == StepStatus.COMPLETED).count();
    }

    public Optional<WorkflowStep> currentStep() {
        List<WorkflowStep> snapshot = new ArrayList<>(steps);
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.get(snapshot.size() - 1));
    }
}
