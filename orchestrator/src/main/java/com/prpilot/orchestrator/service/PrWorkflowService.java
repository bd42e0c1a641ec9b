package com.prpilot.orchestrator.service;

import com.prpilot.orchestrator.model.PrRequest;
import com.prpilot.orchestrator.model.PrSubmission;
import com.prpilot.orchestrator.model.RepositoryAnalysis;
import com.prpilot.orchestrator.model.RepositoryLocator;
import com.prpilot.orchestrator.model.WorkflowRun;
import com.prpilot.orchestrator.repository.PrRequestRegistry;
import com.prpilot.orchestrator.repository.WorkflowRunRegistry;
import com.prpilot.orchestrator.validation.SubmissionValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Submission and lookup facade over the orchestrator.
 *
 * Submissions are validated here, before any record exists or any remote
 * call is made; a rejected submission leaves no trace.
 */
@Service
public class PrWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(PrWorkflowService.class);

    /** An accepted request and its not yet executed run. */
    public record Accepted(PrRequest request, WorkflowRun run) {}

    private final SubmissionValidator  submissionValidator;
    private final WorkflowOrchestrator orchestrator;
    private final RepositoryAnalyzer   analyzer;
    private final PrRequestRegistry    requests;
    private final WorkflowRunRegistry  runs;
    private final Clock                clock;

    public PrWorkflowService(SubmissionValidator submissionValidator,
                             WorkflowOrchestrator orchestrator,
                             RepositoryAnalyzer analyzer,
                             PrRequestRegistry requests,
                             WorkflowRunRegistry runs,
                             Clock clock) {
        this.submissionValidator = submissionValidator;
        this.orchestrator        = orchestrator;
        this.analyzer            = analyzer;
        this.requests            = requests;
        this.runs                = runs;
        this.clock               = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validates and registers a submission without running it.
     *
     * @throws com.prpilot.orchestrator.error.ValidationException on malformed input
     */
    public Accepted accept(PrSubmission submission) {
        RepositoryLocator locator = submissionValidator.validate(submission);
        PrRequest request = requests.create(id -> new PrRequest(id,
                submission.freeTextRequest().strip(), locator, submission.options(), clock.instant()));
        WorkflowRun run = orchestrator.prepare(request);
        log.info("Accepted request {} for {} (workflow {})", request.getId(), locator, run.getId());
        return new Accepted(request, run);
    }

    /** Runs the workflow on the caller's thread and returns once it is terminal. */
    public Accepted submitBlocking(PrSubmission submission) {
        Accepted accepted = accept(submission);
        orchestrator.execute(accepted.request(), accepted.run(), WorkflowOrchestrator.ProgressListener.NONE);
        return accepted;
    }

    // ------------------------------------------------------------------
    // Lookups
    // ------------------------------------------------------------------

    public Optional<PrRequest> findRequest(String requestId) {
        return requests.findById(requestId);
    }

    public Optional<WorkflowRun> findRun(String requestId) {
        return runs.findByRequestId(requestId);
    }

    // ------------------------------------------------------------------
    // Repository analysis
    // ------------------------------------------------------------------

    /** Parses the locator first, so malformed input never reaches the remote. */
    public RepositoryLocator parseLocator(String repositoryLocator) {
        return submissionValidator.parseLocator(repositoryLocator);
    }

    public RepositoryAnalysis analyze(RepositoryLocator locator) {
        return analyzer.analyze(locator, null);
    }
}
