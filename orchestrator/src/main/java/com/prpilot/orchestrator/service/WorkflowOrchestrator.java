package com.prpilot.orchestrator.service;

import com.prpilot.orchestrator.diff.CommitMessageBuilder;
import com.prpilot.orchestrator.diff.DiffCalculator;
import com.prpilot.orchestrator.diff.FileDiff;
import com.prpilot.orchestrator.error.ErrorCode;
import com.prpilot.orchestrator.error.GenerationException;
import com.prpilot.orchestrator.error.NameCollisionException;
import com.prpilot.orchestrator.error.NameGenerationExhaustedException;
import com.prpilot.orchestrator.error.PartialCommitException;
import com.prpilot.orchestrator.error.PrFlowException;
import com.prpilot.orchestrator.error.ValidationException;
import com.prpilot.orchestrator.gateway.BranchRef;
import com.prpilot.orchestrator.gateway.CommitResult;
import com.prpilot.orchestrator.gateway.FileChange;
import com.prpilot.orchestrator.gateway.PullRequestInfo;
import com.prpilot.orchestrator.gateway.PullRequestSpec;
import com.prpilot.orchestrator.gateway.RepositoryGateway;
import com.prpilot.orchestrator.generator.ChangeGenerator;
import com.prpilot.orchestrator.generator.GenerationRequest;
import com.prpilot.orchestrator.generator.ProposedChange;
import com.prpilot.orchestrator.model.ChangeEntry;
import com.prpilot.orchestrator.model.ChangeOperation;
import com.prpilot.orchestrator.model.CompletionStatus;
import com.prpilot.orchestrator.model.ErrorDetail;
import com.prpilot.orchestrator.model.PrRequest;
import com.prpilot.orchestrator.model.PrRequestOptions;
import com.prpilot.orchestrator.model.RepositoryAnalysis;
import com.prpilot.orchestrator.model.RepositoryLocator;
import com.prpilot.orchestrator.model.WorkflowRun;
import com.prpilot.orchestrator.model.WorkflowStep;
import com.prpilot.orchestrator.model.WorkflowStepName;
import com.prpilot.orchestrator.naming.BranchNameCheck;
import com.prpilot.orchestrator.naming.BranchNamer;
import com.prpilot.orchestrator.repository.IdGenerator;
import com.prpilot.orchestrator.repository.WorkflowRunRegistry;
import com.prpilot.orchestrator.validation.ChangeValidator;
import com.prpilot.orchestrator.validation.ValidationReport;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs the six-step PR workflow for one request:
 * <pre>
 *   analyze_repository → generate_changes → validate_changes
 *     → create_branch → commit_changes → create_pull_request
 * </pre>
 * Steps run strictly in order on the calling thread. The first failing step
 * ends the run; its classified error becomes the failure record of both the
 * run and the request, together with any side effects already on the remote
 * (branch name, committed files). Nothing on the remote is rolled back.
 *
 * The same method serves blocking calls and background workers; the
 * background path only differs in the {@link ProgressListener} it passes.
 */
@Service
public class WorkflowOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    static final String DEFAULT_TITLE_PREFIX = "Automated code update: ";
    static final int    TITLE_REQUEST_CHARS  = 60;

    /** Notified after every completed step; used to publish task progress. */
    @FunctionalInterface
    public interface ProgressListener {
        ProgressListener NONE = (step, completed, total) -> {};

        void onStepCompleted(WorkflowStepName step, int completedSteps, int totalSteps);
    }

    private final RepositoryGateway   gateway;
    private final RepositoryAnalyzer  analyzer;
    private final ChangeGenerator     generator;
    private final ChangeValidator     validator;
    private final BranchNamer         branchNamer;
    private final WorkflowRunRegistry runs;
    private final IdGenerator         ids;
    private final MeterRegistry       meterRegistry;
    private final Clock               clock;
    private final List<String>        defaultLabels;
    private final int                 branchAttempts;

    public WorkflowOrchestrator(RepositoryGateway gateway,
                                RepositoryAnalyzer analyzer,
                                ChangeGenerator generator,
                                ChangeValidator validator,
                                BranchNamer branchNamer,
                                WorkflowRunRegistry runs,
                                IdGenerator ids,
                                MeterRegistry meterRegistry,
                                Clock clock,
                                @Value("${prflow.github.default-labels:ai-generated,automated}") String defaultLabels,
                                @Value("${prflow.naming.branch-attempts:3}") int branchAttempts) {
        this.gateway        = gateway;
        this.analyzer       = analyzer;
        this.generator      = generator;
        this.validator      = validator;
        this.branchNamer    = branchNamer;
        this.runs           = runs;
        this.ids            = ids;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;
        this.defaultLabels  = Arrays.stream(defaultLabels.split(","))
                .map(String::trim).filter(s -> !s.isEmpty()).toList();
        this.branchAttempts = branchAttempts;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /** Creates the request's run record without executing it. */
    public WorkflowRun prepare(PrRequest request) {
        return runs.create(id -> new WorkflowRun(id, request.getId(), clock));
    }

    /**
     * Runs the workflow to a terminal state and returns the finished run.
     * Never throws for workflow failures; they are recorded on the run.
     */
    public WorkflowRun execute(PrRequest request, WorkflowRun run, ProgressListener listener) {
        request.markProcessing(clock.instant());
        MDC.put("requestId",  request.getId());
        MDC.put("workflowId", run.getId());
        try {
            log.info("Workflow {} started for {} on {}", run.getId(), request.getId(), request.getRepository());

            RunOutcome outcome = runSteps(request, run, listener);

            run.finish(outcome.completion(), outcome.warning());
            request.markCompleted(run.getPrUrl(), clock.instant());
            log.info("Workflow {} finished {}: {}", run.getId(), outcome.completion(), run.getPrUrl());

        } catch (PrFlowException e) {
            fail(request, run, e, ErrorDetail.from(withSideEffects(e, run)));
        } catch (RuntimeException e) {
            fail(request, run, e, ErrorDetail.internal(e));
        } finally {
            meterRegistry.counter("prflow.workflow.runs", "completion",
                    run.getCompletion() == null ? "unknown" : run.getCompletion().name().toLowerCase()).increment();
            MDC.remove("requestId");
            MDC.remove("workflowId");
        }
        return run;
    }

    private void fail(PrRequest request, WorkflowRun run, RuntimeException e, ErrorDetail detail) {
        if (detail.code() == ErrorCode.INTERNAL_ERROR) {
            log.error("Workflow {} failed unexpectedly", run.getId(), e);
        } else {
            log.warn("Workflow {} failed at {}: [{}] {}", run.getId(),
                    run.currentStep().map(s -> s.getName().wireName()).orElse("start"),
                    detail.code().code(), detail.message());
        }
        if (!run.isFinished()) {
            run.finish(CompletionStatus.FAILED, detail);
        }
        if (!request.getStatus().isTerminal()) {
            request.markFailed(detail, clock.instant());
        }
    }

    private static PrFlowException withSideEffects(PrFlowException e, WorkflowRun run) {
        e.withDetail("branchName", run.getBranchName());
        if (!run.getCommittedFiles().isEmpty()) {
            e.withDetail("committedFiles", run.getCommittedFiles());
        }
        return e;
    }

    // ------------------------------------------------------------------
    // Step sequence
    // ------------------------------------------------------------------

    private record RunOutcome(CompletionStatus completion, ErrorDetail warning) {}

    private RunOutcome runSteps(PrRequest request, WorkflowRun run, ProgressListener listener) {
        RepositoryLocator repo    = request.getRepository();
        PrRequestOptions  options = request.getOptions();
        int total = WorkflowStepName.SEQUENCE.size();

        // 1. analyze_repository
        RepositoryAnalysis analysis = runStep(run, WorkflowStepName.ANALYZE_REPOSITORY, listener, total,
                () -> analyzer.analyze(repo, options.baseBranch()),
                a -> result(
                        "files", String.valueOf(a.files().size()),
                        "primaryLanguage", a.primaryLanguage(),
                        "frameworks", String.join(",", a.frameworks()),
                        "defaultBranch", a.defaultBranch()));
        String baseBranch = options.baseBranch() != null ? options.baseBranch()
                : Objects.requireNonNullElse(analysis.defaultBranch(), "main");
        run.recordBaseBranch(baseBranch);

        // 2. generate_changes
        List<ChangeEntry> proposed = runStep(run, WorkflowStepName.GENERATE_CHANGES, listener, total,
                () -> generate(request, analysis, baseBranch),
                entries -> result(
                        "changes", String.valueOf(entries.size()),
                        "files", joinPaths(entries)));

        // 3. validate_changes
        ValidationReport report = runStep(run, WorkflowStepName.VALIDATE_CHANGES, listener, total,
                () -> {
                    ValidationReport r = validator.validate(proposed);
                    if (r.isInvalid()) {
                        throw new ValidationException(
                                "Change set failed validation: " + String.join("; ", r.violations()),
                                r.violations());
                    }
                    return r;
                },
                r -> result(
                        "verdict", r.verdict().name().toLowerCase(),
                        "warnings", String.valueOf(r.warnings().size())));
        List<ChangeEntry> changes = report.entries();

        // 4. create_branch
        BranchRef branch = runStep(run, WorkflowStepName.PREPARE_BRANCH, listener, total,
                () -> prepareBranch(request, baseBranch),
                b -> result(
                        "branchName", b.name(),
                        "baseBranch", baseBranch,
                        "baseSha", b.sha(),
                        "callerFixed", String.valueOf(options.hasFixedBranchName())));
        run.recordBranch(branch.name(), baseBranch);

        // 5. commit_changes
        CommitResult commit = runStep(run, WorkflowStepName.COMMIT_CHANGES, listener, total,
                () -> commit(request, run, branch.name(), changes),
                c -> result(
                        "commitSha", c.commitSha(),
                        "files", String.join(",", c.committedPaths())));

        // 6. create_pull_request (+ labels)
        LabelledPullRequest pr = runStep(run, WorkflowStepName.CREATE_PULL_REQUEST, listener, total,
                () -> openPullRequest(request, run, analysis, report, branch.name(), baseBranch, commit),
                p -> result(
                        "prNumber", String.valueOf(p.info().number()),
                        "prUrl", p.info().url(),
                        "reusedExisting", String.valueOf(p.info().reusedExisting()),
                        "labels", p.labelFailure() == null ? String.join(",", p.labels()) : "failed"));

        return pr.labelFailure() == null
                ? new RunOutcome(CompletionStatus.SUCCESS, null)
                : new RunOutcome(CompletionStatus.PARTIAL, pr.labelFailure());
    }

    /**
     * Runs one step body and records it on the run. Any exception marks the
     * step failed with its classification and is rethrown to end the run.
     */
    private <T> T runStep(WorkflowRun run, WorkflowStepName name, ProgressListener listener, int total,
                          Supplier<T> body, Function<T, Map<String, String>> resultOf) {
        MDC.put("step", name.wireName());
        WorkflowStep step = run.startStep(name);
        try {
            T value = body.get();
            run.completeStep(step, resultOf.apply(value));
            log.debug("Step {} completed", name.wireName());
            listener.onStepCompleted(name, (int) run.completedStepCount(), total);
            return value;
        } catch (PrFlowException e) {
            run.failStep(step, e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            run.failStep(step, ErrorCode.INTERNAL_ERROR, String.valueOf(e.getMessage()));
            throw e;
        } finally {
            MDC.remove("step");
        }
    }

    // ------------------------------------------------------------------
    // Step bodies
    // ------------------------------------------------------------------

    private List<ChangeEntry> generate(PrRequest request, RepositoryAnalysis analysis, String baseBranch) {
        List<ProposedChange> proposals;
        try {
            proposals = generator.generate(new GenerationRequest(
                    request.getId(), request.getFreeTextRequest(), analysis, baseBranch));
        } catch (GenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GenerationException("Code generator failed: " + e.getMessage(), e);
        }
        if (proposals == null || proposals.isEmpty()) {
            throw new GenerationException("Code generator returned no changes");
        }
        List<ChangeEntry> entries = new ArrayList<>(proposals.size());
        for (ProposedChange p : proposals) {
            entries.add(ChangeEntry.proposed(ids.next(IdGenerator.CHANGE), request.getId(), p.path(),
                    p.operation(), p.originalContent(), p.proposedContent(), p.summary()));
        }
        return entries;
    }

    private BranchRef prepareBranch(PrRequest request, String baseBranch) {
        RepositoryLocator repo = request.getRepository();
        String fixed = request.getOptions().branchName();

        if (fixed != null) {
            BranchNameCheck check = branchNamer.validateBranchName(fixed);
            if (!check.valid()) {
                throw new ValidationException("options.branchName: " + check.message());
            }
            if (!branchNamer.reserve(fixed)) {
                throw new NameCollisionException(fixed, true);
            }
            try {
                if (gateway.branchExists(repo, fixed)) {
                    throw new NameCollisionException(fixed, true);
                }
                return gateway.createBranch(repo, fixed, baseBranch);
            } catch (NameCollisionException e) {
                branchNamer.release(fixed);
                throw new NameCollisionException(fixed, true);
            } catch (PrFlowException e) {
                branchNamer.release(fixed);
                throw e;
            }
        }

        for (int attempt = 1; attempt <= branchAttempts; attempt++) {
            String name = branchNamer.generateUniqueBranchName(
                    request.getFreeTextRequest(), b -> gateway.branchExists(repo, b));
            BranchNameCheck check = branchNamer.validateBranchName(name);
            if (!check.valid()) {
                branchNamer.release(name);
                throw new ValidationException("Generated branch name '" + name + "' is invalid: "
                        + check.message() + "; check prflow.naming.prefix");
            }
            try {
                return gateway.createBranch(repo, name, baseBranch);
            } catch (NameCollisionException e) {
                log.info("Branch {} was taken between lookup and create (attempt {}/{}), regenerating",
                        name, attempt, branchAttempts);
            } catch (PrFlowException e) {
                branchNamer.release(name);
                throw e;
            }
        }
        throw new NameGenerationExhaustedException(request.getFreeTextRequest(), branchAttempts);
    }

    private CommitResult commit(PrRequest request, WorkflowRun run, String branch, List<ChangeEntry> changes) {
        String message = CommitMessageBuilder.buildCommitMessage(
                commonSummary(changes), changes, request.getId(), true);
        List<FileChange> files = changes.stream().map(FileChange::of).toList();
        try {
            CommitResult result = gateway.commitFiles(request.getRepository(), branch, files, message);
            run.recordCommittedFiles(result.committedPaths());
            return result;
        } catch (PartialCommitException e) {
            run.recordCommittedFiles(e.getCommittedPaths());
            throw e;
        }
    }

    private record LabelledPullRequest(PullRequestInfo info, List<String> labels, ErrorDetail labelFailure) {}

    private LabelledPullRequest openPullRequest(PrRequest request, WorkflowRun run, RepositoryAnalysis analysis,
                                                ValidationReport report, String branch, String baseBranch,
                                                CommitResult commit) {
        PrRequestOptions options = request.getOptions();
        String title = pullRequestTitle(request);
        String body = pullRequestBody(request, analysis, report, commit);

        run.recordPullRequestDraft(title, body);
        PullRequestInfo pr = gateway.createPullRequest(request.getRepository(),
                new PullRequestSpec(title, body, branch, baseBranch));
        run.recordPullRequest(pr.number(), pr.url());
        request.attachPrUrl(pr.url(), clock.instant());

        Set<String> labels = new LinkedHashSet<>(defaultLabels);
        labels.addAll(options.labels());
        List<String> labelList = List.copyOf(labels);
        try {
            gateway.addLabels(request.getRepository(), pr.number(), labelList);
            return new LabelledPullRequest(pr, labelList, null);
        } catch (PrFlowException e) {
            log.warn("PR #{} opened but labels {} could not be applied: {}", pr.number(), labelList, e.getMessage());
            return new LabelledPullRequest(pr, labelList, ErrorDetail.from(e));
        }
    }

    // ------------------------------------------------------------------
    // Text synthesis
    // ------------------------------------------------------------------

    static String pullRequestTitle(PrRequest request) {
        String fixed = request.getOptions().prTitle();
        if (fixed != null) {
            return fixed;
        }
        String text = request.getFreeTextRequest().strip().replaceAll("\\s+", " ");
        if (text.length() > TITLE_REQUEST_CHARS) {
            text = text.substring(0, TITLE_REQUEST_CHARS - 3).stripTrailing() + "...";
        }
        return DEFAULT_TITLE_PREFIX + text;
    }

    static String pullRequestBody(PrRequest request, RepositoryAnalysis analysis,
                                  ValidationReport report, CommitResult commit) {
        StringBuilder sb = new StringBuilder();
        String fixed = request.getOptions().prDescription();
        if (fixed != null) {
            sb.append(fixed).append("\n");
        } else {
            sb.append("## Request\n\n").append(request.getFreeTextRequest().strip()).append("\n\n");
            sb.append("## Changes\n\n");
            for (ChangeEntry c : report.entries()) {
                FileDiff diff = DiffCalculator.calculateDiff(c.path(), c.originalContent(),
                        c.operation() == ChangeOperation.DELETE ? null : c.proposedContent());
                sb.append("- `").append(c.path()).append("` (")
                  .append(c.operation().name().toLowerCase()).append(", +")
                  .append(diff.additions()).append(" / -").append(diff.deletions()).append(")\n");
            }
            if (analysis.primaryLanguage() != null) {
                sb.append("\nRepository language: ").append(analysis.primaryLanguage());
                if (!analysis.frameworks().isEmpty()) {
                    sb.append(" (").append(String.join(", ", analysis.frameworks())).append(")");
                }
                sb.append("\n");
            }
        }
        if (!report.warnings().isEmpty()) {
            sb.append("\n## Validation warnings\n\n");
            report.warnings().forEach(w -> sb.append("- ").append(w).append("\n"));
        }
        sb.append("\n---\nRequest-Id: ").append(request.getId())
          .append(" | Commit: ").append(commit.commitSha()).append("\n");
        return sb.toString();
    }

    /** The generator's summary when every entry shares one, otherwise null (synthesised later). */
    private static String commonSummary(List<ChangeEntry> changes) {
        Set<String> summaries = new LinkedHashSet<>();
        for (ChangeEntry c : changes) {
            summaries.add(c.summary());
        }
        return summaries.size() == 1 ? summaries.iterator().next() : null;
    }

    private static String joinPaths(List<ChangeEntry> entries) {
        return String.join(",", entries.stream().map(ChangeEntry::path).toList());
    }

    /** Builds an ordered result map from key/value pairs, skipping null values. */
    private static Map<String, String> result(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i + 1] != null) {
                m.put(kv[i], kv[i + 1]);
            }
        }
        return m;
    }
}
