package com.prpilot.orchestrator.service;

import com.prpilot.orchestrator.error.PrFlowException;
import com.prpilot.orchestrator.model.BackgroundTask;
import com.prpilot.orchestrator.model.CompletionStatus;
import com.prpilot.orchestrator.model.ErrorDetail;
import com.prpilot.orchestrator.model.PrSubmission;
import com.prpilot.orchestrator.model.RepositoryAnalysis;
import com.prpilot.orchestrator.model.RepositoryLocator;
import com.prpilot.orchestrator.model.TaskKind;
import com.prpilot.orchestrator.model.WorkflowRun;
import com.prpilot.orchestrator.repository.TaskRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs workflows and repository analyses on a fixed worker pool and exposes
 * them as poll-only {@link BackgroundTask} records.
 *
 * Input is validated on the caller's thread, so a malformed submission is
 * rejected synchronously and never becomes a task. Each task record is
 * written only by the worker that runs it. There is no cancellation: once
 * submitted, a task runs to completion whether or not anyone polls it.
 */
@Component
public class BackgroundTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(BackgroundTaskRunner.class);

    private final ExecutorService      workers;
    private final PrWorkflowService    workflowService;
    private final WorkflowOrchestrator orchestrator;
    private final TaskRegistry         tasks;
    private final Clock                clock;

    public BackgroundTaskRunner(PrWorkflowService workflowService,
                                WorkflowOrchestrator orchestrator,
                                TaskRegistry tasks,
                                Clock clock,
                                @Value("${prflow.workers:4}") int workerCount) {
        this.workflowService = workflowService;
        this.orchestrator    = orchestrator;
        this.tasks           = tasks;
        this.clock           = clock;
        this.workers         = Executors.newFixedThreadPool(workerCount);
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * @throws com.prpilot.orchestrator.error.ValidationException synchronously, on malformed input
     */
    public BackgroundTask submitPrCreation(PrSubmission submission) {
        PrWorkflowService.Accepted accepted = workflowService.accept(submission);
        BackgroundTask task = tasks.create(id -> new BackgroundTask(id, TaskKind.PR_CREATION, clock.instant()));
        task.linkRequest(accepted.request().getId());

        workers.submit(() -> {
            MDC.put("taskId", task.getId());
            try {
                WorkflowRun run = orchestrator.execute(accepted.request(), accepted.run(),
                        (step, completed, total) -> task.updateProgress(completed * 100 / total));
                if (run.getCompletion() == CompletionStatus.FAILED) {
                    task.fail(run.getFailure(), clock.instant());
                } else {
                    task.complete(new PrTaskResult(accepted.request().getId(), run.getId(), run.getCompletion(),
                            run.getBranchName(), run.getPrUrl(), run.getPrNumber()), clock.instant());
                }
            } catch (RuntimeException e) {
                log.error("Unhandled error in PR task {}", task.getId(), e);
                task.fail(ErrorDetail.internal(e), clock.instant());
            } finally {
                MDC.clear();
            }
        });
        log.info("Queued PR task {} for request {}", task.getId(), accepted.request().getId());
        return task;
    }

    /**
     * @throws com.prpilot.orchestrator.error.ValidationException synchronously, on a malformed locator
     */
    public BackgroundTask submitAnalysis(String repositoryLocator) {
        RepositoryLocator locator = workflowService.parseLocator(repositoryLocator);
        BackgroundTask task = tasks.create(id -> new BackgroundTask(id, TaskKind.REPOSITORY_ANALYSIS, clock.instant()));

        workers.submit(() -> {
            MDC.put("taskId", task.getId());
            try {
                task.updateProgress(10);
                RepositoryAnalysis analysis = workflowService.analyze(locator);
                task.complete(analysis, clock.instant());
            } catch (PrFlowException e) {
                log.warn("Analysis task {} for {} failed: {}", task.getId(), locator, e.getMessage());
                task.fail(ErrorDetail.from(e), clock.instant());
            } catch (RuntimeException e) {
                log.error("Unhandled error in analysis task {}", task.getId(), e);
                task.fail(ErrorDetail.internal(e), clock.instant());
            } finally {
                MDC.clear();
            }
        });
        log.info("Queued analysis task {} for {}", task.getId(), locator);
        return task;
    }

    public Optional<BackgroundTask> findTask(String taskId) {
        return tasks.findById(taskId);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Background workers still busy after 30s; interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }
}
