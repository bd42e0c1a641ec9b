package com.prpilot.orchestrator.model;

import com.prpilot.orchestrator.SteppingClock;
import com.prpilot.orchestrator.error.ErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowRunTest {

    private final SteppingClock clock = new SteppingClock(Instant.parse("2026-01-01T10:00:00Z"));
    private final WorkflowRun   run   = new WorkflowRun("wf-1", "req-1", clock);

    @Test
    void steps_areRecordedInOrderWithResults() {
        WorkflowStep analyze = run.startStep(WorkflowStepName.ANALYZE_REPOSITORY);
        clock.advance(Duration.ofSeconds(1));
        run.completeStep(analyze, Map.of("files", "12"));
        WorkflowStep generate = run.startStep(WorkflowStepName.GENERATE_CHANGES);
        run.failStep(generate, ErrorCode.GENERATION_ERROR, "nothing produced");

        assertThat(run.getSteps()).extracting(WorkflowStep::getName)
                .containsExactly(WorkflowStepName.ANALYZE_REPOSITORY, WorkflowStepName.GENERATE_CHANGES);
        assertThat(analyze.getStatus()).isEqualTo(StepStatus.COMPLETED);
        assertThat(analyze.getResult()).containsEntry("files", "12");
        assertThat(generate.getErrorCode()).isEqualTo(ErrorCode.GENERATION_ERROR);
        assertThat(run.completedStepCount()).isEqualTo(1);
        assertThat(run.currentStep()).contains(generate);
    }

    @Test
    void startingAStepWhileAnotherIsRunning_isRefused() {
        run.startStep(WorkflowStepName.ANALYZE_REPOSITORY);

        assertThatThrownBy(() -> run.startStep(WorkflowStepName.GENERATE_CHANGES))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("analyze_repository");
    }

    @Test
    void timestamps_neverGoBackwards_evenIfTheClockDoes() {
        WorkflowStep first = run.startStep(WorkflowStepName.ANALYZE_REPOSITORY);
        clock.set(Instant.parse("2025-12-31T00:00:00Z"));
        run.completeStep(first, Map.of());
        WorkflowStep second = run.startStep(WorkflowStepName.GENERATE_CHANGES);

        assertThat(first.getFinishedAt()).isAfterOrEqualTo(first.getStartedAt());
        assertThat(second.getStartedAt()).isAfterOrEqualTo(first.getFinishedAt());
        assertThat(second.getTimestamp()).isEqualTo(second.getStartedAt());
    }

    @Test
    void finishedRun_rejectsEveryMutation() {
        run.recordBranch("auto/x-abcdef", "main");
        run.finish(CompletionStatus.SUCCESS, null);

        assertThatThrownBy(() -> run.startStep(WorkflowStepName.ANALYZE_REPOSITORY))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> run.recordCommittedFiles(List.of("a")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> run.finish(CompletionStatus.FAILED, ErrorDetail.internal(new RuntimeException())))
                .isInstanceOf(IllegalStateException.class);
        assertThat(run.getCompletion()).isEqualTo(CompletionStatus.SUCCESS);
        assertThat(run.getCompletedAt()).isNotNull();
    }

    @Test
    void failedFinish_requiresAFailureRecord() {
        assertThatThrownBy(() -> run.finish(CompletionStatus.FAILED, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(run.isFinished()).isFalse();
    }

    // ------------------------------------------------------------------
    // PrRequest transitions
    // ------------------------------------------------------------------

    @Test
    void request_terminalStatusIsFinal() {
        PrRequest request = new PrRequest("req-1", "do it",
                new RepositoryLocator("github.com", "o", "r"), PrRequestOptions.defaults(), clock.instant());

        request.markProcessing(clock.instant());
        request.markCompleted("https://github.com/o/r/pull/1", clock.instant());

        assertThatThrownBy(() -> request.markFailed(ErrorDetail.internal(new RuntimeException()), clock.instant()))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> request.markProcessing(clock.instant()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(request.getStatus()).isEqualTo(RequestStatus.COMPLETED);

        request.attachPrUrl("https://github.com/o/r/pull/2", clock.instant());
        assertThat(request.getPrUrl()).endsWith("/2");
    }

    @Test
    void task_progressIsMonotonicAndCapped() {
        BackgroundTask task = new BackgroundTask("task-1", TaskKind.PR_CREATION, clock.instant());

        task.updateProgress(50);
        task.updateProgress(33);
        assertThat(task.getProgressPercent()).isEqualTo(50);
        task.updateProgress(150);
        assertThat(task.getProgressPercent()).isEqualTo(100);

        task.fail(ErrorDetail.internal(new RuntimeException("boom")), clock.instant());
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThatThrownBy(() -> task.complete("x", clock.instant())).isInstanceOf(IllegalStateException.class);
    }
}
