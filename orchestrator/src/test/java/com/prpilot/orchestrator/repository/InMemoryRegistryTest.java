package com.prpilot.orchestrator.repository;

import com.prpilot.orchestrator.model.BackgroundTask;
import com.prpilot.orchestrator.model.TaskKind;
import com.prpilot.orchestrator.model.WorkflowRun;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRegistryTest {

    private final IdGenerator ids = new IdGenerator();

    @Test
    void create_handsTheAllocatedIdToTheFactory() {
        TaskRegistry tasks = new TaskRegistry(ids);

        BackgroundTask task = tasks.create(id -> new BackgroundTask(id, TaskKind.PR_CREATION, Instant.now()));

        assertThat(task.getId()).startsWith("task-");
        assertThat(tasks.findById(task.getId())).containsSame(task);
        assertThat(tasks.findById("task-unknown")).isEmpty();
        assertThat(tasks.findById(null)).isEmpty();
    }

    @Test
    void workflowRuns_areIndexedByTheirRequest() {
        WorkflowRunRegistry runs = new WorkflowRunRegistry(ids);

        WorkflowRun run = runs.create(id -> new WorkflowRun(id, "req-1", Clock.systemUTC()));

        assertThat(run.getId()).startsWith("wf-");
        assertThat(runs.findByRequestId("req-1")).containsSame(run);
        assertThat(runs.findByRequestId("req-2")).isEmpty();
    }

    @Test
    void secondRunForTheSameRequest_isRefusedAndNotStored() {
        WorkflowRunRegistry runs = new WorkflowRunRegistry(ids);
        WorkflowRun first = runs.create(id -> new WorkflowRun(id, "req-1", Clock.systemUTC()));

        assertThatThrownBy(() -> runs.create(id -> new WorkflowRun(id, "req-1", Clock.systemUTC())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(first.getId());

        assertThat(runs.size()).isEqualTo(1);
        assertThat(runs.findByRequestId("req-1")).containsSame(first);
    }
}
