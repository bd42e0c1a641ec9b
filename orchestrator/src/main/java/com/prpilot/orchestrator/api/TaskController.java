package com.prpilot.orchestrator.api;

import com.prpilot.orchestrator.api.dto.TaskResponse;
import com.prpilot.orchestrator.error.NotFoundException;
import com.prpilot.orchestrator.service.BackgroundTaskRunner;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** GET /api/tasks/{taskId}: poll a background task. */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final BackgroundTaskRunner taskRunner;

    public TaskController(BackgroundTaskRunner taskRunner) {
        this.taskRunner = taskRunner;
    }

    @GetMapping("/{taskId}")
    public TaskResponse getTask(@PathVariable String taskId) {
        return taskRunner.findTask(taskId)
                .map(TaskResponse::from)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
    }
}
