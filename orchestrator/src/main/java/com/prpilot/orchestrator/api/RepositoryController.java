package com.prpilot.orchestrator.api;

import com.prpilot.orchestrator.api.dto.AnalysisResponse;
import com.prpilot.orchestrator.api.dto.AnalyzeRequest;
import com.prpilot.orchestrator.api.dto.TaskAcceptedResponse;
import com.prpilot.orchestrator.model.BackgroundTask;
import com.prpilot.orchestrator.model.RepositoryLocator;
import com.prpilot.orchestrator.service.BackgroundTaskRunner;
import com.prpilot.orchestrator.service.PrWorkflowService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Repository analysis without opening a PR.
 *
 * POST /api/repositories/analyze          blocking
 * POST /api/repositories/analyze/async    202 with a task handle
 */
@RestController
@RequestMapping("/api/repositories")
public class RepositoryController {

    private final PrWorkflowService    workflowService;
    private final BackgroundTaskRunner taskRunner;

    public RepositoryController(PrWorkflowService workflowService, BackgroundTaskRunner taskRunner) {
        this.workflowService = workflowService;
        this.taskRunner      = taskRunner;
    }

    @PostMapping("/analyze")
    public AnalysisResponse analyze(@RequestBody AnalyzeRequest body) {
        RepositoryLocator locator = workflowService.parseLocator(body.repositoryLocator());
        return AnalysisResponse.from(workflowService.analyze(locator));
    }

    @PostMapping("/analyze/async")
    public ResponseEntity<TaskAcceptedResponse> analyzeAsync(@RequestBody AnalyzeRequest body) {
        BackgroundTask task = taskRunner.submitAnalysis(body.repositoryLocator());
        return ResponseEntity.accepted().body(new TaskAcceptedResponse(
                task.getId(), task.getStatus().name().toLowerCase(), "/api/tasks/" + task.getId(), null));
    }
}
