package com.prpilot.orchestrator.api;

import com.prpilot.orchestrator.error.AuthenticationException;
import com.prpilot.orchestrator.error.ValidationException;
import com.prpilot.orchestrator.model.BackgroundTask;
import com.prpilot.orchestrator.model.RepositoryAnalysis;
import com.prpilot.orchestrator.model.RepositoryLocator;
import com.prpilot.orchestrator.model.TaskKind;
import com.prpilot.orchestrator.service.BackgroundTaskRunner;
import com.prpilot.orchestrator.service.PrWorkflowService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RepositoryController.class)
@Import(ApiTestSupport.class)
class RepositoryControllerTest {

    private static final RepositoryLocator REPO = new RepositoryLocator("github.com", "example", "demo");

    @Autowired MockMvc                mockMvc;
    @MockitoBean PrWorkflowService    workflowService;
    @MockitoBean BackgroundTaskRunner taskRunner;

    @Test
    void analyze_returnsSummaryOfTheRepository() throws Exception {
        when(workflowService.parseLocator("example/demo")).thenReturn(REPO);
        when(workflowService.analyze(REPO)).thenReturn(new RepositoryAnalysis(REPO, "Demo repository", "main",
                Map.of("Java", 5000L), "Java", List.of("Maven", "Spring Boot"),
                List.of("pom.xml", "src/main/resources/application.yml"), "# Demo"));

        mockMvc.perform(post("/api/repositories/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repositoryLocator":"example/demo"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.repository").value("github.com/example/demo"))
                .andExpect(jsonPath("$.defaultBranch").value("main"))
                .andExpect(jsonPath("$.primaryLanguage").value("Java"))
                .andExpect(jsonPath("$.languages.Java").value(5000))
                .andExpect(jsonPath("$.frameworks[1]").value("Spring Boot"))
                .andExpect(jsonPath("$.filesCount").value(2));
    }

    @Test
    void analyze_malformedLocator_returns400AndNeverAnalyzes() throws Exception {
        when(workflowService.parseLocator("nope"))
                .thenThrow(new ValidationException("repositoryLocator 'nope' must have the shape host/owner/name"));

        mockMvc.perform(post("/api/repositories/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repositoryLocator":"nope"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("validation_error"));

        verify(workflowService, never()).analyze(any());
    }

    @Test
    void analyze_rejectedCredential_returns401() throws Exception {
        when(workflowService.parseLocator("example/demo")).thenReturn(REPO);
        when(workflowService.analyze(REPO)).thenThrow(new AuthenticationException("Bad credentials", 401));

        mockMvc.perform(post("/api/repositories/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repositoryLocator":"example/demo"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("authentication_error"));
    }

    @Test
    void analyzeAsync_returns202WithoutRequestId() throws Exception {
        when(taskRunner.submitAnalysis("example/demo"))
                .thenReturn(new BackgroundTask("task-4", TaskKind.REPOSITORY_ANALYSIS, Instant.now()));

        mockMvc.perform(post("/api/repositories/analyze/async")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"repositoryLocator":"example/demo"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.taskId").value("task-4"))
                .andExpect(jsonPath("$.statusPollingLocation").value("/api/tasks/task-4"))
                .andExpect(jsonPath("$.requestId").doesNotExist());
    }
}
