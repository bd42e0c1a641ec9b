package com.prpilot.orchestrator.service;

import com.prpilot.orchestrator.error.ValidationException;
import com.prpilot.orchestrator.generator.ProposedChange;
import com.prpilot.orchestrator.model.CompletionStatus;
import com.prpilot.orchestrator.model.PrRequestOptions;
import com.prpilot.orchestrator.model.PrSubmission;
import com.prpilot.orchestrator.model.RepositoryAnalysis;
import com.prpilot.orchestrator.model.RequestStatus;
import com.prpilot.orchestrator.naming.BranchNamer;
import com.prpilot.orchestrator.repository.IdGenerator;
import com.prpilot.orchestrator.repository.PrRequestRegistry;
import com.prpilot.orchestrator.repository.WorkflowRunRegistry;
import com.prpilot.orchestrator.validation.ChangeValidator;
import com.prpilot.orchestrator.validation.SubmissionValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verifyNoInteractions;

class PrWorkflowServiceTest {

    private InMemoryRepositoryGateway gateway;
    private PrRequestRegistry         requests;
    private WorkflowRunRegistry       runs;
    private PrWorkflowService         service;

    @BeforeEach
    void setUp() {
        gateway = spy(new InMemoryRepositoryGateway("main", Map.of("README.md", "# Demo\n")));
        IdGenerator ids = new IdGenerator();
        Clock clock = Clock.systemUTC();
        BranchNamer namer = new BranchNamer("auto", 40, 5);
        requests = new PrRequestRegistry(ids);
        runs     = new WorkflowRunRegistry(ids);
        RepositoryAnalyzer analyzer = new RepositoryAnalyzer(gateway);
        WorkflowOrchestrator orchestrator = new WorkflowOrchestrator(gateway, analyzer,
                r -> List.of(ProposedChange.create("hello.py", "print('Hello World')\n", "Add hello.py")),
                new ChangeValidator(1_048_576, 20), namer, runs, ids, new SimpleMeterRegistry(), clock,
                "ai-generated", 3);
        service = new PrWorkflowService(new SubmissionValidator(namer, "github.com"),
                orchestrator, analyzer, requests, runs, clock);
    }

    @Test
    void malformedLocator_isRejectedBeforeAnyRemoteCallOrRecord() {
        assertThatThrownBy(() -> service.submitBlocking(
                new PrSubmission("Add hello.py", "not-a-repository", null)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("repositoryLocator");

        verifyNoInteractions(gateway);
        assertThat(requests.size()).isZero();
        assertThat(runs.size()).isZero();
    }

    @Test
    void invalidBranchOverride_isRejectedBeforeAnyRemoteCall() {
        PrRequestOptions options = new PrRequestOptions("bad branch", null, null, null, false, null);

        assertThatThrownBy(() -> service.accept(new PrSubmission("Add hello.py", "example/demo", options)))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(gateway);
    }

    @Test
    void accept_registersPendingRequestWithItsRun() {
        PrWorkflowService.Accepted accepted = service.accept(
                new PrSubmission("  Add hello.py  ", "https://github.com/example/demo.git", null));

        assertThat(accepted.request().getId()).startsWith("req-");
        assertThat(accepted.request().getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(accepted.request().getFreeTextRequest()).isEqualTo("Add hello.py");
        assertThat(accepted.run().getId()).startsWith("wf-");
        assertThat(service.findRun(accepted.request().getId())).contains(accepted.run());
        verifyNoInteractions(gateway);
    }

    @Test
    void submitBlocking_returnsTerminalRequestVisibleThroughLookups() {
        PrWorkflowService.Accepted accepted = service.submitBlocking(
                new PrSubmission("Add hello.py printing Hello World", "github.com/example/demo", null));

        assertThat(accepted.run().getCompletion()).isEqualTo(CompletionStatus.SUCCESS);
        assertThat(service.findRequest(accepted.request().getId()))
                .get()
                .satisfies(r -> {
                    assertThat(r.getStatus()).isEqualTo(RequestStatus.COMPLETED);
                    assertThat(r.getPrUrl()).isEqualTo("https://github.com/example/demo/pull/1");
                });
        assertThat(service.findRequest("req-unknown")).isEmpty();
    }

    @Test
    void analyze_usesTheDefaultBranch() {
        RepositoryAnalysis analysis = service.analyze(service.parseLocator("example/demo"));

        assertThat(analysis.defaultBranch()).isEqualTo("main");
        assertThat(analysis.files()).containsExactly("README.md");
    }
}
