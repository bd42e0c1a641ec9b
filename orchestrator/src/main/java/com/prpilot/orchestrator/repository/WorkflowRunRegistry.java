package com.prpilot.orchestrator.repository;

import com.prpilot.orchestrator.model.WorkflowRun;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Workflow runs, also indexed by their owning request (exactly one run per request). */
@Repository
public class WorkflowRunRegistry extends InMemoryRegistry<WorkflowRun> {

    private final ConcurrentMap<String, WorkflowRun> byRequest = new ConcurrentHashMap<>();

    public WorkflowRunRegistry(IdGenerator ids) {
        super(ids, IdGenerator.WORKFLOW);
    }

    @Override
    protected void onCreated(String id, WorkflowRun run) {
        WorkflowRun existing = byRequest.putIfAbsent(run.getRequestId(), run);
        if (existing != null) {
            throw new IllegalStateException(
                    "Request " + run.getRequestId() + " already has workflow run " + existing.getId());
        }
    }

    public Optional<WorkflowRun> findByRequestId(String requestId) {
        return requestId == null ? Optional.empty() : Optional.ofNullable(byRequest.get(requestId));
    }
}
