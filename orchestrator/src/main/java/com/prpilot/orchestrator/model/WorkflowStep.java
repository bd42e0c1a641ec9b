package com.prpilot.orchestrator.model;

import com.prpilot.orchestrator.error.ErrorCode;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One executed step of a workflow run. Starts PENDING and is finished exactly
 * once, either COMPLETED with a result map or FAILED with a classification.
 */
public class WorkflowStep {

    private final WorkflowStepName name;
    private final Instant          startedAt;

    private volatile StepStatus          status = StepStatus.PENDING;
    private volatile Map<String, String> result = Map.of();
    private volatile String              errorMessage;
    private volatile ErrorCode           errorCode;
    private volatile Instant             finishedAt;

    WorkflowStep(WorkflowStepName name, Instant startedAt) {
        this.name      = name;
        this.startedAt = startedAt;
    }

    synchronized void complete(Map<String, String> result, Instant now) {
        requirePending();
        this.result     = Collections.unmodifiableMap(new LinkedHashMap<>(result));
        this.finishedAt = now;
        this.status     = StepStatus.COMPLETED;
    }

    synchronized void fail(ErrorCode code, String message, Instant now) {
        requirePending();
        this.errorCode    = code;
        this.errorMessage = message;
        this.finishedAt   = now;
        this.status       = StepStatus.FAILED;
    }

    private void requirePending() {
        if (status != StepStatus.PENDING) {
            throw new IllegalStateException("Step " + name.wireName() + " already finished");
        }
    }

    public WorkflowStepName getName()        { return name; }
    public StepStatus getStatus()            { return status; }
    public Map<String, String> getResult()   { return result; }
    public String getErrorMessage()          { return errorMessage; }
    public ErrorCode getErrorCode()          { return errorCode; }
    public Instant getStartedAt()            { return startedAt; }
    public Instant getFinishedAt()           { return finishedAt; }

    /** The step's point in time: when it finished, or when it started if still running. */
    public Instant getTimestamp() {
        Instant f = finishedAt;
        return f != null ? f : startedAt;
    }
}
