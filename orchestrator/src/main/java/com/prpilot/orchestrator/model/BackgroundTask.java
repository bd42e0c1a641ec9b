package com.prpilot.orchestrator.model;

import java.time.Instant;

/**
 * Poll-only status record for work running on the background pool.
 * Only the owning worker writes it; any caller may read it by id.
 */
public class BackgroundTask {

    private final String   id;
    private final TaskKind kind;
    private final Instant  startedAt;

    private volatile TaskStatus  status = TaskStatus.PROCESSING;
    private volatile int         progressPercent;
    private volatile Instant     completedAt;
    private volatile Object      result;
    private volatile ErrorDetail error;

    // Present for PR_CREATION tasks so pollers can follow the request too.
    private volatile String requestId;

    public BackgroundTask(String id, TaskKind kind, Instant startedAt) {
        this.id        = id;
        this.kind      = kind;
        this.startedAt = startedAt;
    }

    public void updateProgress(int percent) {
        if (status == TaskStatus.PROCESSING) {
            progressPercent = Math.max(progressPercent, Math.min(percent, 100));
        }
    }

    public synchronized void complete(Object result, Instant now) {
        requireProcessing();
        this.result          = result;
        this.progressPercent = 100;
        this.completedAt     = now;
        this.status          = TaskStatus.COMPLETED;
    }

    public synchronized void fail(ErrorDetail error, Instant now) {
        requireProcessing();
        this.error       = error;
        this.completedAt = now;
        this.status      = TaskStatus.FAILED;
    }

    public void linkRequest(String requestId) {
        this.requestId = requestId;
    }

    private void requireProcessing() {
        if (status != TaskStatus.PROCESSING) {
            throw new IllegalStateException("Task " + id + " is already " + status);
        }
    }

    public String getId()               { return id; }
    public TaskKind getKind()           { return kind; }
    public Instant getStartedAt()       { return startedAt; }
    public TaskStatus getStatus()       { return status; }
    public int getProgressPercent()     { return progressPercent; }
    public Instant getCompletedAt()     { return completedAt; }
    public Object getResult()           { return result; }
    public ErrorDetail getError()        { return error; }
    public String getRequestId()        { return requestId; }
}
