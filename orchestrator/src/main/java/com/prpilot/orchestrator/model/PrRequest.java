package com.prpilot.orchestrator.model;

import java.time.Instant;

/**
 * One submitted change request.
 *
 * Status is owned by the orchestrator. Once the request reaches COMPLETED or
 * FAILED every further transition is refused; only the PR URL and error
 * metadata may still be attached.
 */
public class PrRequest {

    private final String             id;
    private final String             freeTextRequest;
    private final RepositoryLocator  repository;
    private final PrRequestOptions   options;
    private final Instant            createdAt;

    // Written by the worker thread running the workflow, read by pollers.
    private volatile RequestStatus status = RequestStatus.PENDING;
    private volatile Instant       updatedAt;
    private volatile String        prUrl;
    private volatile ErrorDetail   error;

    public PrRequest(String id, String freeTextRequest, RepositoryLocator repository,
                     PrRequestOptions options, Instant createdAt) {
        this.id              = id;
        this.freeTextRequest = freeTextRequest;
        this.repository      = repository;
        this.options         = options;
        this.createdAt       = createdAt;
        this.updatedAt       = createdAt;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public synchronized void markProcessing(Instant now) {
        requireStatus(RequestStatus.PENDING, RequestStatus.PROCESSING);
        status    = RequestStatus.PROCESSING;
        updatedAt = now;
    }

    public synchronized void markCompleted(String prUrl, Instant now) {
        requireNotTerminal(RequestStatus.COMPLETED);
        this.prUrl = prUrl;
        status     = RequestStatus.COMPLETED;
        updatedAt  = now;
    }

    public synchronized void markFailed(ErrorDetail error, Instant now) {
        requireNotTerminal(RequestStatus.FAILED);
        this.error = error;
        status     = RequestStatus.FAILED;
        updatedAt  = now;
    }

    /** Metadata attachment is the one change still allowed after termination. */
    public synchronized void attachPrUrl(String prUrl, Instant now) {
        this.prUrl = prUrl;
        updatedAt  = now;
    }

    private void requireStatus(RequestStatus expected, RequestStatus target) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Request %s cannot move from %s to %s".formatted(id, status, target));
        }
    }

    private void requireNotTerminal(RequestStatus target) {
        if (status.isTerminal()) {
            throw new IllegalStateException(
                    "Request %s is already %s, refusing %s".formatted(id, status, target));
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String getId()                     { return id; }
    public String getFreeTextRequest()        { return freeTextRequest; }
    public RepositoryLocator getRepository()  { return repository; }
    public PrRequestOptions getOptions()      { return options; }
    public Instant getCreatedAt()             { return createdAt; }
    public RequestStatus getStatus()          { return status; }
    public Instant getUpdatedAt()             { return updatedAt; }
    public String getPrUrl()                  { return prUrl; }
    public ErrorDetail getError()             { return error; }
}
