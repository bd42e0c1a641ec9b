package com.prpilot.orchestrator.model;

/** Raw submission as it arrives at the boundary, before validation. */
public record PrSubmission(String freeTextRequest, String repositoryLocator, PrRequestOptions options) {

    public PrSubmission {
        if (options == null) options = PrRequestOptions.defaults();
    }
}
