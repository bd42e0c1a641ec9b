package com.prpilot.orchestrator.api.dto;

import com.prpilot.orchestrator.model.PrRequestOptions;
import com.prpilot.orchestrator.model.PrSubmission;

import java.util.List;

/**
 * Request body for POST /api/pr and POST /api/pr/async.
 *
 * Required: freeTextRequest, repositoryLocator ("host/owner/name", a clone URL or "owner/name").
 * Everything under options is optional.
 */
public record SubmitPrRequest(String freeTextRequest, String repositoryLocator, Options options) {

    public record Options(String branchName,
                          String prTitle,
                          String prDescription,
                          String baseBranch,
                          Boolean autoMerge,
                          List<String> labels) {}

    public PrSubmission toSubmission() {
        PrRequestOptions opts = options == null ? PrRequestOptions.defaults()
                : new PrRequestOptions(options.branchName(), options.prTitle(), options.prDescription(),
                        options.baseBranch(), Boolean.TRUE.equals(options.autoMerge()), options.labels());
        return new PrSubmission(freeTextRequest, repositoryLocator, opts);
    }
}
