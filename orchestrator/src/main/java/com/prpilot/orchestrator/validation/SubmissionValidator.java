package com.prpilot.orchestrator.validation;

import com.prpilot.orchestrator.error.ValidationException;
import com.prpilot.orchestrator.model.PrRequestOptions;
import com.prpilot.orchestrator.model.PrSubmission;
import com.prpilot.orchestrator.model.RepositoryLocator;
import com.prpilot.orchestrator.naming.BranchNameCheck;
import com.prpilot.orchestrator.naming.BranchNamer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Boundary checks on an incoming submission. Runs before any record is
 * created or any remote call is made; collects every violation instead of
 * stopping at the first.
 */
@Component
public class SubmissionValidator {

    static final int MAX_REQUEST_LENGTH     = 10_000;
    static final int MAX_TITLE_LENGTH       = 256;
    static final int MAX_DESCRIPTION_LENGTH = 65_536;
    static final int MAX_LABELS             = 20;

    private final BranchNamer branchNamer;
    private final String      defaultHost;

    public SubmissionValidator(BranchNamer branchNamer,
                               @Value("${prflow.github.web-host:github.com}") String defaultHost) {
        this.branchNamer = branchNamer;
        this.defaultHost = defaultHost;
    }

    /**
     * @return the parsed repository locator
     * @throws ValidationException listing every violation found
     */
    public RepositoryLocator validate(PrSubmission submission) {
        List<String> violations = new ArrayList<>();

        String text = submission.freeTextRequest();
        if (text == null || text.isBlank()) {
            violations.add("freeTextRequest is required");
        } else if (text.length() > MAX_REQUEST_LENGTH) {
            violations.add("freeTextRequest must be at most " + MAX_REQUEST_LENGTH + " characters");
        }

        RepositoryLocator locator = null;
        try {
            locator = parseLocator(submission.repositoryLocator());
        } catch (ValidationException e) {
            violations.addAll(e.getViolations());
        }

        PrRequestOptions options = submission.options();
        if (options.branchName() != null) {
            BranchNameCheck check = branchNamer.validateBranchName(options.branchName());
            if (!check.valid()) violations.add("options.branchName: " + check.message());
        }
        if (options.baseBranch() != null) {
            BranchNameCheck check = branchNamer.validateBranchName(options.baseBranch());
            if (!check.valid()) violations.add("options.baseBranch: " + check.message());
        }
        if (options.prTitle() != null && options.prTitle().length() > MAX_TITLE_LENGTH) {
            violations.add("options.prTitle must be at most " + MAX_TITLE_LENGTH + " characters");
        }
        if (options.prDescription() != null && options.prDescription().length() > MAX_DESCRIPTION_LENGTH) {
            violations.add("options.prDescription must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (options.labels().size() > MAX_LABELS) {
            violations.add("options.labels must contain at most " + MAX_LABELS + " entries");
        }

        if (!violations.isEmpty()) {
            throw new ValidationException("Invalid submission: " + String.join("; ", violations), violations);
        }
        return locator;
    }

    /** Locator-only check, used by repository analysis. */
    public RepositoryLocator parseLocator(String raw) {
        return RepositoryLocator.parse(raw, defaultHost);
    }
}
