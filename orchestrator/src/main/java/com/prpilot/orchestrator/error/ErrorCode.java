package com.prpilot.orchestrator.error;

/**
 * Classification attached to every failure the platform reports.
 *
 * The wire form ({@link #code()}) is what callers see in the error body and
 * in a failed step's record.
 */
public enum ErrorCode {
    VALIDATION_ERROR,            // malformed input or rejected change set; never retried
    AUTHENTICATION_ERROR,        // credential rejected by the remote; needs operator action
    NOT_FOUND,                   // repository, branch or file absent
    RATE_LIMITED,                // throttled; retried inside the gateway up to a bound
    TRANSIENT_NETWORK_ERROR,     // timeouts, 5xx, secondary rate limits
    NAME_COLLISION,              // branch name already taken
    NAME_GENERATION_EXHAUSTED,   // no free branch name within the attempt budget
    GENERATION_ERROR,            // code generator failed or produced nothing usable
    PARTIAL_COMMIT,              // some but not all files landed on the branch
    REMOTE_ERROR,                // unexpected remote response
    INTERNAL_ERROR;

    public String code() {
        return name().toLowerCase();
    }
}
