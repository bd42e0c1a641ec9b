package com.prpilot.orchestrator.error;

import java.util.List;
import java.util.Map;

/**
 * Malformed input or a change set that failed policy checks.
 * Raised before anything reaches the remote and never retried.
 */
public class ValidationException extends PrFlowException {

    private final List<String> violations;

    public ValidationException(String message, List<String> violations) {
        super(ErrorCode.VALIDATION_ERROR, message, false,
                List.of("Correct the listed violations and resubmit the request"),
                Map.of("violations", List.copyOf(violations)));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String message) {
        this(message, List.of(message));
    }

    public List<String> getViolations() { return violations; }
}
