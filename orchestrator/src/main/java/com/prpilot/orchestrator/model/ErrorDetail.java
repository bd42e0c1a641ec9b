package com.prpilot.orchestrator.model;

import com.prpilot.orchestrator.error.ErrorCode;
import com.prpilot.orchestrator.error.PrFlowException;

import java.util.List;
import java.util.Map;

/** Classified terminal failure, stored on both the run and its request. */
public record ErrorDetail(
        ErrorCode code,
        String message,
        List<String> suggestions,
        boolean retryPossible,
        Map<String, Object> details
) {
    public static ErrorDetail from(PrFlowException e) {
        return new ErrorDetail(e.getCode(), e.getMessage(), e.getSuggestions(),
                e.isRetryable(), e.getDetails());
    }

    public static ErrorDetail internal(Throwable t) {
        return new ErrorDetail(ErrorCode.INTERNAL_ERROR,
                "Unexpected failure: " + t.getClass().getSimpleName()
                        + (t.getMessage() == null ? "" : ": " + t.getMessage()),
                List.of("Check the service logs for the stack trace"),
                false, Map.of());
    }
}
