package com.prpilot.orchestrator.api.dto;

import com.prpilot.orchestrator.model.ErrorDetail;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The one error shape every endpoint returns:
 * {@code {error: {code, message, details, suggestions, retryPossible}, timestamp, errorId}}.
 */
public record ErrorResponse(ErrorBody error, Instant timestamp, String errorId) {

    public record ErrorBody(String code,
                            String message,
                            Map<String, Object> details,
                            List<String> suggestions,
                            boolean retryPossible) {

        public static ErrorBody from(ErrorDetail d) {
            return new ErrorBody(d.code().code(), d.message(),
                    d.details().isEmpty() ? null : d.details(), d.suggestions(), d.retryPossible());
        }
    }
}
