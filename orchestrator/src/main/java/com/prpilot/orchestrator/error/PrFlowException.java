package com.prpilot.orchestrator.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the classified failure hierarchy.
 *
 * Unchecked so callers only catch it where they have a specific recovery
 * strategy. The orchestrator turns any instance that escapes a step into the
 * run's terminal failure record.
 */
public class PrFlowException extends RuntimeException {

    private final ErrorCode           code;
    private final boolean             retryable;
    private final List<String>        suggestions;
    private final Map<String, Object> details;

    public PrFlowException(ErrorCode code, String message, boolean retryable,
                           List<String> suggestions, Map<String, Object> details) {
        this(code, message, retryable, suggestions, details, null);
    }

    public PrFlowException(ErrorCode code, String message, boolean retryable,
                           List<String> suggestions, Map<String, Object> details,
                           Throwable cause) {
        super(message, cause);
        this.code        = code;
        this.retryable   = retryable;
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        this.details     = details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
    }

    public ErrorCode getCode()                { return code; }
    public boolean isRetryable()              { return retryable; }
    public List<String> getSuggestions()      { return suggestions; }
    public Map<String, Object> getDetails()   { return Map.copyOf(details); }

    /** Adds a detail entry; used by the orchestrator to report side effects. */
    public PrFlowException withDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }
}
