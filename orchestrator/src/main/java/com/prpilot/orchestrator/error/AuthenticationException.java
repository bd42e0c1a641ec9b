package com.prpilot.orchestrator.error;

import java.util.List;
import java.util.Map;

/** The remote rejected the configured credential (HTTP 401/403). */
public class AuthenticationException extends PrFlowException {

    public AuthenticationException(String message, int status) {
        super(ErrorCode.AUTHENTICATION_ERROR, message, false,
                List.of("Check that the GitHub token is valid and not expired",
                        "Verify the token has the repo scope and push access to the repository"),
                Map.of("status", status));
    }
}
