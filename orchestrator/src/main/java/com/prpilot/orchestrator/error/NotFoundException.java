package com.prpilot.orchestrator.error;

import java.util.List;
import java.util.Map;

/** Repository, branch, file, request or task that does not exist. */
public class NotFoundException extends PrFlowException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message, false,
                List.of("Verify the repository locator, branch and file path",
                        "Check that the token can see private repositories"),
                Map.of());
    }
}
