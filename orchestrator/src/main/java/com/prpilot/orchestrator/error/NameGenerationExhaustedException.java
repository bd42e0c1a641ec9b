package com.prpilot.orchestrator.error;

import java.util.List;
import java.util.Map;

/** Every candidate branch name within the attempt budget was taken. */
public class NameGenerationExhaustedException extends PrFlowException {

    public NameGenerationExhaustedException(String baseName, int attempts) {
        super(ErrorCode.NAME_GENERATION_EXHAUSTED,
                "No free branch name derived from '" + baseName + "' after " + attempts + " attempts",
                false,
                List.of("Supply an explicit branchName", "Delete stale automation branches on the remote"),
                Map.of("attempts", attempts));
    }
}
