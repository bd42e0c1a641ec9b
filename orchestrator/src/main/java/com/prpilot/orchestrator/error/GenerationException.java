package com.prpilot.orchestrator.error;

import java.util.List;
import java.util.Map;

/** The code generator failed or returned nothing usable. Not retried by the orchestrator. */
public class GenerationException extends PrFlowException {

    public GenerationException(String message) {
        this(message, null);
    }

    public GenerationException(String message, Throwable cause) {
        super(ErrorCode.GENERATION_ERROR, message, false,
                List.of("Rephrase the request with concrete file names and behaviour",
                        "Check the code generator configuration and credentials"),
                Map.of(), cause);
    }
}
