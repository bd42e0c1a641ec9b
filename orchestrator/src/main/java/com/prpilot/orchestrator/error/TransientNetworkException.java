package com.prpilot.orchestrator.error;

import java.util.List;
import java.util.Map;

/** Timeout, connection failure, 5xx or secondary rate limit. */
public class TransientNetworkException extends PrFlowException {

    public TransientNetworkException(String message, Throwable cause) {
        super(ErrorCode.TRANSIENT_NETWORK_ERROR, message, true,
                List.of("Retry the request later", "Check connectivity to the version-control service"),
                Map.of(), cause);
    }

    public TransientNetworkException(String message, int status) {
        super(ErrorCode.TRANSIENT_NETWORK_ERROR, message, true,
                List.of("Retry the request later", "Check the version-control service status page"),
                Map.of("status", status));
    }
}
