package com.prpilot.orchestrator.error;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary rate limit hit. Carries the remote's reset hint when one was sent
 * (Retry-After or x-ratelimit-reset).
 */
public class RateLimitException extends PrFlowException {

    private final Duration resetAfter;

    public RateLimitException(String message, Duration resetAfter) {
        super(ErrorCode.RATE_LIMITED, message, true,
                List.of("Wait for the rate limit window to reset and retry",
                        "Reduce concurrent submissions against the same credential"),
                resetAfter == null ? Map.of() : Map.of("resetAfterSeconds", resetAfter.toSeconds()));
        this.resetAfter = resetAfter;
    }

    public Optional<Duration> getResetAfter() { return Optional.ofNullable(resetAfter); }
}
