package com.prpilot.orchestrator.gateway;

import com.prpilot.orchestrator.error.ErrorCode;
import com.prpilot.orchestrator.error.PrFlowException;
import com.prpilot.orchestrator.error.RateLimitException;
import com.prpilot.orchestrator.error.TransientNetworkException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retry/backoff applied uniformly to every remote call the gateway makes.
 *
 * Only {@link RateLimitException} and {@link TransientNetworkException} are
 * retried; everything else surfaces on the first attempt. Rate limits wait
 * for the remote's reset hint when it is short enough, otherwise the error is
 * surfaced (still marked retryable) instead of parking a worker. Transient
 * failures back off exponentially with jitter.
 *
 * The policy holds configuration only. Attempt counters live on the stack of
 * each {@link #execute} call, so one instance is shared by all runs.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** Blocking wait, swappable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

    private final int           maxAttempts;
    private final Duration      baseDelay;
    private final Duration      maxDelay;
    private final Duration      maxRateLimitWait;
    private final Sleeper       sleeper;
    private final MeterRegistry meterRegistry;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay,
                       Duration maxRateLimitWait, Sleeper sleeper, MeterRegistry meterRegistry) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts      = maxAttempts;
        this.baseDelay        = baseDelay;
        this.maxDelay         = maxDelay;
        this.maxRateLimitWait = maxRateLimitWait;
        this.sleeper          = sleeper;
        this.meterRegistry    = meterRegistry;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RateLimitException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{}: rate limited, giving up after {} attempts", operation, attempt);
                    throw e;
                }
                Duration wait = e.getResetAfter().orElseGet(() -> backoff(1));
                if (wait.compareTo(maxRateLimitWait) > 0) {
                    log.warn("{}: rate limit resets in {}s, longer than the {}s we are willing to wait",
                            operation, wait.toSeconds(), maxRateLimitWait.toSeconds());
                    throw e;
                }
                pause(operation, "rate_limited", attempt, wait, e);
            } catch (TransientNetworkException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{}: transient failure, giving up after {} attempts: {}",
                            operation, attempt, e.getMessage());
                    throw e;
                }
                pause(operation, "transient", attempt, backoff(attempt), e);
            }
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before retry number {@code attempt}: base * 2^(attempt-1), capped,
     * then jittered into the upper half of that window.
     */
    Duration backoff(int attempt) {
        long exp    = baseDelay.toMillis() << Math.min(attempt - 1, 20);
        long capped = Math.min(exp, maxDelay.toMillis());
        long half   = capped / 2;
        long jitter = half == 0 ? 0 : ThreadLocalRandom.current().nextLong(half + 1);
        return Duration.ofMillis(half + jitter);
    }

    private void pause(String operation, String reason, int attempt, Duration wait, PrFlowException cause) {
        log.info("{}: {} (attempt {}/{}), retrying in {} ms: {}",
                operation, reason, attempt, maxAttempts, wait.toMillis(), cause.getMessage());
        meterRegistry.counter("prflow.gateway.retries", "operation", operation, "reason", reason).increment();
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new PrFlowException(ErrorCode.INTERNAL_ERROR,
                    operation + " interrupted while waiting to retry", false,
                    List.of("Resubmit the request"), Map.of(), ie);
        }
    }
}
