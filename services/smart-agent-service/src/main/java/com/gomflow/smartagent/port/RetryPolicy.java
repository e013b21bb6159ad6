package com.gomflow.smartagent.port;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff: attempt n waits {@code baseDelay * multiplier^(n-1)},
 * never more than {@code maxDelay}.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double multiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be shorter than baseDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static RetryPolicy singleAttempt() {
        return new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1), 1.0);
    }

    /**
     * Delay before the attempt that follows {@code failedAttempts} failures.
     */
    public Duration delayAfter(int failedAttempts) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempts - 1));
        double millis = Math.min(baseDelay.toMillis() * factor, maxDelay.toMillis());
        return Duration.ofMillis((long) millis);
    }

    public RetryConfig toRetryConfig(Predicate<Throwable> retryOn) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        baseDelay.toMillis(), multiplier, maxDelay.toMillis()))
                .retryOnException(retryOn)
                .build();
    }
}
