package io.github.drompincen.taskclaw.runtime.retry;

import java.time.Duration;

/**
 * Exponential backoff bounded by attempts and by total elapsed time.
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxElapsed) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(5));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /** Delay before the given attempt; attempt 2 waits {@link #initialDelay()}. */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double factor = Math.pow(multiplier, attempt - 2);
        return Duration.ofMillis(Math.round(initialDelay.toMillis() * factor));
    }
}
