package com.govsync.distribution;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Exponential reconnect backoff: {@code min(base * 2^attempt, max)} for a zero-based
 * attempt, with at most {@code maxAttempts} attempts before push tiers are abandoned.
 */
public record ReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts) {

    private static final double MULTIPLIER = 2.0;
    private static final int MAX_DOUBLINGS = 63;

    public ReconnectPolicy {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("require 0 <= baseDelay <= maxDelay");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative");
        }
    }

    public Duration delayFor(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        // IntervalFunction rejects intervals below 1 ms
        if (baseDelay.toMillis() < 1) {
            return Duration.ZERO;
        }
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
            baseDelay.toMillis(), MULTIPLIER, maxDelay.toMillis());
        // IntervalFunction counts attempts from 1 and walks every step; past 2^63 the cap applies anyway
        return Duration.ofMillis(backoff.apply(Math.min(attempt, MAX_DOUBLINGS) + 1));
    }

    public boolean exhausted(int attemptsMade) {
        return attemptsMade >= maxAttempts;
    }
}
