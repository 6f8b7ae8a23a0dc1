package io.revisor.core.execution;

import java.time.Duration;
import java.util.Objects;

/// Retry budget and exponential backoff for transient stage failures.
///
/// The delay before retry number `n` (after attempt `n` failed) is
/// `initialBackoff * 2^(n-1)`, capped at `maxBackoff`.
///
/// @param maxRetries retries allowed after the first attempt, not negative
/// @param initialBackoff delay before the first retry, not negative
/// @param maxBackoff upper bound of any single delay, not less than `initialBackoff`
public record RetryPolicy(int maxRetries, Duration initialBackoff, Duration maxBackoff) {

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(5);

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must not be less than initialBackoff");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_BACKOFF, DEFAULT_MAX_BACKOFF);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /// Whether another attempt is allowed after attempt number `attempt` failed.
    public boolean allowsRetryAfter(int attempt) {
        return attempt <= maxRetries;
    }

    /// Delay to wait after attempt number `attempt` failed.
    public Duration backoff(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        int shift = Math.min(attempt - 1, 30);
        long millis = initialBackoff.toMillis();
        long scaled = millis > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : millis << shift;
        return scaled >= maxBackoff.toMillis() ? maxBackoff : Duration.ofMillis(scaled);
    }
}
