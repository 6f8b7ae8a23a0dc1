package io.revisor.core.task;

import java.time.Duration;
import java.util.Objects;

/// Bounds on how many finished tasks the registry keeps and for how long.
///
/// @param maxRetainedTasks registry size above which the oldest finished tasks are evicted
/// @param maxAge finished tasks older than this are evicted regardless of registry size
public record RetentionPolicy(int maxRetainedTasks, Duration maxAge) {

    public static final int DEFAULT_MAX_RETAINED_TASKS = 100;
    public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(24);

    public RetentionPolicy {
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxRetainedTasks <= 0) {
            throw new IllegalArgumentException("maxRetainedTasks must be positive");
        }
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be positive");
        }
    }

    public static RetentionPolicy defaults() {
        return new RetentionPolicy(DEFAULT_MAX_RETAINED_TASKS, DEFAULT_MAX_AGE);
    }
}
