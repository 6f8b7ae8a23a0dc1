package io.revisor.core;

import io.revisor.core.execution.RetryPolicy;
import io.revisor.core.streaming.TaskEventBroadcaster;
import io.revisor.core.task.RetentionPolicy;
import java.time.Duration;

/// Configuration options for the Revisor review environment.
///
/// Controls run concurrency, stage retries and timeouts, subscriber buffering and task
/// retention. Use the [Builder] for fluent configuration or the setters for mutable
/// configuration.
///
/// ### Default Values
/// | Option | Default |
/// |---|---|
/// | `runThreads` | `8` |
/// | `maxRetries` | `2` |
/// | `initialBackoff` | `500 ms` |
/// | `maxBackoff` | `5 s` |
/// | `stageTimeout` | `120 s` |
/// | `subscriberQueueCapacity` | `256` |
/// | `maxRetainedTasks` | `100` |
/// | `retentionMaxAge` | `24 h` |
///
/// `runThreads` is the number of run threads kept alive between runs. Further concurrent
/// runs get threads of their own, so the value never caps how many tasks progress at once.
///
/// @implNote **Not thread-safe**. Configure before passing to [RevisorFactory] and do not
/// modify afterwards.
///
/// @see RevisorFactory#createEnvironment(RevisorConfig)
public class RevisorConfig {
    private int runThreads = 8;
    private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
    private Duration initialBackoff = RetryPolicy.DEFAULT_INITIAL_BACKOFF;
    private Duration maxBackoff = RetryPolicy.DEFAULT_MAX_BACKOFF;
    private Duration stageTimeout = Duration.ofSeconds(120);
    private int subscriberQueueCapacity = TaskEventBroadcaster.DEFAULT_QUEUE_CAPACITY;
    private int maxRetainedTasks = RetentionPolicy.DEFAULT_MAX_RETAINED_TASKS;
    private Duration retentionMaxAge = RetentionPolicy.DEFAULT_MAX_AGE;

    public RevisorConfig() {}

    /// Number of tasks that may run at the same time.
    public int getRunThreads() {
        return runThreads;
    }

    public void setRunThreads(int runThreads) {
        this.runThreads = runThreads;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    /// Upper bound on a single stage attempt; an attempt that exceeds it counts as a
    /// transient failure.
    public Duration getStageTimeout() {
        return stageTimeout;
    }

    public void setStageTimeout(Duration stageTimeout) {
        this.stageTimeout = stageTimeout;
    }

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }

    public int getMaxRetainedTasks() {
        return maxRetainedTasks;
    }

    public void setMaxRetainedTasks(int maxRetainedTasks) {
        this.maxRetainedTasks = maxRetainedTasks;
    }

    public Duration getRetentionMaxAge() {
        return retentionMaxAge;
    }

    public void setRetentionMaxAge(Duration retentionMaxAge) {
        this.retentionMaxAge = retentionMaxAge;
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxRetries, initialBackoff, maxBackoff);
    }

    public RetentionPolicy retentionPolicy() {
        return new RetentionPolicy(maxRetainedTasks, retentionMaxAge);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for [RevisorConfig].
    ///
    /// @implNote The builder mutates a single config instance and returns it on [#build()].
    public static class Builder {
        private final RevisorConfig config = new RevisorConfig();

        public Builder runThreads(int runThreads) {
            config.runThreads = runThreads;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            config.maxRetries = maxRetries;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            config.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            config.maxBackoff = maxBackoff;
            return this;
        }

        public Builder stageTimeout(Duration stageTimeout) {
            config.stageTimeout = stageTimeout;
            return this;
        }

        public Builder subscriberQueueCapacity(int subscriberQueueCapacity) {
            config.subscriberQueueCapacity = subscriberQueueCapacity;
            return this;
        }

        public Builder maxRetainedTasks(int maxRetainedTasks) {
            config.maxRetainedTasks = maxRetainedTasks;
            return this;
        }

        public Builder retentionMaxAge(Duration retentionMaxAge) {
            config.retentionMaxAge = retentionMaxAge;
            return this;
        }

        public RevisorConfig build() {
            return config;
        }
    }
}
