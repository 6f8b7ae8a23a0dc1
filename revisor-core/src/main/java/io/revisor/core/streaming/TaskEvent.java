package io.revisor.core.streaming;

import io.revisor.core.result.ReviewResult;
import io.revisor.core.task.StageRecord;
import io.revisor.core.task.Task;
import java.time.Instant;

/// Progress notifications for one task.
///
/// Each event carries the version of the task snapshot it was derived from. Versions grow
/// by one per registry mutation, which lets a subscriber line events up against the
/// snapshot it received on subscription.
///
/// ### Event Types
/// - `task.snapshot` - state of the task when the subscriber attached; always first
/// - `task.started` - task moved to `RUNNING`
/// - `stage.started` - stage began its first attempt
/// - `stage.retrying` - a transient failure is being retried
/// - `stage.completed` - stage produced its report
/// - `stage.failed` - stage failed permanently
/// - `task.completed` - every stage completed; carries the final snapshot and result
/// - `task.failed` - task failed; carries the final snapshot
/// - `subscriber.overflow` - the receiving subscriber fell behind and was detached
///
/// @see TaskEventBroadcaster
public sealed interface TaskEvent {

    /// Returns the event type identifier.
    String type();

    String taskId();

    /// Version of the task snapshot this event reflects.
    long version();

    /// Status of the task or stage after the change, as an enum constant name.
    String status();

    Instant timestamp();

    /// Whether no further events follow for the task.
    default boolean isTerminal() {
        return false;
    }

    /// Task state at the moment a subscriber attached. Later events carry newer versions.
    record TaskSnapshot(String taskId, long version, String status, Task task, Instant timestamp)
            implements TaskEvent {

        @Override
        public String type() {
            return "task.snapshot";
        }

        public static TaskSnapshot of(Task task) {
            return new TaskSnapshot(
                    task.id(), task.version(), task.status().name(), task, task.updatedAt());
        }
    }

    record TaskStarted(String taskId, long version, String status, Instant timestamp)
            implements TaskEvent {

        @Override
        public String type() {
            return "task.started";
        }

        public static TaskStarted of(Task task) {
            return new TaskStarted(
                    task.id(), task.version(), task.status().name(), task.updatedAt());
        }
    }

    record StageStarted(
            String taskId,
            long version,
            int stageIndex,
            String stageName,
            int attempt,
            String status,
            Instant timestamp)
            implements TaskEvent {

        @Override
        public String type() {
            return "stage.started";
        }

        public static StageStarted of(Task task, int stageIndex) {
            StageRecord stage = task.stage(stageIndex);
            return new StageStarted(
                    task.id(),
                    task.version(),
                    stageIndex,
                    stage.name(),
                    stage.attempt(),
                    stage.status().name(),
                    task.updatedAt());
        }
    }

    record StageRetrying(
            String taskId,
            long version,
            int stageIndex,
            String stageName,
            int attempt,
            String error,
            String status,
            Instant timestamp)
            implements TaskEvent {

        @Override
        public String type() {
            return "stage.retrying";
        }

        public static StageRetrying of(Task task, int stageIndex, String error) {
            StageRecord stage = task.stage(stageIndex);
            return new StageRetrying(
                    task.id(),
                    task.version(),
                    stageIndex,
                    stage.name(),
                    stage.attempt(),
                    error,
                    stage.status().name(),
                    task.updatedAt());
        }
    }

    record StageCompleted(
            String taskId,
            long version,
            int stageIndex,
            String stageName,
            int attempt,
            String output,
            String status,
            Instant timestamp)
            implements TaskEvent {

        @Override
        public String type() {
            return "stage.completed";
        }

        public static StageCompleted of(Task task, int stageIndex) {
            StageRecord stage = task.stage(stageIndex);
            return new StageCompleted(
                    task.id(),
                    task.version(),
                    stageIndex,
                    stage.name(),
                    stage.attempt(),
                    stage.output(),
                    stage.status().name(),
                    task.updatedAt());
        }
    }

    record StageFailed(
            String taskId,
            long version,
            int stageIndex,
            String stageName,
            int attempt,
            String error,
            String status,
            Instant timestamp)
            implements TaskEvent {

        @Override
        public String type() {
            return "stage.failed";
        }

        public static StageFailed of(Task task, int stageIndex) {
            StageRecord stage = task.stage(stageIndex);
            return new StageFailed(
                    task.id(),
                    task.version(),
                    stageIndex,
                    stage.name(),
                    stage.attempt(),
                    stage.error(),
                    stage.status().name(),
                    task.updatedAt());
        }
    }

    record TaskCompleted(
            String taskId,
            long version,
            String status,
            Task snapshot,
            ReviewResult result,
            Instant timestamp)
            implements TaskEvent {

        @Override
        public String type() {
            return "task.completed";
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        public static TaskCompleted of(Task task, ReviewResult result) {
            return new TaskCompleted(
                    task.id(),
                    task.version(),
                    task.status().name(),
                    task,
                    result,
                    task.updatedAt());
        }
    }

    record TaskFailed(
            String taskId,
            long version,
            String status,
            String error,
            Task snapshot,
            Instant timestamp)
            implements TaskEvent {

        @Override
        public String type() {
            return "task.failed";
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        public static TaskFailed of(Task task) {
            return new TaskFailed(
                    task.id(),
                    task.version(),
                    task.status().name(),
                    task.error(),
                    task,
                    task.updatedAt());
        }
    }

    /// Final notice delivered to a subscriber whose queue overflowed.
    ///
    /// `version` is the version of the first event that did not fit.
    record SubscriberOverflow(
            String taskId, long version, int capacity, String status, Instant timestamp)
            implements TaskEvent {

        public static final String STATUS = "DETACHED";

        @Override
        public String type() {
            return "subscriber.overflow";
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        public static SubscriberOverflow now(String taskId, long version, int capacity) {
            return new SubscriberOverflow(taskId, version, capacity, STATUS, Instant.now());
        }
    }
}
