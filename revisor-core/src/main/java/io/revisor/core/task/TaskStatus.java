package io.revisor.core.task;

/// Lifecycle status of a [Task].
///
/// ```
/// PENDING ──> RUNNING ──┬──> COMPLETED
///                       └──> FAILED
/// ```
///
/// Statuses only move forward; `COMPLETED` and `FAILED` are terminal.
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /// Returns whether a task in this status may move to `next`.
    ///
    /// @param next the requested status, not null
    /// @return `true` for the forward moves shown in the type diagram
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
