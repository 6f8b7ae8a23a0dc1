package io.revisor.core.task;

/// Lifecycle status of one [StageRecord].
///
/// `RUNNING -> RUNNING` is the retry move: the stage stays running and its attempt counter
/// is incremented.
public enum StageStatus {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(StageStatus next) {
        return switch (this) {
            case IDLE -> next == RUNNING;
            case RUNNING -> next == RUNNING || next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
