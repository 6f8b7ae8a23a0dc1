package io.revisor.core.exception;

import java.io.Serial;

/// Thrown by the task registry when a requested status change would break task ordering.
///
/// Examples are starting a stage while an earlier stage has not completed, completing a
/// task with unfinished stages, or moving any status backwards. Callers inside the
/// pipeline treat this as an internal consistency defect, never as a stage failure.
///
/// @see io.revisor.core.task.TaskRegistry
public class InvalidTransitionException extends IllegalStateException {

    @Serial private static final long serialVersionUID = 1L;

    private final String taskId;

    public InvalidTransitionException(String taskId, String message) {
        super("Task " + taskId + ": " + message);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
