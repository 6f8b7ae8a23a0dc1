package io.revisor.core.task;

import io.revisor.core.exception.InvalidTransitionException;
import java.util.List;
import java.util.Optional;

/// Authoritative store of task state.
///
/// Every mutation is atomic per task and returns the resulting snapshot. An empty
/// `Optional` means the task id is unknown. Operations on different tasks never block one
/// another.
///
/// @see InMemoryTaskRegistry
public interface TaskRegistry {

    /// Registers a new `PENDING` task with one `IDLE` stage record per name.
    ///
    /// @param inputArtifact the submitted artifact, not null
    /// @param stageNames ordered stage names, not null, not empty
    /// @return the initial snapshot, never null
    Task create(Artifact inputArtifact, List<String> stageNames);

    Optional<Task> get(String taskId);

    /// Moves the task to `newStatus`.
    ///
    /// @throws InvalidTransitionException if the move breaks ordering or task invariants
    Optional<Task> transitionTask(String taskId, TaskStatus newStatus, TaskUpdate update);

    /// Moves stage `stageIndex` of the task to `newStatus`.
    ///
    /// `RUNNING -> RUNNING` records a retry and increments the stage's attempt counter.
    ///
    /// @throws InvalidTransitionException if the task is not running, an earlier stage is not
    ///     completed, another stage is running, the index is out of range, the move goes
    ///     backwards, or the update lacks the required output or error
    Optional<Task> transitionStage(
            String taskId, int stageIndex, StageStatus newStatus, StageUpdate update);

    /// Returns matching snapshots ordered by creation time, newest first.
    List<Task> list(TaskFilter filter);

    /// Removes a pending or terminal task.
    ///
    /// @return `true` if a task was removed, `false` if the id is unknown
    /// @throws InvalidTransitionException if the task is running
    boolean delete(String taskId);

    int size();
}
