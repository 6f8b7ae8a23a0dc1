package io.revisor.core.task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Immutable snapshot of one submission's run through the pipeline.
///
/// Snapshots are produced exclusively by a [TaskRegistry]. Every registry mutation yields a
/// new snapshot whose `version` is one higher than the previous one, so two snapshots of the
/// same task can be ordered without comparing timestamps.
///
/// ### Contracts
/// - `stages` has fixed length and order from creation on
/// - at most one stage is `RUNNING`
/// - a `COMPLETED` task has every stage `COMPLETED`
/// - a `FAILED` task has no `RUNNING` stage, at most one `FAILED` stage, and only `IDLE`
///   stages after it
///
/// @param id opaque unique identifier, not null
/// @param status current lifecycle status, not null
/// @param stages ordered stage records, not null
/// @param inputArtifact submitted artifact, not null
/// @param outputArtifact derived artifact, set only on `COMPLETED` when a stage produced one
/// @param createdAt creation time, not null
/// @param updatedAt time of the latest mutation, never decreasing, not null
/// @param startedAt when the task moved to `RUNNING`, may be null
/// @param finishedAt when the task reached a terminal status, may be null
/// @param error failure description, set only on `FAILED`
/// @param version mutation counter, `0` at creation
public record Task(
        String id,
        TaskStatus status,
        List<StageRecord> stages,
        Artifact inputArtifact,
        DerivedArtifact outputArtifact,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt,
        String error,
        long version) {

    public Task {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(inputArtifact, "inputArtifact must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        stages = List.copyOf(Objects.requireNonNull(stages, "stages must not be null"));
    }

    /// Creates the initial `PENDING` snapshot with one `IDLE` record per stage name.
    static Task pending(String id, Artifact input, List<String> stageNames, Instant now) {
        List<StageRecord> records = new ArrayList<>(stageNames.size());
        for (int i = 0; i < stageNames.size(); i++) {
            records.add(StageRecord.idle(i, stageNames.get(i)));
        }
        return new Task(
                id, TaskStatus.PENDING, records, input, null, now, now, null, null, null, 0);
    }

    public StageRecord stage(int index) {
        return stages.get(index);
    }

    public int stageCount() {
        return stages.size();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Optional<StageRecord> runningStage() {
        return stages.stream().filter(s -> s.status() == StageStatus.RUNNING).findFirst();
    }

    public Optional<StageRecord> failedStage() {
        return stages.stream().filter(s -> s.status() == StageStatus.FAILED).findFirst();
    }

    public Optional<DerivedArtifact> output() {
        return Optional.ofNullable(outputArtifact);
    }

    /// Returns the share of completed stages as a whole percentage between 0 and 100.
    public int progress() {
        if (stages.isEmpty()) {
            return status == TaskStatus.COMPLETED ? 100 : 0;
        }
        long completed = stages.stream().filter(s -> s.status() == StageStatus.COMPLETED).count();
        return (int) (completed * 100 / stages.size());
    }

    @Override
    public String toString() {
        return "Task[id="
                + id
                + ", status="
                + status
                + ", progress="
                + progress()
                + "%, version="
                + version
                + "]";
    }
}
