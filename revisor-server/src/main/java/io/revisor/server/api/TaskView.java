package io.revisor.server.api;

import io.revisor.core.task.StageRecord;
import io.revisor.core.task.Task;
import java.time.Instant;
import java.util.List;

/// JSON view of a task snapshot.
///
/// Leaves out artifact content and stage reports; those are served by the result endpoint.
///
/// @param taskId task identifier
/// @param fileName submitted file name
/// @param status task status
/// @param progress completed stages as a percentage
/// @param version snapshot version, matches the `id` of SSE events
/// @param stages per-stage progress in pipeline order
/// @param createdAt creation time
/// @param updatedAt time of the latest change
/// @param startedAt start of the run, may be null
/// @param finishedAt end of the run, may be null
/// @param error failure description, may be null
/// @param outputLocation where the fixed file was stored, may be null
public record TaskView(
        String taskId,
        String fileName,
        String status,
        int progress,
        long version,
        List<StageView> stages,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt,
        String error,
        String outputLocation) {

    public static TaskView from(Task task) {
        return new TaskView(
                task.id(),
                task.inputArtifact().name(),
                task.status().name(),
                task.progress(),
                task.version(),
                task.stages().stream().map(StageView::from).toList(),
                task.createdAt(),
                task.updatedAt(),
                task.startedAt(),
                task.finishedAt(),
                task.error(),
                task.output().map(o -> o.location()).orElse(null));
    }

    public record StageView(
            int index,
            String name,
            String status,
            int attempt,
            Instant startedAt,
            Instant finishedAt,
            String error) {

        public static StageView from(StageRecord stage) {
            return new StageView(
                    stage.index(),
                    stage.name(),
                    stage.status().name(),
                    stage.attempt(),
                    stage.startedAt(),
                    stage.finishedAt(),
                    stage.error());
        }
    }
}
