package io.revisor.core.result;

import io.revisor.core.task.DerivedArtifact;
import io.revisor.core.task.TaskStatus;
import java.util.List;
import java.util.Objects;

/// Final bundle returned to the submitter once a task is finished.
///
/// @param taskId task identifier, not null
/// @param status task status at assembly time, not null
/// @param fileName name of the submitted artifact, not null
/// @param sections reports of completed stages in pipeline order, not null
/// @param combinedReport all section reports under numbered headings, not null
/// @param outputArtifact derived artifact, may be null
/// @param error failure description of a failed task, may be null
/// @param inputStats size figures of the submitted artifact, not null
/// @param outputStats size figures of the derived artifact, null without one
public record ReviewResult(
        String taskId,
        TaskStatus status,
        String fileName,
        List<Section> sections,
        String combinedReport,
        DerivedArtifact outputArtifact,
        String error,
        ArtifactStats inputStats,
        ArtifactStats outputStats) {

    public ReviewResult {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(combinedReport, "combinedReport must not be null");
        Objects.requireNonNull(inputStats, "inputStats must not be null");
        sections = List.copyOf(Objects.requireNonNull(sections, "sections must not be null"));
    }

    /// One stage's contribution to the result.
    ///
    /// @param index stage position
    /// @param name stage name
    /// @param report stage report
    public record Section(int index, String name, String report) {}
}
