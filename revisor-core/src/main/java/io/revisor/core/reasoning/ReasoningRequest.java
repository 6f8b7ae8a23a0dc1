package io.revisor.core.reasoning;

import io.revisor.core.task.Artifact;
import java.util.List;
import java.util.Objects;

/// Input for one reasoning engine call.
///
/// @param taskId owning task, not null
/// @param artifact artifact under review, not null
/// @param priorReports reports of earlier stages in pipeline order, not null
/// @param instructions stage-specific instructions, not null
/// @param expectsRevision whether the engine should also return revised artifact content
public record ReasoningRequest(
        String taskId,
        Artifact artifact,
        List<String> priorReports,
        String instructions,
        boolean expectsRevision) {

    public ReasoningRequest {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(artifact, "artifact must not be null");
        Objects.requireNonNull(instructions, "instructions must not be null");
        priorReports =
                List.copyOf(Objects.requireNonNull(priorReports, "priorReports must not be null"));
    }
}
