package io.revisor.core.stage;

import io.revisor.core.task.Artifact;
import java.util.List;
import java.util.Objects;

/// Inputs handed to a [Stage] for one attempt.
///
/// @param taskId owning task, not null
/// @param stageIndex zero-based position of the stage
/// @param stageName stage label, not null
/// @param attempt attempt number, starting at 1
/// @param stageCount total number of stages in the pipeline
/// @param inputArtifact the submitted artifact, not null
/// @param priorOutputs reports of all earlier stages in pipeline order, not null
public record StageContext(
        String taskId,
        int stageIndex,
        String stageName,
        int attempt,
        int stageCount,
        Artifact inputArtifact,
        List<String> priorOutputs) {

    public StageContext {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(stageName, "stageName must not be null");
        Objects.requireNonNull(inputArtifact, "inputArtifact must not be null");
        priorOutputs =
                List.copyOf(Objects.requireNonNull(priorOutputs, "priorOutputs must not be null"));
    }

    /// Whether this is the final stage, the only one allowed to produce a derived artifact.
    public boolean isTerminalStage() {
        return stageIndex == stageCount - 1;
    }
}
