package io.revisor.core.task;

/// Payload carried by a task status transition.
///
/// @param outputArtifact artifact to attach on `COMPLETED`, may be null
/// @param error failure description, required on `FAILED`
public record TaskUpdate(DerivedArtifact outputArtifact, String error) {

    private static final TaskUpdate NONE = new TaskUpdate(null, null);

    public static TaskUpdate none() {
        return NONE;
    }

    public static TaskUpdate completed(DerivedArtifact outputArtifact) {
        return new TaskUpdate(outputArtifact, null);
    }

    public static TaskUpdate failed(String error) {
        return new TaskUpdate(null, error);
    }
}
