package io.revisor.core.task;

/// Payload carried by a stage status transition.
///
/// @param output stage report, required on `COMPLETED`
/// @param error failure description, required on `FAILED`
public record StageUpdate(String output, String error) {

    private static final StageUpdate NONE = new StageUpdate(null, null);

    public static StageUpdate none() {
        return NONE;
    }

    public static StageUpdate output(String output) {
        return new StageUpdate(output, null);
    }

    public static StageUpdate error(String error) {
        return new StageUpdate(null, error);
    }
}
