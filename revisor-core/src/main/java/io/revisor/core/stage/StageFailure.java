package io.revisor.core.stage;

import io.revisor.core.exception.FailureKind;
import java.io.Serial;
import java.util.Objects;

/// Classified failure of a stage attempt.
///
/// @see FailureKind
public class StageFailure extends Exception {

    @Serial private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public StageFailure(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public StageFailure(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public static StageFailure transientFailure(String message) {
        return new StageFailure(FailureKind.TRANSIENT, message);
    }

    public static StageFailure permanentFailure(String message) {
        return new StageFailure(FailureKind.PERMANENT, message);
    }

    public FailureKind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind.isRetryable();
    }

    /// Escalates a transient failure that used up the retry budget.
    ///
    /// @param attempts number of attempts made
    /// @return a permanent failure wrapping this one
    public StageFailure exhausted(int attempts) {
        return new StageFailure(
                FailureKind.PERMANENT,
                "Gave up after " + attempts + " attempts: " + getMessage(),
                this);
    }
}
