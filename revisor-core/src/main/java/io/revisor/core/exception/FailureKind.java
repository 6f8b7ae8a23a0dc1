package io.revisor.core.exception;

/// Classification of a failure raised while executing a stage or one of its collaborators.
///
/// The pipeline executor retries `TRANSIENT` failures with exponential backoff until the
/// retry budget is spent. `PERMANENT` failures fail the stage immediately.
public enum FailureKind {
    /// Retryable: timeouts, I/O errors, rate limits, upstream 5xx responses.
    TRANSIENT,

    /// Not retryable: invalid input, malformed collaborator responses, exhausted retries.
    PERMANENT;

    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
