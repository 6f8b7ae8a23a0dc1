package io.revisor.core.storage;

import io.revisor.core.exception.FailureKind;
import java.io.Serial;
import java.util.Objects;

/// Classified failure of an [ArtifactStorage] operation.
///
/// I/O problems are `TRANSIENT`; invalid names or content are `PERMANENT`.
public class ArtifactStorageException extends Exception {

    @Serial private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public ArtifactStorageException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ArtifactStorageException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public FailureKind getKind() {
        return kind;
    }
}
