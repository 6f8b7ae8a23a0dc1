package io.revisor.core.reasoning;

import io.revisor.core.exception.FailureKind;
import java.io.Serial;
import java.util.Objects;

/// Classified failure of a [ReasoningEngine] call.
public class ReasoningException extends Exception {

    @Serial private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public ReasoningException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ReasoningException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public FailureKind getKind() {
        return kind;
    }
}
