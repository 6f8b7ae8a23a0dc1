package io.revisor.core.reasoning;

import java.util.Objects;
import java.util.Optional;

/// Output of one reasoning engine call.
///
/// @param report analysis text, not null
/// @param revisedContent full revised artifact content, null when none was produced
public record ReasoningResult(String report, String revisedContent) {

    public ReasoningResult {
        Objects.requireNonNull(report, "report must not be null");
    }

    public static ReasoningResult report(String report) {
        return new ReasoningResult(report, null);
    }

    public static ReasoningResult withRevision(String report, String revisedContent) {
        return new ReasoningResult(
                report, Objects.requireNonNull(revisedContent, "revisedContent must not be null"));
    }

    public Optional<String> revision() {
        return Optional.ofNullable(revisedContent);
    }
}
