package io.revisor.core.stage;

import io.revisor.core.task.DerivedArtifact;
import java.util.Objects;

/// Successful result of a stage attempt.
///
/// The variant tells the executor whether the stage also produced a derived artifact, so
/// no caller ever needs to inspect the report text to find out.
public sealed interface StageOutcome {

    /// Human-readable stage report.
    String report();

    /// Plain report.
    record Report(String report) implements StageOutcome {
        public Report {
            Objects.requireNonNull(report, "report must not be null");
        }
    }

    /// Report together with an artifact already persisted by the stage.
    record ReportWithArtifact(String report, DerivedArtifact artifact) implements StageOutcome {
        public ReportWithArtifact {
            Objects.requireNonNull(report, "report must not be null");
            Objects.requireNonNull(artifact, "artifact must not be null");
        }
    }
}
