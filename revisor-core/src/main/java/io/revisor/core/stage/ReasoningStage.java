package io.revisor.core.stage;

import io.revisor.core.reasoning.ReasoningEngine;
import io.revisor.core.reasoning.ReasoningException;
import io.revisor.core.reasoning.ReasoningRequest;
import io.revisor.core.reasoning.ReasoningResult;
import io.revisor.core.storage.ArtifactNames;
import io.revisor.core.storage.ArtifactStorage;
import io.revisor.core.storage.ArtifactStorageException;
import io.revisor.core.task.DerivedArtifact;
import java.util.Objects;
import java.util.logging.Logger;

/// Stage that delegates its work to a [ReasoningEngine].
///
/// Each instance carries fixed instructions describing what the engine should look for.
/// An artifact-producing stage asks the engine for revised content when it runs as the
/// terminal stage and persists that content through [ArtifactStorage].
///
/// ### Failure classification
/// | Source | Kind |
/// |---|---|
/// | `ReasoningException` | kind reported by the engine |
/// | `ArtifactStorageException` | kind reported by the storage |
/// | blank report or revision | permanent |
/// | attempt abandoned before the revision was stored | permanent |
///
/// @see Pipeline#codeReview(ReasoningEngine, ArtifactStorage)
public final class ReasoningStage implements Stage {

    private static final Logger logger = Logger.getLogger(ReasoningStage.class.getName());

    private final String name;
    private final String instructions;
    private final ReasoningEngine engine;
    private final ArtifactStorage storage;

    private ReasoningStage(
            String name, String instructions, ReasoningEngine engine, ArtifactStorage storage) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.instructions = Objects.requireNonNull(instructions, "instructions must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.storage = storage;
    }

    /// Creates a stage that only reports.
    public static ReasoningStage reporting(
            String name, String instructions, ReasoningEngine engine) {
        return new ReasoningStage(name, instructions, engine, null);
    }

    /// Creates a stage that also stores revised content when run as the terminal stage.
    public static ReasoningStage revising(
            String name, String instructions, ReasoningEngine engine, ArtifactStorage storage) {
        return new ReasoningStage(
                name,
                instructions,
                engine,
                Objects.requireNonNull(storage, "storage must not be null"));
    }

    @Override
    public String name() {
        return name;
    }

    public String instructions() {
        return instructions;
    }

    public boolean producesArtifact() {
        return storage != null;
    }

    @Override
    public StageOutcome execute(StageContext context) throws StageFailure {
        boolean expectsRevision = producesArtifact() && context.isTerminalStage();
        ReasoningRequest request =
                new ReasoningRequest(
                        context.taskId(),
                        context.inputArtifact(),
                        context.priorOutputs(),
                        instructions,
                        expectsRevision);

        ReasoningResult result;
        try {
            result = engine.invoke(name, request);
        } catch (ReasoningException e) {
            throw new StageFailure(e.getKind(), "Reasoning failed: " + e.getMessage(), e);
        }
        if (result == null || result.report().isBlank()) {
            throw StageFailure.permanentFailure("Reasoning engine returned an empty report");
        }
        if (!expectsRevision || result.revision().isEmpty()) {
            return new StageOutcome.Report(result.report());
        }

        String revised = result.revisedContent();
        if (revised.isBlank()) {
            throw StageFailure.permanentFailure("Reasoning engine returned blank revised content");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw StageFailure.permanentFailure(
                    "Attempt " + context.attempt() + " was abandoned; revision not stored");
        }
        String derivedName = ArtifactNames.derivedName(context.inputArtifact().name());
        String location;
        try {
            location = storage.putDerived(context.taskId(), derivedName, revised);
        } catch (ArtifactStorageException e) {
            throw new StageFailure(
                    e.getKind(), "Could not store revised artifact: " + e.getMessage(), e);
        }
        logger.fine(() -> "Stage '" + name + "' stored revised artifact at " + location);
        return new StageOutcome.ReportWithArtifact(
                result.report(), new DerivedArtifact(derivedName, revised, location));
    }
}
