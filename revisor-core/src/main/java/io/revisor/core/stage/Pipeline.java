package io.revisor.core.stage;

import io.revisor.core.reasoning.ReasoningEngine;
import io.revisor.core.storage.ArtifactStorage;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Fixed, ordered list of stages every task runs through.
///
/// Stage names are unique. Only the last stage may produce a derived artifact.
public final class Pipeline {

    public static final String STRUCTURAL_ANALYSIS = "structural-analysis";
    public static final String DEFECT_REVIEW = "defect-review";
    public static final String FIX_GENERATION = "fix-generation";

    static final String STRUCTURAL_ANALYSIS_INSTRUCTIONS =
            """
            Analyze the structure of the submitted source file. Describe its purpose, \
            main components and control flow, and point out code smells, naming problems \
            and maintainability concerns. Be specific and reference the relevant code.""";

    static final String DEFECT_REVIEW_INSTRUCTIONS =
            """
            Review the submitted source file for defects. Using the earlier analysis as \
            context, list bugs, unhandled edge cases, error handling gaps and security \
            weaknesses. Rate each finding as high, medium or low severity.""";

    static final String FIX_GENERATION_INSTRUCTIONS =
            """
            Produce a corrected version of the submitted source file that resolves the \
            findings of the earlier reports while preserving its behavior and style. \
            Summarize every change you made. Return the complete revised file.""";

    private final List<Stage> stages;

    public Pipeline(List<Stage> stages) {
        Objects.requireNonNull(stages, "stages must not be null");
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("a pipeline needs at least one stage");
        }
        Set<String> names = new HashSet<>();
        for (Stage stage : stages) {
            Objects.requireNonNull(stage, "stages must not contain null");
            if (!names.add(stage.name())) {
                throw new IllegalArgumentException("duplicate stage name: " + stage.name());
            }
        }
        this.stages = List.copyOf(stages);
    }

    public static Pipeline of(Stage... stages) {
        return new Pipeline(List.of(stages));
    }

    /// Builds the standard three-stage code review pipeline.
    ///
    /// @param engine reasoning engine used by every stage, not null
    /// @param storage storage for the revised file produced by the last stage, not null
    /// @return the pipeline `structural-analysis`, `defect-review`, `fix-generation`
    public static Pipeline codeReview(ReasoningEngine engine, ArtifactStorage storage) {
        return of(
                ReasoningStage.reporting(
                        STRUCTURAL_ANALYSIS, STRUCTURAL_ANALYSIS_INSTRUCTIONS, engine),
                ReasoningStage.reporting(DEFECT_REVIEW, DEFECT_REVIEW_INSTRUCTIONS, engine),
                ReasoningStage.revising(
                        FIX_GENERATION, FIX_GENERATION_INSTRUCTIONS, engine, storage));
    }

    public int size() {
        return stages.size();
    }

    public Stage stage(int index) {
        return stages.get(index);
    }

    public List<Stage> stages() {
        return stages;
    }

    public List<String> stageNames() {
        return stages.stream().map(Stage::name).toList();
    }
}
