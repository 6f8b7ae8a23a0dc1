package io.revisor.core.result;

import io.revisor.core.task.DerivedArtifact;
import io.revisor.core.task.StageRecord;
import io.revisor.core.task.StageStatus;
import io.revisor.core.task.Task;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// Builds the [ReviewResult] of a task from its snapshot.
///
/// Pure: the result depends only on the snapshot, so assembling the same snapshot twice
/// yields equal results. Stages that did not complete contribute no section.
public final class ResultAssembler {

    public ReviewResult assemble(Task task) {
        Objects.requireNonNull(task, "task must not be null");

        List<ReviewResult.Section> sections = new ArrayList<>();
        for (StageRecord stage : task.stages()) {
            if (stage.status() == StageStatus.COMPLETED && stage.output() != null) {
                sections.add(new ReviewResult.Section(stage.index(), stage.name(), stage.output()));
            }
        }

        DerivedArtifact output = task.outputArtifact();
        return new ReviewResult(
                task.id(),
                task.status(),
                task.inputArtifact().name(),
                sections,
                combine(sections),
                output,
                task.error(),
                ArtifactStats.of(task.inputArtifact().content()),
                output != null ? ArtifactStats.of(output.content()) : null);
    }

    private static String combine(List<ReviewResult.Section> sections) {
        return sections.stream()
                .map(s -> "## " + (s.index() + 1) + ". " + s.name() + "\n\n" + s.report().strip())
                .collect(Collectors.joining("\n\n"));
    }
}
