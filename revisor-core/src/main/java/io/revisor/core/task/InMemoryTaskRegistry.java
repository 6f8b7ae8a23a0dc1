package io.revisor.core.task;

import io.revisor.core.exception.InvalidTransitionException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/// In-memory task registry (default implementation).
///
/// Thread-safe, no external dependencies. Each mutation runs inside
/// `ConcurrentHashMap.computeIfPresent` for its task key, which serializes writers of the
/// same task while leaving other tasks untouched. Snapshots are immutable records, so
/// readers never observe a half-applied change.
///
/// ### Clock handling
/// `updatedAt` is clamped to the previous value when the clock steps backwards, keeping it
/// monotonically non-decreasing per task.
///
/// @see TaskRegistry for contract
public final class InMemoryTaskRegistry implements TaskRegistry {

    private static final Logger logger = Logger.getLogger(InMemoryTaskRegistry.class.getName());

    private static final Comparator<Task> NEWEST_FIRST =
            Comparator.comparing(Task::createdAt).reversed().thenComparing(Task::id);

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTaskRegistry() {
        this(Clock.systemUTC());
    }

    public InMemoryTaskRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Task create(Artifact inputArtifact, List<String> stageNames) {
        Objects.requireNonNull(inputArtifact, "inputArtifact must not be null");
        Objects.requireNonNull(stageNames, "stageNames must not be null");
        if (stageNames.isEmpty()) {
            throw new IllegalArgumentException("stageNames must not be empty");
        }
        for (String name : stageNames) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("stage names must not be blank");
            }
        }

        Instant now = clock.instant();
        Task candidate;
        do {
            candidate = Task.pending(UUID.randomUUID().toString(), inputArtifact, stageNames, now);
        } while (tasks.putIfAbsent(candidate.id(), candidate) != null);

        Task created = candidate;
        logger.fine(
                () -> "Created task " + created.id() + " with " + stageNames.size() + " stages");
        return created;
    }

    @Override
    public Optional<Task> get(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Optional<Task> transitionTask(String taskId, TaskStatus newStatus, TaskUpdate update) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(newStatus, "newStatus must not be null");
        Objects.requireNonNull(update, "update must not be null");

        return Optional.ofNullable(
                tasks.computeIfPresent(
                        taskId, (id, current) -> applyTaskTransition(current, newStatus, update)));
    }

    @Override
    public Optional<Task> transitionStage(
            String taskId, int stageIndex, StageStatus newStatus, StageUpdate update) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(newStatus, "newStatus must not be null");
        Objects.requireNonNull(update, "update must not be null");

        return Optional.ofNullable(
                tasks.computeIfPresent(
                        taskId,
                        (id, current) ->
                                applyStageTransition(current, stageIndex, newStatus, update)));
    }

    @Override
    public List<Task> list(TaskFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");
        return tasks.values().stream()
                .filter(filter::matches)
                .sorted(NEWEST_FIRST)
                .skip(filter.offset())
                .limit(filter.limit())
                .toList();
    }

    @Override
    public boolean delete(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");

        AtomicBoolean removed = new AtomicBoolean();
        tasks.computeIfPresent(
                taskId,
                (id, current) -> {
                    if (current.status() == TaskStatus.RUNNING) {
                        throw new InvalidTransitionException(
                                id, "a running task cannot be deleted");
                    }
                    removed.set(true);
                    return null;
                });
        if (removed.get()) {
            logger.fine(() -> "Deleted task " + taskId);
        }
        return removed.get();
    }

    @Override
    public int size() {
        return tasks.size();
    }

    private Task applyTaskTransition(Task current, TaskStatus next, TaskUpdate update) {
        if (!current.status().canTransitionTo(next)) {
            throw new InvalidTransitionException(
                    current.id(), "cannot move task from " + current.status() + " to " + next);
        }
        Instant now = advance(current);

        return switch (next) {
            case RUNNING -> copy(current, next, current.stages(), null, now, now, null, null);
            case COMPLETED -> {
                for (StageRecord stage : current.stages()) {
                    if (stage.status() != StageStatus.COMPLETED) {
                        throw new InvalidTransitionException(
                                current.id(),
                                "cannot complete task while stage "
                                        + stage.index()
                                        + " is "
                                        + stage.status());
                    }
                }
                yield copy(
                        current,
                        next,
                        current.stages(),
                        update.outputArtifact(),
                        now,
                        current.startedAt(),
                        now,
                        null);
            }
            case FAILED -> {
                requireText(current, update.error(), "a failed task requires an error");
                verifyFailable(current);
                yield copy(
                        current,
                        next,
                        current.stages(),
                        null,
                        now,
                        current.startedAt(),
                        now,
                        update.error());
            }
            case PENDING ->
                    throw new InvalidTransitionException(current.id(), "cannot return to PENDING");
        };
    }

    private Task applyStageTransition(
            Task current, int index, StageStatus next, StageUpdate update) {
        if (current.status() != TaskStatus.RUNNING) {
            throw new InvalidTransitionException(
                    current.id(),
                    "stages can only move while the task is RUNNING, was " + current.status());
        }
        if (index < 0 || index >= current.stageCount()) {
            throw new InvalidTransitionException(
                    current.id(), "stage index " + index + " out of range");
        }
        StageRecord stage = current.stage(index);
        if (!stage.status().canTransitionTo(next)) {
            throw new InvalidTransitionException(
                    current.id(),
                    "cannot move stage " + index + " from " + stage.status() + " to " + next);
        }
        Instant now = advance(current);

        StageRecord updated =
                switch (next) {
                    case RUNNING -> {
                        if (stage.status() == StageStatus.RUNNING) {
                            yield stage.retried();
                        }
                        verifyStartable(current, index);
                        yield stage.started(now);
                    }
                    case COMPLETED -> {
                        if (update.output() == null) {
                            throw new InvalidTransitionException(
                                    current.id(), "a completed stage requires output");
                        }
                        yield stage.completed(update.output(), now);
                    }
                    case FAILED -> {
                        requireText(current, update.error(), "a failed stage requires an error");
                        yield stage.failed(update.error(), now);
                    }
                    case IDLE ->
                            throw new InvalidTransitionException(
                                    current.id(), "stage " + index + " cannot return to IDLE");
                };

        List<StageRecord> stages = new ArrayList<>(current.stages());
        stages.set(index, updated);
        return copy(
                current,
                current.status(),
                stages,
                current.outputArtifact(),
                now,
                current.startedAt(),
                current.finishedAt(),
                current.error());
    }

    private static void verifyStartable(Task current, int index) {
        for (StageRecord other : current.stages()) {
            if (other.index() < index && other.status() != StageStatus.COMPLETED) {
                throw new InvalidTransitionException(
                        current.id(),
                        "stage "
                                + index
                                + " cannot start before stage "
                                + other.index()
                                + " completes");
            }
            if (other.status() == StageStatus.RUNNING) {
                throw new InvalidTransitionException(
                        current.id(), "stage " + other.index() + " is already running");
            }
        }
    }

    private static void verifyFailable(Task current) {
        int failedIndex = -1;
        for (StageRecord stage : current.stages()) {
            switch (stage.status()) {
                case RUNNING ->
                        throw new InvalidTransitionException(
                                current.id(),
                                "cannot fail task while stage " + stage.index() + " is running");
                case FAILED -> {
                    if (failedIndex >= 0) {
                        throw new InvalidTransitionException(
                                current.id(), "more than one failed stage");
                    }
                    failedIndex = stage.index();
                }
                case COMPLETED -> {
                    if (failedIndex >= 0) {
                        throw new InvalidTransitionException(
                                current.id(),
                                "stage "
                                        + stage.index()
                                        + " completed after failed stage "
                                        + failedIndex);
                    }
                }
                case IDLE -> {
                    // idle stages are allowed anywhere in a failed task
                }
            }
        }
    }

    private static void requireText(Task current, String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidTransitionException(current.id(), message);
        }
    }

    private Instant advance(Task current) {
        Instant now = clock.instant();
        return now.isBefore(current.updatedAt()) ? current.updatedAt() : now;
    }

    private static Task copy(
            Task current,
            TaskStatus status,
            List<StageRecord> stages,
            DerivedArtifact outputArtifact,
            Instant updatedAt,
            Instant startedAt,
            Instant finishedAt,
            String error) {
        return new Task(
                current.id(),
                status,
                stages,
                current.inputArtifact(),
                outputArtifact,
                current.createdAt(),
                updatedAt,
                startedAt,
                finishedAt,
                error,
                current.version() + 1);
    }
}
