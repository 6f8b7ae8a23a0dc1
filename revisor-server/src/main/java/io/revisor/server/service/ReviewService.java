package io.revisor.server.service;

import io.revisor.core.exception.InvalidTransitionException;
import io.revisor.core.execution.PipelineExecutor;
import io.revisor.core.result.ResultAssembler;
import io.revisor.core.result.ReviewResult;
import io.revisor.core.storage.ArtifactStorage;
import io.revisor.core.storage.ArtifactStorageException;
import io.revisor.core.streaming.TaskEvent;
import io.revisor.core.streaming.TaskEventBroadcaster;
import io.revisor.core.task.Artifact;
import io.revisor.core.task.Task;
import io.revisor.core.task.TaskFilter;
import io.revisor.core.task.TaskRegistry;
import io.revisor.core.task.TaskRetention;
import io.revisor.core.task.TaskStatus;
import io.revisor.server.validation.LogSanitizer;
import io.smallrye.mutiny.Multi;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.Serial;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.jboss.logging.Logger;

/// Service for code review submissions.
///
/// Sits between the REST resources and the core engine:
/// - registering uploads as tasks and storing their content
/// - starting pipeline runs
/// - reading task snapshots and assembled results
/// - subscribing to live task events
/// - deleting and evicting finished tasks together with their stored artifacts
///
/// Unknown ids surface as [TaskNotFoundException]; lifecycle conflicts as
/// [TaskAlreadyFinishedException], [TaskNotFinishedException] or [TaskRunningException].
///
/// @see io.revisor.server.api.ReviewResource for REST API endpoints
/// @see PipelineExecutor for the run loop
@ApplicationScoped
public class ReviewService {

    private static final Logger LOG = Logger.getLogger(ReviewService.class);

    private final TaskRegistry registry;
    private final ArtifactStorage storage;
    private final PipelineExecutor executor;
    private final TaskEventBroadcaster broadcaster;
    private final ResultAssembler resultAssembler;
    private final TaskRetention retention;

    @Inject
    public ReviewService(
            TaskRegistry registry,
            ArtifactStorage storage,
            PipelineExecutor executor,
            TaskEventBroadcaster broadcaster,
            ResultAssembler resultAssembler,
            TaskRetention retention) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.storage = Objects.requireNonNull(storage, "storage must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster must not be null");
        this.resultAssembler =
                Objects.requireNonNull(resultAssembler, "resultAssembler must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
    }

    /// Registers an uploaded file as a new `PENDING` task and stores its content.
    ///
    /// ### Contracts
    /// - **Postcondition**: the returned task exists in the registry and its artifact is
    ///   stored; when storing fails no task is left behind
    ///
    /// @param artifact uploaded file, not null
    /// @param autoStart whether to start the pipeline right away
    /// @return the task snapshot after registration (and start, if requested), never null
    /// @throws ArtifactStoreFailedException if the artifact cannot be stored
    public Task submit(Artifact artifact, boolean autoStart) {
        Objects.requireNonNull(artifact, "artifact must not be null");

        Task task = registry.create(artifact, executor.pipeline().stageNames());
        try {
            storage.putUploaded(task.id(), artifact);
        } catch (ArtifactStorageException e) {
            registry.delete(task.id());
            throw new ArtifactStoreFailedException(
                    "Could not store upload for task " + task.id(), e);
        }

        LOG.infov(
                "Task {0} created: file={1}, bytes={2}",
                task.id(), LogSanitizer.sanitize(artifact.name()), artifact.sizeInBytes());

        return autoStart ? start(task.id()) : task;
    }

    /// Starts the pipeline run of a task.
    ///
    /// Starting a task that is already running is a no-op that returns its current snapshot.
    ///
    /// @param taskId the task to start, not null
    /// @return the current snapshot, never null
    /// @throws TaskNotFoundException if the task does not exist
    /// @throws TaskAlreadyFinishedException if the task is completed or failed
    public Task start(String taskId) {
        Task task = requireTask(taskId);
        if (task.isTerminal()) {
            throw new TaskAlreadyFinishedException(
                    "Task " + taskId + " already finished with status " + task.status());
        }

        boolean alreadyRunning = executor.isRunning(taskId);
        Optional<CompletableFuture<Task>> run = executor.start(taskId);
        if (run.isEmpty()) {
            throw new TaskNotFoundException("Task not found: " + taskId);
        }
        if (alreadyRunning) {
            LOG.debugv("Task {0} is already running", taskId);
        } else {
            LOG.infov("Task {0} accepted for execution", taskId);
        }
        return requireTask(taskId);
    }

    /// @throws TaskNotFoundException if the task does not exist
    public Task getTask(String taskId) {
        return requireTask(taskId);
    }

    /// Assembles the review result of a finished task.
    ///
    /// Failed tasks yield a result with the sections that completed before the failure.
    ///
    /// @throws TaskNotFoundException if the task does not exist
    /// @throws TaskNotFinishedException if the task is still pending or running
    public ReviewResult getResult(String taskId) {
        Task task = requireTask(taskId);
        if (!task.isTerminal()) {
            throw new TaskNotFinishedException(
                    "Task " + taskId + " has not finished (status " + task.status() + ")");
        }
        return resultAssembler.assemble(task);
    }

    /// Lists tasks newest first.
    ///
    /// @param status required status, or null for any
    /// @param offset number of tasks to skip, not negative
    /// @param limit maximum number of tasks, positive
    /// @return matching snapshots, never null
    public List<Task> listTasks(TaskStatus status, int offset, int limit) {
        return registry.list(TaskFilter.all().withStatus(status).page(offset, limit));
    }

    /// Subscribes to a task's live events.
    ///
    /// @return event stream starting with the task snapshot; cancel it to detach
    /// @throws TaskNotFoundException if the task does not exist
    public Multi<TaskEvent> subscribe(String taskId) {
        return broadcaster
                .subscribe(taskId)
                .orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
    }

    /// Deletes a pending or finished task and its stored artifacts.
    ///
    /// @throws TaskNotFoundException if the task does not exist
    /// @throws TaskRunningException if the task is running
    public void deleteTask(String taskId) {
        boolean removed;
        try {
            removed = registry.delete(taskId);
        } catch (InvalidTransitionException e) {
            throw new TaskRunningException("Task " + taskId + " is running and cannot be deleted");
        }
        if (!removed) {
            throw new TaskNotFoundException("Task not found: " + taskId);
        }
        purgeArtifacts(taskId);
        LOG.infov("Task {0} deleted", taskId);
    }

    /// Runs one retention pass and removes the stored artifacts of evicted tasks.
    ///
    /// @return number of evicted tasks
    public int evictFinishedTasks() {
        List<String> evicted = retention.sweep();
        evicted.forEach(this::purgeArtifacts);
        return evicted.size();
    }

    private void purgeArtifacts(String taskId) {
        try {
            storage.deleteAll(taskId);
        } catch (ArtifactStorageException e) {
            LOG.warnv(e, "Could not remove stored artifacts of task {0}", taskId);
        }
    }

    private Task requireTask(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return registry.get(taskId)
                .orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
    }

    // --- Exceptions ---

    public static class TaskNotFoundException extends RuntimeException {
        @Serial private static final long serialVersionUID = 3385204178840219145L;

        public TaskNotFoundException(String message) {
            super(message);
        }
    }

    public static class TaskAlreadyFinishedException extends RuntimeException {
        @Serial private static final long serialVersionUID = -1742690533148029107L;

        public TaskAlreadyFinishedException(String message) {
            super(message);
        }
    }

    public static class TaskNotFinishedException extends RuntimeException {
        @Serial private static final long serialVersionUID = 5628310092716471260L;

        public TaskNotFinishedException(String message) {
            super(message);
        }
    }

    public static class TaskRunningException extends RuntimeException {
        @Serial private static final long serialVersionUID = -8039715212375884493L;

        public TaskRunningException(String message) {
            super(message);
        }
    }

    public static class ArtifactStoreFailedException extends RuntimeException {
        @Serial private static final long serialVersionUID = 7150946263091738824L;

        public ArtifactStoreFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
