package io.revisor.core.execution;

import io.revisor.core.exception.FailureKind;
import io.revisor.core.exception.InvalidTransitionException;
import io.revisor.core.result.ResultAssembler;
import io.revisor.core.result.ReviewResult;
import io.revisor.core.stage.Pipeline;
import io.revisor.core.stage.Stage;
import io.revisor.core.stage.StageContext;
import io.revisor.core.stage.StageFailure;
import io.revisor.core.stage.StageOutcome;
import io.revisor.core.streaming.TaskEvent;
import io.revisor.core.streaming.TaskEventPublisher;
import io.revisor.core.task.DerivedArtifact;
import io.revisor.core.task.StageRecord;
import io.revisor.core.task.StageStatus;
import io.revisor.core.task.StageUpdate;
import io.revisor.core.task.Task;
import io.revisor.core.task.TaskRegistry;
import io.revisor.core.task.TaskStatus;
import io.revisor.core.task.TaskUpdate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives tasks through the stages of a [Pipeline].
///
/// Each started task gets one run on the run executor. The run moves stages forward one
/// at a time through the [TaskRegistry] and publishes a [TaskEvent] after every registry
/// mutation, using the snapshot that mutation returned.
///
/// ### Failure handling
/// - transient failures and attempt timeouts are retried with exponential backoff until
///   the [RetryPolicy] budget is spent, then escalate to permanent
/// - a permanent failure fails the stage and the task; later stages stay `IDLE`
/// - an unchecked exception thrown by a stage is a permanent failure
/// - an [InvalidTransitionException] aborts the run with an internal consistency error
///
/// ### Contracts
/// - at most one run per task: concurrent or repeated `start` calls share one future
/// - the future returned by `start` always completes with a terminal snapshot, also when
///   the run executor is shut down and rejects the run
/// - stage attempts run on the attempt executor so a timed out attempt can be abandoned
///   and interrupted
///
/// @implNote Thread-safe. Runs of different tasks share no mutable state besides the
/// registry, which serializes per task.
///
/// @see Stage
/// @see io.revisor.core.streaming.TaskEventBroadcaster
public final class PipelineExecutor {

    private static final Logger logger = Logger.getLogger(PipelineExecutor.class.getName());

    private final TaskRegistry registry;
    private final Pipeline pipeline;
    private final TaskEventPublisher publisher;
    private final ResultAssembler resultAssembler;
    private final RetryPolicy retryPolicy;
    private final Duration stageTimeout;
    private final ExecutorService runExecutor;
    private final ExecutorService attemptExecutor;
    private final Map<String, CompletableFuture<Task>> runs = new ConcurrentHashMap<>();

    private PipelineExecutor(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry must not be null");
        this.pipeline = Objects.requireNonNull(builder.pipeline, "pipeline must not be null");
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher must not be null");
        this.resultAssembler =
                Objects.requireNonNull(builder.resultAssembler, "resultAssembler must not be null");
        this.retryPolicy =
                Objects.requireNonNull(builder.retryPolicy, "retryPolicy must not be null");
        this.stageTimeout =
                Objects.requireNonNull(builder.stageTimeout, "stageTimeout must not be null");
        this.runExecutor =
                Objects.requireNonNull(builder.runExecutor, "runExecutor must not be null");
        this.attemptExecutor =
                Objects.requireNonNull(builder.attemptExecutor, "attemptExecutor must not be null");
        if (stageTimeout.isNegative() || stageTimeout.isZero()) {
            throw new IllegalArgumentException("stageTimeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Pipeline pipeline() {
        return pipeline;
    }

    /// Starts the run of a task, or joins the run already in progress.
    ///
    /// @param taskId task to run, not null
    /// @return future completing with the terminal snapshot, or empty if the task is unknown
    public Optional<CompletableFuture<Task>> start(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");

        Optional<Task> current = registry.get(taskId);
        if (current.isEmpty()) {
            return Optional.empty();
        }
        if (current.get().isTerminal()) {
            return Optional.of(CompletableFuture.completedFuture(current.get()));
        }

        CompletableFuture<Task> run = runs.computeIfAbsent(taskId, this::launch);
        if (run != null) {
            return Optional.of(run);
        }
        // Lost the race against a run that has already finished.
        return registry.get(taskId).map(this::existingRunOrSnapshot);
    }

    public boolean isRunning(String taskId) {
        return runs.containsKey(taskId);
    }

    public int activeRunCount() {
        return runs.size();
    }

    private CompletableFuture<Task> existingRunOrSnapshot(Task task) {
        CompletableFuture<Task> run = runs.get(task.id());
        return run != null ? run : CompletableFuture.completedFuture(task);
    }

    /// Moves the task to `RUNNING` and schedules its run. Returns null when the task is no
    /// longer pending or the run could not be scheduled, which leaves `runs` untouched. A
    /// rejected run fails the task.
    private CompletableFuture<Task> launch(String taskId) {
        Optional<Task> started;
        try {
            started = registry.transitionTask(taskId, TaskStatus.RUNNING, TaskUpdate.none());
        } catch (InvalidTransitionException e) {
            logger.fine(() -> "Task " + taskId + " is no longer pending: " + e.getMessage());
            return null;
        }
        if (started.isEmpty()) {
            return null;
        }

        Task task = started.get();
        CompletableFuture<Task> completion = new CompletableFuture<>();
        try {
            runExecutor.execute(() -> run(task, completion));
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Run of task " + taskId + " was rejected", e);
            abort(taskId, "Run rejected: the executor is shut down");
            return null;
        }
        logger.info("Started task " + taskId + " (" + pipeline.size() + " stages)");
        return completion;
    }

    private void run(Task started, CompletableFuture<Task> completion) {
        String taskId = started.id();
        try {
            completion.complete(execute(started));
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error while running task " + taskId, e);
            completion.complete(abort(taskId, "Internal error: " + e.getMessage()));
        } finally {
            runs.remove(taskId, completion);
        }
    }

    private Task execute(Task started) {
        String taskId = started.id();
        publish(TaskEvent.TaskStarted.of(started));
        try {
            if (started.stageCount() != pipeline.size()) {
                throw new InvalidTransitionException(
                        taskId,
                        "task has "
                                + started.stageCount()
                                + " stages but the pipeline has "
                                + pipeline.size());
            }

            List<String> priorOutputs = new ArrayList<>();
            DerivedArtifact derived = null;
            for (int index = 0; index < pipeline.size(); index++) {
                Stage stage = pipeline.stage(index);
                Task running =
                        transitionStage(taskId, index, StageStatus.RUNNING, StageUpdate.none());
                publish(TaskEvent.StageStarted.of(running, index));

                StageOutcome outcome;
                try {
                    outcome = runWithRetries(running, index, stage, priorOutputs);
                } catch (StageFailure failure) {
                    return fail(taskId, index, stage, failure);
                }

                Task completed =
                        transitionStage(
                                taskId,
                                index,
                                StageStatus.COMPLETED,
                                StageUpdate.output(outcome.report()));
                publish(TaskEvent.StageCompleted.of(completed, index));
                priorOutputs.add(outcome.report());

                if (outcome instanceof StageOutcome.ReportWithArtifact withArtifact) {
                    if (index == pipeline.size() - 1) {
                        derived = withArtifact.artifact();
                    } else {
                        logger.warning(
                                "Ignoring artifact of non-terminal stage '"
                                        + stage.name()
                                        + "' in task "
                                        + taskId);
                    }
                }
            }

            Task finished =
                    registry.transitionTask(
                                    taskId, TaskStatus.COMPLETED, TaskUpdate.completed(derived))
                            .orElseThrow(() -> vanished(taskId));
            ReviewResult result = resultAssembler.assemble(finished);
            publish(TaskEvent.TaskCompleted.of(finished, result));
            logger.info("Task " + taskId + " completed");
            return finished;
        } catch (InvalidTransitionException e) {
            logger.log(Level.SEVERE, "Internal consistency error in task " + taskId, e);
            return abort(taskId, "Internal consistency error: " + e.getMessage());
        }
    }

    private StageOutcome runWithRetries(
            Task running, int index, Stage stage, List<String> priorOutputs) throws StageFailure {
        String taskId = running.id();
        int attempt = running.stage(index).attempt();
        while (true) {
            StageContext context =
                    new StageContext(
                            taskId,
                            index,
                            stage.name(),
                            attempt,
                            pipeline.size(),
                            running.inputArtifact(),
                            priorOutputs);
            try {
                return attempt(stage, context);
            } catch (StageFailure failure) {
                if (!failure.isTransient()) {
                    throw failure;
                }
                if (!retryPolicy.allowsRetryAfter(attempt)) {
                    throw failure.exhausted(attempt);
                }
                Duration delay = retryPolicy.backoff(attempt);
                logger.info(
                        "Stage '"
                                + stage.name()
                                + "' of task "
                                + taskId
                                + " failed transiently on attempt "
                                + attempt
                                + ", retrying in "
                                + delay.toMillis()
                                + " ms: "
                                + failure.getMessage());
                sleep(delay);

                Task retried =
                        transitionStage(taskId, index, StageStatus.RUNNING, StageUpdate.none());
                publish(TaskEvent.StageRetrying.of(retried, index, failure.getMessage()));
                attempt = retried.stage(index).attempt();
            }
        }
    }

    private StageOutcome attempt(Stage stage, StageContext context) throws StageFailure {
        Future<StageOutcome> future = attemptExecutor.submit(() -> stage.execute(context));
        try {
            StageOutcome outcome = future.get(stageTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                throw StageFailure.permanentFailure(
                        "Stage '" + stage.name() + "' returned no outcome");
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw StageFailure.transientFailure(
                    "Stage '"
                            + stage.name()
                            + "' timed out after "
                            + stageTimeout.toMillis()
                            + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StageFailure failure) {
                throw failure;
            }
            logger.log(
                    Level.WARNING,
                    "Stage '" + stage.name() + "' threw an unclassified exception",
                    cause);
            throw new StageFailure(
                    FailureKind.PERMANENT,
                    "Unexpected error: " + describe(cause),
                    cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StageFailure(
                    FailureKind.PERMANENT,
                    "Interrupted while waiting for stage '" + stage.name() + "'",
                    e);
        }
    }

    private Task fail(String taskId, int index, Stage stage, StageFailure failure) {
        Task stageFailed =
                transitionStage(
                        taskId, index, StageStatus.FAILED, StageUpdate.error(failure.getMessage()));
        publish(TaskEvent.StageFailed.of(stageFailed, index));

        String reason = "Stage '" + stage.name() + "' failed: " + failure.getMessage();
        Task failed =
                registry.transitionTask(taskId, TaskStatus.FAILED, TaskUpdate.failed(reason))
                        .orElseThrow(() -> vanished(taskId));
        publish(TaskEvent.TaskFailed.of(failed));
        logger.warning("Task " + taskId + " failed: " + reason);
        return failed;
    }

    /// Fails the running stage, if any, and the task after an internal error.
    private Task abort(String taskId, String reason) {
        try {
            Task current = registry.get(taskId).orElseThrow(() -> vanished(taskId));
            Optional<StageRecord> running = current.runningStage();
            if (running.isPresent()) {
                int index = running.get().index();
                current =
                        transitionStage(
                                taskId, index, StageStatus.FAILED, StageUpdate.error(reason));
                publish(TaskEvent.StageFailed.of(current, index));
            }
            if (current.isTerminal()) {
                return current;
            }
            Task failed =
                    registry.transitionTask(taskId, TaskStatus.FAILED, TaskUpdate.failed(reason))
                            .orElseThrow(() -> vanished(taskId));
            publish(TaskEvent.TaskFailed.of(failed));
            return failed;
        } catch (InvalidTransitionException e) {
            logger.log(Level.SEVERE, "Could not mark task " + taskId + " as failed", e);
            return registry.get(taskId).orElse(null);
        }
    }

    private Task transitionStage(String taskId, int index, StageStatus status, StageUpdate update) {
        return registry.transitionStage(taskId, index, status, update)
                .orElseThrow(() -> vanished(taskId));
    }

    private void publish(TaskEvent event) {
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Failed to publish " + event.type() + " for task " + event.taskId(),
                    e);
        }
    }

    private static void sleep(Duration delay) throws StageFailure {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageFailure(
                    FailureKind.PERMANENT, "Interrupted during retry backoff", e);
        }
    }

    private static InvalidTransitionException vanished(String taskId) {
        return new InvalidTransitionException(taskId, "task disappeared from the registry");
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    /// Builder for [PipelineExecutor].
    public static final class Builder {
        private TaskRegistry registry;
        private Pipeline pipeline;
        private TaskEventPublisher publisher = TaskEventPublisher.noop();
        private ResultAssembler resultAssembler = new ResultAssembler();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration stageTimeout = Duration.ofSeconds(120);
        private ExecutorService runExecutor;
        private ExecutorService attemptExecutor;

        private Builder() {}

        public Builder registry(TaskRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder pipeline(Pipeline pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public Builder publisher(TaskEventPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder resultAssembler(ResultAssembler resultAssembler) {
            this.resultAssembler = resultAssembler;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder stageTimeout(Duration stageTimeout) {
            this.stageTimeout = stageTimeout;
            return this;
        }

        /// Executor running one task per submitted job. Must not run jobs on the caller.
        public Builder runExecutor(ExecutorService runExecutor) {
            this.runExecutor = runExecutor;
            return this;
        }

        /// Executor running single stage attempts; should grow on demand.
        public Builder attemptExecutor(ExecutorService attemptExecutor) {
            this.attemptExecutor = attemptExecutor;
            return this;
        }

        public PipelineExecutor build() {
            return new PipelineExecutor(this);
        }
    }
}
