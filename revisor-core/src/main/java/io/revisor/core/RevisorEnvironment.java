package io.revisor.core;

import io.revisor.core.execution.PipelineExecutor;
import io.revisor.core.reasoning.ReasoningEngine;
import io.revisor.core.stage.Pipeline;
import io.revisor.core.storage.ArtifactStorage;
import io.revisor.core.streaming.TaskEventBroadcaster;
import io.revisor.core.task.TaskRegistry;
import io.revisor.core.task.TaskRetention;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Container holding the wired review components.
///
/// Implements [AutoCloseable] to shut down the thread pools owned by the environment.
///
/// @apiNote Create instances via [RevisorFactory] rather than direct construction.
///
/// @see RevisorFactory#createEnvironment()
public final class RevisorEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(RevisorEnvironment.class.getName());

    private final RevisorConfig config;
    private final TaskRegistry taskRegistry;
    private final ArtifactStorage artifactStorage;
    private final ReasoningEngine reasoningEngine;
    private final Pipeline pipeline;
    private final TaskEventBroadcaster broadcaster;
    private final PipelineExecutor pipelineExecutor;
    private final TaskRetention retention;
    private final List<ExecutorService> ownedExecutors;

    RevisorEnvironment(
            RevisorConfig config,
            TaskRegistry taskRegistry,
            ArtifactStorage artifactStorage,
            ReasoningEngine reasoningEngine,
            Pipeline pipeline,
            TaskEventBroadcaster broadcaster,
            PipelineExecutor pipelineExecutor,
            TaskRetention retention,
            List<ExecutorService> ownedExecutors) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.taskRegistry = Objects.requireNonNull(taskRegistry, "taskRegistry must not be null");
        this.artifactStorage =
                Objects.requireNonNull(artifactStorage, "artifactStorage must not be null");
        this.reasoningEngine =
                Objects.requireNonNull(reasoningEngine, "reasoningEngine must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster must not be null");
        this.pipelineExecutor =
                Objects.requireNonNull(pipelineExecutor, "pipelineExecutor must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        // run pool first, attempt pool second
        this.ownedExecutors = List.copyOf(ownedExecutors);
    }

    public RevisorConfig getConfig() {
        return config;
    }

    public TaskRegistry getTaskRegistry() {
        return taskRegistry;
    }

    public ArtifactStorage getArtifactStorage() {
        return artifactStorage;
    }

    public ReasoningEngine getReasoningEngine() {
        return reasoningEngine;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public TaskEventBroadcaster getBroadcaster() {
        return broadcaster;
    }

    public PipelineExecutor getPipelineExecutor() {
        return pipelineExecutor;
    }

    public TaskRetention getRetention() {
        return retention;
    }

    /// Stops accepting runs and waits for running tasks to finish.
    ///
    /// Pools are shut down in order, each after the previous one terminated, so runs in
    /// progress can still submit their stage attempts.
    ///
    /// @param timeout maximum time to wait per pool
    /// @param unit unit of `timeout`
    /// @return `true` if every pool terminated in time
    /// @throws InterruptedException if interrupted while waiting
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        boolean terminated = true;
        for (ExecutorService executor : ownedExecutors) {
            executor.shutdown();
            terminated &= executor.awaitTermination(timeout, unit);
        }
        return terminated;
    }

    /// Initiates orderly shutdown of the run pool.
    ///
    /// @implNote Does not block. Runs already started continue and keep their attempt
    /// threads, which are daemon threads released when idle. Use
    /// [#awaitIdle(long, TimeUnit)] to wait for them.
    @Override
    public void close() {
        if (!ownedExecutors.isEmpty()) {
            ownedExecutors.get(0).shutdown();
        }
        logger.fine("Revisor environment closed");
    }
}
