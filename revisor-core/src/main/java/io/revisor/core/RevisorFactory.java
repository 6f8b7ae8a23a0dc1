package io.revisor.core;

import io.revisor.core.execution.PipelineExecutor;
import io.revisor.core.reasoning.ReasoningEngine;
import io.revisor.core.reasoning.stub.StubReasoningEngine;
import io.revisor.core.result.ResultAssembler;
import io.revisor.core.stage.Pipeline;
import io.revisor.core.storage.ArtifactStorage;
import io.revisor.core.storage.InMemoryArtifactStorage;
import io.revisor.core.streaming.TaskEventBroadcaster;
import io.revisor.core.streaming.TaskEventPublisher;
import io.revisor.core.task.InMemoryTaskRegistry;
import io.revisor.core.task.TaskRegistry;
import io.revisor.core.task.TaskRetention;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring Revisor environments.
///
/// Provides static factory methods and a fluent [Builder] for constructing fully wired
/// [RevisorEnvironment] instances without a server or a model provider. Components left
/// unset fall back to in-memory defaults and the [StubReasoningEngine].
///
/// ### Usage
/// {@snippet :
/// RevisorEnvironment env = RevisorFactory.builder()
///     .config(RevisorConfig.builder().runThreads(4).build())
///     .reasoningEngine(engine)
///     .artifactStorage(new FileSystemArtifactStorage(uploads, fixed))
///     .build();
/// }
///
/// @see RevisorEnvironment
/// @see RevisorConfig
public final class RevisorFactory {

    private static final Logger logger = Logger.getLogger(RevisorFactory.class.getName());

    private static final Duration RUN_THREAD_KEEP_ALIVE = Duration.ofSeconds(60);

    private RevisorFactory() {}

    /// Creates an environment with default configuration and the stub reasoning engine.
    public static RevisorEnvironment createEnvironment() {
        return builder().build();
    }

    public static RevisorEnvironment createEnvironment(RevisorConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder wiring a [RevisorEnvironment].
    public static class Builder {
        private RevisorConfig config = new RevisorConfig();
        private Clock clock = Clock.systemUTC();
        private TaskRegistry taskRegistry;
        private ArtifactStorage artifactStorage;
        private ReasoningEngine reasoningEngine;
        private Pipeline pipeline;
        private final List<TaskEventPublisher> extraPublishers = new ArrayList<>();

        private Builder() {}

        public Builder config(RevisorConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public Builder taskRegistry(TaskRegistry taskRegistry) {
            this.taskRegistry = taskRegistry;
            return this;
        }

        public Builder artifactStorage(ArtifactStorage artifactStorage) {
            this.artifactStorage = artifactStorage;
            return this;
        }

        public Builder reasoningEngine(ReasoningEngine reasoningEngine) {
            this.reasoningEngine = reasoningEngine;
            return this;
        }

        /// Replaces the standard code review pipeline.
        public Builder pipeline(Pipeline pipeline) {
            this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
            return this;
        }

        /// Adds a publisher that receives every task event next to the broadcaster.
        public Builder publisher(TaskEventPublisher publisher) {
            extraPublishers.add(Objects.requireNonNull(publisher, "publisher must not be null"));
            return this;
        }

        public RevisorEnvironment build() {
            TaskRegistry registry =
                    taskRegistry != null ? taskRegistry : new InMemoryTaskRegistry(clock);
            ArtifactStorage storage =
                    artifactStorage != null ? artifactStorage : new InMemoryArtifactStorage();
            ReasoningEngine engine =
                    reasoningEngine != null ? reasoningEngine : new StubReasoningEngine();
            Pipeline stages = pipeline != null ? pipeline : Pipeline.codeReview(engine, storage);

            TaskEventBroadcaster broadcaster =
                    new TaskEventBroadcaster(registry, config.getSubscriberQueueCapacity());
            List<TaskEventPublisher> publishers = new ArrayList<>();
            publishers.add(broadcaster);
            publishers.addAll(extraPublishers);

            ExecutorService runExecutor = runPool(config.getRunThreads());
            ExecutorService attemptExecutor =
                    Executors.newCachedThreadPool(daemonThreads("revisor-stage-"));

            PipelineExecutor executor =
                    PipelineExecutor.builder()
                            .registry(registry)
                            .pipeline(stages)
                            .publisher(
                                    publishers.size() == 1
                                            ? broadcaster
                                            : TaskEventPublisher.composite(publishers))
                            .resultAssembler(new ResultAssembler())
                            .retryPolicy(config.retryPolicy())
                            .stageTimeout(config.getStageTimeout())
                            .runExecutor(runExecutor)
                            .attemptExecutor(attemptExecutor)
                            .build();

            logger.info(
                    "Revisor environment ready: engine="
                            + engine.getClass().getSimpleName()
                            + ", stages="
                            + stages.stageNames()
                            + ", coreRunThreads="
                            + config.getRunThreads());

            return new RevisorEnvironment(
                    config,
                    registry,
                    storage,
                    engine,
                    stages,
                    broadcaster,
                    executor,
                    new TaskRetention(registry, config.retentionPolicy(), clock),
                    List.of(runExecutor, attemptExecutor));
        }

        /// Keeps `coreThreads` run threads alive and adds one per further concurrent run, so a
        /// run stuck in a slow stage never queues behind other runs.
        private static ExecutorService runPool(int coreThreads) {
            return new ThreadPoolExecutor(
                    coreThreads,
                    Integer.MAX_VALUE,
                    RUN_THREAD_KEEP_ALIVE.toSeconds(),
                    TimeUnit.SECONDS,
                    new SynchronousQueue<>(),
                    daemonThreads("revisor-run-"));
        }

        private static ThreadFactory daemonThreads(String prefix) {
            AtomicInteger counter = new AtomicInteger();
            return runnable -> {
                Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
        }
    }
}
