package io.revisor.server.config;

import io.revisor.adapter.langchain4j.LangChain4jModelFactory;
import io.revisor.adapter.langchain4j.LangChain4jReasoningEngine;
import io.revisor.adapter.langchain4j.ModelSettings;
import io.revisor.core.RevisorConfig;
import io.revisor.core.RevisorEnvironment;
import io.revisor.core.RevisorFactory;
import io.revisor.core.execution.RetryPolicy;
import io.revisor.core.reasoning.ReasoningEngine;
import io.revisor.core.reasoning.stub.StubReasoningEngine;
import io.revisor.core.storage.ArtifactStorage;
import io.revisor.core.storage.FileSystemArtifactStorage;
import io.revisor.core.storage.InMemoryArtifactStorage;
import io.revisor.core.streaming.TaskEventBroadcaster;
import io.revisor.core.task.RetentionPolicy;
import io.revisor.server.execution.LoggingTaskEventPublisher;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/// CDI producer for the Revisor runtime environment.
///
/// Wires the core components via [RevisorFactory]: task registry, artifact storage,
/// reasoning engine, review pipeline, broadcaster and pipeline executor.
///
/// ### Credential Discovery
/// Credentials are loaded from (later wins):
/// 1. **Environment variables** ending in `_API_KEY`
/// 2. **Application properties** under `revisor.credentials.*`
///
/// ### Configuration Properties
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `revisor.stub.enabled` | `false` | Use the deterministic stub engine instead of a model |
/// | `revisor.model.name` | `deepseek-coder` | Chat model; prefix selects the provider |
/// | `revisor.model.temperature` | `0.1` | Sampling temperature |
/// | `revisor.model.max-tokens` | `4000` | Token limit per call |
/// | `revisor.model.timeout` | `120s` | HTTP timeout per model call |
/// | `revisor.storage.type` | `filesystem` | `filesystem` or `memory` |
/// | `revisor.storage.upload-dir` | `uploads` | Submitted files |
/// | `revisor.storage.fixed-dir` | `fixed` | Derived (fixed) files |
/// | `revisor.execution.run-threads` | `8` | Idle run threads kept alive |
/// | `revisor.execution.max-retries` | `2` | Retries after a transient stage failure |
/// | `revisor.execution.initial-backoff` | `500ms` | First retry delay |
/// | `revisor.execution.max-backoff` | `5s` | Retry delay cap |
/// | `revisor.execution.stage-timeout` | `120s` | Time limit of one stage attempt |
/// | `revisor.streaming.subscriber-queue-capacity` | `256` | Events buffered per SSE subscriber |
/// | `revisor.retention.max-tasks` | `100` | Finished tasks kept in the registry |
/// | `revisor.retention.max-age` | `24h` | Age after which finished tasks are evicted |
///
/// @implNote Application-scoped. The environment is built once and closed on shutdown.
///
/// @see ServerConfiguration for the component delegates
@ApplicationScoped
public class RevisorEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(RevisorEnvironmentProducer.class);

    static final String CREDENTIALS_PREFIX = "revisor.credentials.";

    private RevisorEnvironment environment;

    @Inject Config config;

    @Inject LoggingTaskEventPublisher loggingPublisher;

    /// Produces the Revisor runtime environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @Singleton
    public RevisorEnvironment revisorEnvironment() {
        RevisorConfig revisorConfig = readConfig();
        ArtifactStorage storage = createStorage();
        ReasoningEngine engine = createReasoningEngine();

        environment =
                RevisorFactory.builder()
                        .config(revisorConfig)
                        .artifactStorage(storage)
                        .reasoningEngine(engine)
                        .publisher(loggingPublisher)
                        .build();

        LOG.infov(
                "Configured RevisorEnvironment: engine={0}, storage={1}, stages={2}",
                engine.getClass().getSimpleName(),
                storage.getClass().getSimpleName(),
                environment.getPipeline().stageNames());
        return environment;
    }

    RevisorConfig readConfig() {
        return RevisorConfig.builder()
                .runThreads(intValue("revisor.execution.run-threads", 8))
                .maxRetries(
                        intValue("revisor.execution.max-retries", RetryPolicy.DEFAULT_MAX_RETRIES))
                .initialBackoff(
                        durationValue(
                                "revisor.execution.initial-backoff",
                                RetryPolicy.DEFAULT_INITIAL_BACKOFF))
                .maxBackoff(
                        durationValue(
                                "revisor.execution.max-backoff", RetryPolicy.DEFAULT_MAX_BACKOFF))
                .stageTimeout(
                        durationValue("revisor.execution.stage-timeout", Duration.ofSeconds(120)))
                .subscriberQueueCapacity(
                        intValue(
                                "revisor.streaming.subscriber-queue-capacity",
                                TaskEventBroadcaster.DEFAULT_QUEUE_CAPACITY))
                .maxRetainedTasks(
                        intValue(
                                "revisor.retention.max-tasks",
                                RetentionPolicy.DEFAULT_MAX_RETAINED_TASKS))
                .retentionMaxAge(
                        durationValue(
                                "revisor.retention.max-age", RetentionPolicy.DEFAULT_MAX_AGE))
                .build();
    }

    ArtifactStorage createStorage() {
        String type =
                config.getOptionalValue("revisor.storage.type", String.class).orElse("filesystem");
        if ("memory".equalsIgnoreCase(type)) {
            LOG.info("Using in-memory artifact storage");
            return new InMemoryArtifactStorage();
        }
        if (!"filesystem".equalsIgnoreCase(type)) {
            throw new IllegalStateException("Unknown revisor.storage.type: " + type);
        }
        Path uploads =
                Path.of(
                        config.getOptionalValue("revisor.storage.upload-dir", String.class)
                                .orElse("uploads"));
        Path fixed =
                Path.of(
                        config.getOptionalValue("revisor.storage.fixed-dir", String.class)
                                .orElse("fixed"));
        LOG.infov("Using file-system artifact storage: uploads={0}, fixed={1}", uploads, fixed);
        return new FileSystemArtifactStorage(uploads, fixed);
    }

    ReasoningEngine createReasoningEngine() {
        boolean stub = config.getOptionalValue("revisor.stub.enabled", Boolean.class).orElse(false);
        if (stub) {
            LOG.warn("Stub mode enabled: reviews are canned, no model is called");
            return new StubReasoningEngine();
        }
        ModelSettings settings =
                new ModelSettings(
                        config.getOptionalValue("revisor.model.name", String.class)
                                .orElse("deepseek-coder"),
                        config.getOptionalValue("revisor.model.temperature", Double.class)
                                .orElse(ModelSettings.DEFAULT_TEMPERATURE),
                        intValue("revisor.model.max-tokens", ModelSettings.DEFAULT_MAX_TOKENS),
                        durationValue("revisor.model.timeout", ModelSettings.DEFAULT_TIMEOUT));
        LangChain4jModelFactory factory = new LangChain4jModelFactory();
        return new LangChain4jReasoningEngine(factory.createModel(settings, loadCredentials()));
    }

    /// Collects API keys from the environment and from `revisor.credentials.*`.
    Map<String, String> loadCredentials() {
        Map<String, String> credentials = new HashMap<>();
        System.getenv()
                .forEach(
                        (key, value) -> {
                            if (key.endsWith("_API_KEY")) {
                                credentials.put(key, value);
                            }
                        });
        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(CREDENTIALS_PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .ifPresent(
                                value ->
                                        credentials.put(
                                                propertyName.substring(
                                                        CREDENTIALS_PREFIX.length()),
                                                value));
            }
        }
        return credentials;
    }

    private int intValue(String name, int defaultValue) {
        return config.getOptionalValue(name, Integer.class).orElse(defaultValue);
    }

    private Duration durationValue(String name, Duration defaultValue) {
        return config.getOptionalValue(name, Duration.class).orElse(defaultValue);
    }

    /// Closes the environment and its thread pools on shutdown.
    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
            LOG.info("RevisorEnvironment closed");
        }
    }
}
