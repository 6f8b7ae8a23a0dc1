package io.revisor.server.config;

import io.revisor.core.RevisorEnvironment;
import io.revisor.core.execution.PipelineExecutor;
import io.revisor.core.result.ResultAssembler;
import io.revisor.core.storage.ArtifactStorage;
import io.revisor.core.streaming.TaskEventBroadcaster;
import io.revisor.core.task.TaskRegistry;
import io.revisor.core.task.TaskRetention;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/// Exposes [RevisorEnvironment] components for direct CDI injection.
///
/// The environment itself is produced by [RevisorEnvironmentProducer].
@ApplicationScoped
public class ServerConfiguration {

    @Produces
    @Singleton
    public TaskRegistry taskRegistry(RevisorEnvironment env) {
        return env.getTaskRegistry();
    }

    @Produces
    @Singleton
    public ArtifactStorage artifactStorage(RevisorEnvironment env) {
        return env.getArtifactStorage();
    }

    /// Produces the broadcaster that SSE subscriptions attach to.
    ///
    /// @param env the initialized environment, not null
    /// @return the broadcaster, never null
    @Produces
    @Singleton
    public TaskEventBroadcaster taskEventBroadcaster(RevisorEnvironment env) {
        return env.getBroadcaster();
    }

    @Produces
    @Singleton
    public PipelineExecutor pipelineExecutor(RevisorEnvironment env) {
        return env.getPipelineExecutor();
    }

    @Produces
    @Singleton
    public TaskRetention taskRetention(RevisorEnvironment env) {
        return env.getRetention();
    }

    @Produces
    @Singleton
    public ResultAssembler resultAssembler() {
        return new ResultAssembler();
    }
}
