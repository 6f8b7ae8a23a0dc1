package io.revisor.server.execution;

import io.revisor.core.streaming.TaskEvent;
import io.revisor.core.streaming.TaskEventPublisher;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/// Writes task lifecycle events to the server log.
///
/// Task-level transitions and permanent stage failures are logged at INFO or WARN, stage
/// progress at DEBUG. Stage reports and artifact content are never logged.
///
/// ### Log Format
/// ```
/// Task 3f2a... started
/// Task 3f2a... stage 1 (defect-review) retrying after attempt 1: Timed out after 120s
/// Task 3f2a... completed (version 8)
/// ```
///
/// @apiNote **Side effects**: writes to the JBoss log category
/// `io.revisor.server.execution.LoggingTaskEventPublisher`.
@ApplicationScoped
public class LoggingTaskEventPublisher implements TaskEventPublisher {

    private static final Logger LOG = Logger.getLogger(LoggingTaskEventPublisher.class);

    @Override
    public void publish(TaskEvent event) {
        if (event instanceof TaskEvent.TaskStarted e) {
            LOG.infov("Task {0} started", e.taskId());
        } else if (event instanceof TaskEvent.StageStarted e) {
            LOG.debugv(
                    "Task {0} stage {1} ({2}) started", e.taskId(), e.stageIndex(), e.stageName());
        } else if (event instanceof TaskEvent.StageRetrying e) {
            LOG.infov(
                    "Task {0} stage {1} ({2}) retrying after attempt {3}: {4}",
                    e.taskId(), e.stageIndex(), e.stageName(), e.attempt(), e.error());
        } else if (event instanceof TaskEvent.StageCompleted e) {
            LOG.debugv(
                    "Task {0} stage {1} ({2}) completed on attempt {3}",
                    e.taskId(), e.stageIndex(), e.stageName(), e.attempt());
        } else if (event instanceof TaskEvent.StageFailed e) {
            LOG.warnv(
                    "Task {0} stage {1} ({2}) failed: {3}",
                    e.taskId(), e.stageIndex(), e.stageName(), e.error());
        } else if (event instanceof TaskEvent.TaskCompleted e) {
            LOG.infov("Task {0} completed (version {1})", e.taskId(), e.version());
        } else if (event instanceof TaskEvent.TaskFailed e) {
            LOG.warnv("Task {0} failed: {1}", e.taskId(), e.error());
        } else {
            LOG.tracev("Task {0}: {1}", event.taskId(), event.type());
        }
    }
}
