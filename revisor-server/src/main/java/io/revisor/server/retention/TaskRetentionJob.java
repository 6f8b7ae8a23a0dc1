package io.revisor.server.retention;

import io.quarkus.scheduler.Scheduled;
import io.revisor.server.service.ReviewService;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/// Scheduled job that evicts finished tasks from the registry.
///
/// Each tick applies the configured retention policy and removes the stored artifacts of
/// every evicted task. Pending and running tasks are never touched.
///
/// ### Configuration
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `revisor.retention.sweep-interval` | `5m` | How often to run the sweep |
///
/// @see io.revisor.core.task.TaskRetention
@ApplicationScoped
public class TaskRetentionJob {

    private static final Logger LOG = Logger.getLogger(TaskRetentionJob.class);

    private final ReviewService reviewService;

    @Inject
    public TaskRetentionJob(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @Scheduled(
            every = "${revisor.retention.sweep-interval:5m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void sweep() {
        int evicted = reviewService.evictFinishedTasks();
        if (evicted > 0) {
            LOG.infov("Retention sweep evicted {0} finished task(s)", evicted);
        } else {
            LOG.debug("Retention sweep found nothing to evict");
        }
    }
}
