package io.revisor.core.task;

import io.revisor.core.exception.InvalidTransitionException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Evicts finished tasks from a [TaskRegistry] according to a [RetentionPolicy].
///
/// Only `COMPLETED` and `FAILED` tasks are ever evicted, oldest first. Pending and running
/// tasks stay even when the registry is above its size bound.
public final class TaskRetention {

    private static final Logger logger = Logger.getLogger(TaskRetention.class.getName());

    private final TaskRegistry registry;
    private final RetentionPolicy policy;
    private final Clock clock;

    public TaskRetention(TaskRegistry registry, RetentionPolicy policy, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public RetentionPolicy policy() {
        return policy;
    }

    /// Runs one eviction pass.
    ///
    /// @return ids of the removed tasks, oldest first
    public List<String> sweep() {
        Instant cutoff = clock.instant().minus(policy.maxAge());
        List<Task> finished =
                registry.list(TaskFilter.all()).stream()
                        .filter(Task::isTerminal)
                        .sorted(Comparator.comparing(TaskRetention::finishedOrUpdated))
                        .toList();

        int excess = registry.size() - policy.maxRetainedTasks();
        List<String> evicted = new ArrayList<>();
        for (Task task : finished) {
            boolean expired = finishedOrUpdated(task).isBefore(cutoff);
            if (!expired && excess - evicted.size() <= 0) {
                continue;
            }
            if (evict(task)) {
                evicted.add(task.id());
            }
        }

        if (!evicted.isEmpty()) {
            logger.info("Retention sweep evicted " + evicted.size() + " finished task(s)");
        }
        return List.copyOf(evicted);
    }

    private boolean evict(Task task) {
        try {
            return registry.delete(task.id());
        } catch (InvalidTransitionException e) {
            logger.log(Level.WARNING, "Skipped eviction of task " + task.id(), e);
            return false;
        }
    }

    private static Instant finishedOrUpdated(Task task) {
        return task.finishedAt() != null ? task.finishedAt() : task.updatedAt();
    }
}
