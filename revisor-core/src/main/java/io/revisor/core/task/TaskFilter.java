package io.revisor.core.task;

import java.time.Instant;

/// Read-only query over the task registry.
///
/// A `null` status or `createdAfter` means "any". Results are ordered newest first, then
/// `offset` entries are skipped and at most `limit` are returned.
///
/// @param status required status, may be null
/// @param createdAfter exclusive lower bound on creation time, may be null
/// @param offset number of matching tasks to skip, not negative
/// @param limit maximum number of tasks to return, positive
public record TaskFilter(TaskStatus status, Instant createdAfter, int offset, int limit) {

    public TaskFilter {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static TaskFilter all() {
        return new TaskFilter(null, null, 0, Integer.MAX_VALUE);
    }

    public TaskFilter withStatus(TaskStatus status) {
        return new TaskFilter(status, createdAfter, offset, limit);
    }

    public TaskFilter withCreatedAfter(Instant createdAfter) {
        return new TaskFilter(status, createdAfter, offset, limit);
    }

    public TaskFilter page(int offset, int limit) {
        return new TaskFilter(status, createdAfter, offset, limit);
    }

    public boolean matches(Task task) {
        if (status != null && task.status() != status) {
            return false;
        }
        return createdAfter == null || task.createdAt().isAfter(createdAfter);
    }
}
