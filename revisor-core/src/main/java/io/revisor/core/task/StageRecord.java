package io.revisor.core.task;

import java.time.Instant;
import java.util.Objects;

/// Immutable progress record of one pipeline stage within a [Task].
///
/// `index` and `name` together identify the stage and never change. The remaining fields
/// are replaced by the registry as the stage moves through [StageStatus].
///
/// @param index zero-based position in the pipeline
/// @param name stage label, not null
/// @param status current status, not null
/// @param attempt `0` while idle, `1` once started, incremented on every retry
/// @param startedAt when the first attempt began, null while idle
/// @param finishedAt when the stage completed or failed, null otherwise
/// @param output stage report, set only when `COMPLETED`
/// @param error failure description, set only when `FAILED`
public record StageRecord(
        int index,
        String name,
        StageStatus status,
        int attempt,
        Instant startedAt,
        Instant finishedAt,
        String output,
        String error) {

    public StageRecord {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
    }

    public static StageRecord idle(int index, String name) {
        return new StageRecord(index, name, StageStatus.IDLE, 0, null, null, null, null);
    }

    StageRecord started(Instant now) {
        return new StageRecord(index, name, StageStatus.RUNNING, 1, now, null, null, null);
    }

    StageRecord retried() {
        return new StageRecord(
                index, name, StageStatus.RUNNING, attempt + 1, startedAt, null, null, null);
    }

    StageRecord completed(String report, Instant now) {
        return new StageRecord(
                index, name, StageStatus.COMPLETED, attempt, startedAt, now, report, null);
    }

    StageRecord failed(String reason, Instant now) {
        return new StageRecord(
                index, name, StageStatus.FAILED, attempt, startedAt, now, null, reason);
    }
}
