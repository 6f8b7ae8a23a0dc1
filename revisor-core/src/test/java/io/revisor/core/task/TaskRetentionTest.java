package io.revisor.core.task;

import static org.assertj.core.api.Assertions.assertThat;

import io.revisor.core.task.InMemoryTaskRegistryTest.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TaskRetention")
class TaskRetentionTest {

    private MutableClock clock;
    private InMemoryTaskRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        registry = new InMemoryTaskRegistry(clock);
    }

    private Task finishedTask(String name) {
        Task task = registry.create(new Artifact(name, ""), List.of("only"));
        registry.transitionTask(task.id(), TaskStatus.RUNNING, TaskUpdate.none());
        registry.transitionStage(task.id(), 0, StageStatus.RUNNING, StageUpdate.none());
        registry.transitionStage(task.id(), 0, StageStatus.COMPLETED, StageUpdate.output("ok"));
        Task done =
                registry.transitionTask(task.id(), TaskStatus.COMPLETED, TaskUpdate.none())
                        .orElseThrow();
        clock.advance(Duration.ofMinutes(1));
        return done;
    }

    @Test
    @DisplayName("evicts the oldest finished tasks above the size bound")
    void shouldEvictOldestFinishedTasks() {
        Task first = finishedTask("1.py");
        Task second = finishedTask("2.py");
        Task third = finishedTask("3.py");
        TaskRetention retention =
                new TaskRetention(registry, new RetentionPolicy(2, Duration.ofDays(1)), clock);

        List<String> evicted = retention.sweep();

        assertThat(evicted).containsExactly(first.id());
        assertThat(registry.get(first.id())).isEmpty();
        assertThat(registry.get(second.id())).isPresent();
        assertThat(registry.get(third.id())).isPresent();
    }

    @Test
    @DisplayName("never evicts pending or running tasks")
    void shouldKeepUnfinishedTasks() {
        Task pending = registry.create(new Artifact("p.py", ""), List.of("only"));
        Task running = registry.create(new Artifact("r.py", ""), List.of("only"));
        registry.transitionTask(running.id(), TaskStatus.RUNNING, TaskUpdate.none());
        Task finished = finishedTask("f.py");
        TaskRetention retention =
                new TaskRetention(registry, new RetentionPolicy(1, Duration.ofDays(1)), clock);

        retention.sweep();

        assertThat(registry.get(pending.id())).isPresent();
        assertThat(registry.get(running.id())).isPresent();
        assertThat(registry.get(finished.id())).isEmpty();
    }

    @Test
    @DisplayName("evicts finished tasks older than the maximum age")
    void shouldEvictExpiredTasks() {
        Task old = finishedTask("old.py");
        clock.advance(Duration.ofHours(2));
        Task fresh = finishedTask("fresh.py");
        TaskRetention retention =
                new TaskRetention(registry, new RetentionPolicy(100, Duration.ofHours(1)), clock);

        assertThat(retention.sweep()).containsExactly(old.id());
        assertThat(registry.get(old.id())).isEmpty();
        assertThat(registry.get(fresh.id())).isPresent();
    }
}
