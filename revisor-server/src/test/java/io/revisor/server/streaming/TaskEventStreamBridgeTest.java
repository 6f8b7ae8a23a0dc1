package io.revisor.server.streaming;

import static org.assertj.core.api.Assertions.assertThat;

import io.revisor.core.RevisorEnvironment;
import io.revisor.core.RevisorFactory;
import io.revisor.core.stage.Pipeline;
import io.revisor.core.streaming.TaskEvent;
import io.revisor.core.task.Artifact;
import io.revisor.core.task.Task;
import io.revisor.server.api.TaskView;
import io.revisor.server.service.GateStage;
import io.smallrye.mutiny.helpers.test.AssertSubscriber;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaskEventStreamBridgeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final TaskEventStreamBridge bridge = new TaskEventStreamBridge(Duration.ofSeconds(30));
    private RevisorEnvironment environment;

    @AfterEach
    void tearDown() {
        if (environment != null) {
            environment.close();
        }
    }

    private Task submit() {
        return environment
                .getTaskRegistry()
                .create(
                        new Artifact("calc.py", "def add(a, b):\n    return a - b\n"),
                        environment.getPipeline().stageNames());
    }

    private AssertSubscriber<SseFrame> listen(TaskEventStreamBridge streamBridge, Task task) {
        return streamBridge
                .frames(environment.getBroadcaster().subscribe(task.id()).orElseThrow())
                .subscribe()
                .withSubscriber(AssertSubscriber.create(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("emits the snapshot first, then every event in version order, then completes")
    void shouldStreamSnapshotThenEvents() {
        environment = RevisorFactory.createEnvironment();
        Task task = submit();

        AssertSubscriber<SseFrame> subscriber = listen(bridge, task);
        environment.getPipelineExecutor().start(task.id());
        subscriber.awaitCompletion(TIMEOUT);

        List<SseFrame> frames = subscriber.getItems();
        assertThat(frames)
                .extracting(SseFrame::name)
                .containsExactly(
                        "task.snapshot",
                        "task.started",
                        "stage.started",
                        "stage.completed",
                        "stage.started",
                        "stage.completed",
                        "stage.started",
                        "stage.completed",
                        "task.completed");
        assertThat(frames)
                .extracting(SseFrame::id)
                .containsExactly("0", "1", "2", "3", "4", "5", "6", "7", "8");
        assertThat(frames.get(0).data()).isInstanceOf(TaskView.class);
        assertThat(frames.get(8).data()).isInstanceOf(TaskEvent.TaskCompleted.class);
        assertThat(environment.getBroadcaster().activeChannelCount()).isZero();
    }

    @Test
    @DisplayName("emits only the snapshot for a finished task")
    void shouldCompleteAfterSnapshotForFinishedTask() throws Exception {
        environment = RevisorFactory.createEnvironment();
        Task task = submit();
        environment.getPipelineExecutor().start(task.id()).orElseThrow().get();

        AssertSubscriber<SseFrame> subscriber = listen(bridge, task);
        subscriber.awaitCompletion(TIMEOUT);

        assertThat(subscriber.getItems())
                .singleElement()
                .satisfies(
                        frame -> {
                            assertThat(frame.name()).isEqualTo(SseFrame.SNAPSHOT);
                            assertThat(((TaskView) frame.data()).status()).isEqualTo("COMPLETED");
                        });
    }

    @Test
    @DisplayName("detaches from the task when the client cancels")
    void shouldDetachOnCancel() throws Exception {
        GateStage gate = new GateStage();
        environment = RevisorFactory.builder().pipeline(Pipeline.of(gate)).build();
        Task task = submit();
        environment.getPipelineExecutor().start(task.id());
        assertThat(gate.awaitEntered()).isTrue();

        AssertSubscriber<SseFrame> subscriber = listen(bridge, task);
        subscriber.awaitItems(1, TIMEOUT);
        assertThat(environment.getBroadcaster().subscriberCount(task.id())).isEqualTo(1);
        subscriber.cancel();

        assertThat(environment.getBroadcaster().subscriberCount(task.id())).isZero();
        gate.release();
    }

    @Test
    @DisplayName("sends keep-alives while the task is quiet and stops them on completion")
    void shouldSendKeepAlivesUntilCompletion() throws Exception {
        GateStage gate = new GateStage();
        environment = RevisorFactory.builder().pipeline(Pipeline.of(gate)).build();
        Task task = submit();
        var run = environment.getPipelineExecutor().start(task.id()).orElseThrow();
        assertThat(gate.awaitEntered()).isTrue();

        AssertSubscriber<SseFrame> subscriber =
                listen(new TaskEventStreamBridge(Duration.ofMillis(50)), task);
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (subscriber.getItems().size() < 3 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        List<SseFrame> quiet = List.copyOf(subscriber.getItems());
        assertThat(quiet).hasSizeGreaterThanOrEqualTo(3);
        assertThat(quiet.get(0).name()).isEqualTo(SseFrame.SNAPSHOT);
        assertThat(quiet.subList(1, quiet.size())).allMatch(SseFrame::isKeepAlive);
        subscriber.assertNotTerminated();

        gate.release();
        run.get(10, TimeUnit.SECONDS);
        subscriber.awaitCompletion(TIMEOUT);
        List<SseFrame> frames = subscriber.getItems();
        assertThat(frames.get(frames.size() - 1).name()).isEqualTo("task.completed");

        int delivered = frames.size();
        Thread.sleep(200);
        assertThat(subscriber.getItems()).hasSize(delivered);
    }
}
