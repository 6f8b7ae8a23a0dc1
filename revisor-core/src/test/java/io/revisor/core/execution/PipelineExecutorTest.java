package io.revisor.core.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.revisor.core.stage.Pipeline;
import io.revisor.core.stage.StageFailure;
import io.revisor.core.stage.StageOutcome;
import io.revisor.core.streaming.TaskEvent;
import io.revisor.core.task.Artifact;
import io.revisor.core.task.DerivedArtifact;
import io.revisor.core.task.InMemoryTaskRegistry;
import io.revisor.core.task.StageRecord;
import io.revisor.core.task.StageStatus;
import io.revisor.core.task.Task;
import io.revisor.core.task.TaskStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PipelineExecutor")
class PipelineExecutorTest {

    private static final long WAIT_SECONDS = 10;

    private InMemoryTaskRegistry registry;
    private List<TaskEvent> events;
    private ExecutorService runExecutor;
    private ExecutorService attemptExecutor;

    @BeforeEach
    void setUp() {
        registry = new InMemoryTaskRegistry();
        events = new CopyOnWriteArrayList<>();
        runExecutor = Executors.newFixedThreadPool(4);
        attemptExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        runExecutor.shutdownNow();
        attemptExecutor.shutdownNow();
    }

    private PipelineExecutor executor(Pipeline pipeline) {
        return executor(pipeline, Duration.ofSeconds(5), 2);
    }

    private PipelineExecutor executor(Pipeline pipeline, Duration stageTimeout, int maxRetries) {
        return PipelineExecutor.builder()
                .registry(registry)
                .pipeline(pipeline)
                .publisher(events::add)
                .retryPolicy(new RetryPolicy(maxRetries, Duration.ofMillis(1), Duration.ofMillis(5)))
                .stageTimeout(stageTimeout)
                .runExecutor(runExecutor)
                .attemptExecutor(attemptExecutor)
                .build();
    }

    private Task create(Pipeline pipeline) {
        return registry.create(new Artifact("a.py", "print('hello')\n"), pipeline.stageNames());
    }

    private static Task await(Optional<CompletableFuture<Task>> run) throws Exception {
        assertThat(run).isPresent();
        return run.get().get(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    private List<String> eventTypes(String taskId) {
        return events.stream().filter(e -> e.taskId().equals(taskId)).map(TaskEvent::type).toList();
    }

    private static ScriptedStage fixing(String name) {
        return new ScriptedStage(
                name,
                context ->
                        new StageOutcome.ReportWithArtifact(
                                "fixed " + context.inputArtifact().name(),
                                new DerivedArtifact(
                                        "fixed_a.py", "print('fixed')\n", "memory://" + context.taskId())));
    }

    @Nested
    @DisplayName("successful runs")
    class SuccessfulRuns {

        @Test
        @DisplayName("runs every stage and attaches the derived artifact")
        void shouldCompleteAllStages() throws Exception {
            Pipeline pipeline =
                    Pipeline.of(
                            ScriptedStage.reporting("analysis"),
                            ScriptedStage.reporting("review"),
                            fixing("fix"));
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            Task finished = await(executor.start(task.id()));

            assertThat(finished.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(finished.stage(2).output()).isNotBlank();
            assertThat(finished.outputArtifact()).isNotNull();
            assertThat(finished.outputArtifact().name()).isEqualTo("fixed_a.py");
            assertThat(finished.stages()).extracting(StageRecord::attempt).containsOnly(1);
            assertThat(registry.get(task.id())).contains(finished);
        }

        @Test
        @DisplayName("publishes one event per mutation in order")
        void shouldPublishEventsInOrder() throws Exception {
            Pipeline pipeline = Pipeline.of(ScriptedStage.reporting("analysis"), fixing("fix"));
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            Task finished = await(executor.start(task.id()));

            assertThat(eventTypes(task.id()))
                    .containsExactly(
                            "task.started",
                            "stage.started",
                            "stage.completed",
                            "stage.started",
                            "stage.completed",
                            "task.completed");
            assertThat(events)
                    .extracting(TaskEvent::version)
                    .containsExactly(1L, 2L, 3L, 4L, 5L, 6L);
            assertThat(finished.version()).isEqualTo(6);
            TaskEvent.TaskCompleted completed = (TaskEvent.TaskCompleted) events.get(events.size() - 1);
            assertThat(completed.result().sections()).hasSize(2);
            assertThat(completed.snapshot()).isEqualTo(finished);
        }

        @Test
        @DisplayName("hands earlier reports to later stages")
        void shouldPassPriorOutputs() throws Exception {
            ScriptedStage last = ScriptedStage.reporting("last");
            Pipeline pipeline =
                    Pipeline.of(ScriptedStage.reporting("first"), ScriptedStage.reporting("second"), last);
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            await(executor.start(task.id()));

            assertThat(last.contexts()).hasSize(1);
            assertThat(last.contexts().get(0).priorOutputs())
                    .containsExactly(
                            "first report for " + task.id(), "second report for " + task.id());
            assertThat(last.contexts().get(0).isTerminalStage()).isTrue();
        }

        @Test
        @DisplayName("runs two tasks independently")
        void shouldRunTasksIndependently() throws Exception {
            Pipeline pipeline =
                    Pipeline.of(
                            ScriptedStage.reporting("analysis"),
                            ScriptedStage.reporting("review"),
                            ScriptedStage.reporting("fix"));
            PipelineExecutor executor = executor(pipeline);
            Task first = create(pipeline);
            Task second = create(pipeline);

            Optional<CompletableFuture<Task>> firstRun = executor.start(first.id());
            Optional<CompletableFuture<Task>> secondRun = executor.start(second.id());
            Task firstDone = await(firstRun);
            Task secondDone = await(secondRun);

            assertThat(firstDone.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(secondDone.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(firstDone.stages())
                    .allSatisfy(s -> assertThat(s.output()).endsWith(first.id()));
            assertThat(secondDone.stages())
                    .allSatisfy(s -> assertThat(s.output()).endsWith(second.id()));
            assertThat(firstDone.version()).isEqualTo(secondDone.version());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("fails the task on a permanent stage failure and leaves later stages idle")
        void shouldFailOnPermanentFailure() throws Exception {
            ScriptedStage broken =
                    new ScriptedStage(
                            "review",
                            context -> {
                                throw StageFailure.permanentFailure("unparseable input");
                            });
            ScriptedStage last = ScriptedStage.reporting("fix");
            Pipeline pipeline = Pipeline.of(ScriptedStage.reporting("analysis"), broken, last);
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            Task finished = await(executor.start(task.id()));

            assertThat(finished.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(finished.stages())
                    .extracting(StageRecord::status)
                    .containsExactly(StageStatus.COMPLETED, StageStatus.FAILED, StageStatus.IDLE);
            assertThat(finished.error()).contains("review").contains("unparseable input");
            assertThat(broken.invocations()).isEqualTo(1);
            assertThat(last.invocations()).isZero();
            List<String> types = eventTypes(task.id());
            assertThat(types.subList(types.size() - 2, types.size()))
                    .containsExactly("stage.failed", "task.failed");
        }

        @Test
        @DisplayName("retries transient failures and then succeeds")
        void shouldRetryTransientFailures() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            ScriptedStage flaky =
                    new ScriptedStage(
                            "analysis",
                            context -> {
                                if (calls.incrementAndGet() < 3) {
                                    throw StageFailure.transientFailure("upstream 503");
                                }
                                return new StageOutcome.Report("finally");
                            });
            Pipeline pipeline =
                    Pipeline.of(flaky, ScriptedStage.reporting("review"), ScriptedStage.reporting("fix"));
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            Task finished = await(executor.start(task.id()));

            assertThat(finished.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(finished.stage(0).attempt()).isEqualTo(3);
            assertThat(finished.stage(0).status()).isEqualTo(StageStatus.COMPLETED);
            assertThat(flaky.contexts()).extracting(c -> c.attempt()).containsExactly(1, 2, 3);
            assertThat(eventTypes(task.id())).filteredOn("stage.retrying"::equals).hasSize(2);
        }

        @Test
        @DisplayName("never exposes two running stages while retrying")
        void shouldExposeConsistentSnapshotsDuringRetries() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            ScriptedStage flaky =
                    new ScriptedStage(
                            "review",
                            context -> {
                                Thread.sleep(5);
                                if (calls.incrementAndGet() < 3) {
                                    throw StageFailure.transientFailure("upstream 503");
                                }
                                return new StageOutcome.Report("reviewed");
                            });
            ScriptedStage slow =
                    new ScriptedStage(
                            "analysis",
                            context -> {
                                Thread.sleep(5);
                                return new StageOutcome.Report("analysed");
                            });
            Pipeline pipeline = Pipeline.of(slow, flaky, ScriptedStage.reporting("fix"));
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            CompletableFuture<Task> run = executor.start(task.id()).orElseThrow();
            long lastVersion = -1;
            int samples = 0;
            while (!run.isDone()) {
                Task sample = registry.get(task.id()).orElseThrow();
                samples++;
                assertThat(sample.stages()).hasSize(3);
                assertThat(sample.version()).isGreaterThanOrEqualTo(lastVersion);
                lastVersion = sample.version();
                List<StageStatus> statuses =
                        sample.stages().stream().map(StageRecord::status).toList();
                assertThat(statuses)
                        .filteredOn(StageStatus.RUNNING::equals)
                        .hasSizeLessThanOrEqualTo(1);
                int running = statuses.indexOf(StageStatus.RUNNING);
                if (running >= 0) {
                    assertThat(statuses.subList(0, running)).containsOnly(StageStatus.COMPLETED);
                    assertThat(statuses.subList(running + 1, 3)).containsOnly(StageStatus.IDLE);
                }
            }
            Task finished = run.get(WAIT_SECONDS, TimeUnit.SECONDS);

            assertThat(samples).isPositive();
            assertThat(finished.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(finished.stages()).hasSize(3);
            assertThat(finished.stage(1).attempt()).isEqualTo(3);
        }

        @Test
        @DisplayName("escalates to permanent once retries are spent")
        void shouldEscalateAfterRetryBudget() throws Exception {
            ScriptedStage down =
                    new ScriptedStage(
                            "analysis",
                            context -> {
                                throw StageFailure.transientFailure("connection reset");
                            });
            Pipeline pipeline = Pipeline.of(down, ScriptedStage.reporting("fix"));
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            Task finished = await(executor.start(task.id()));

            assertThat(finished.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(finished.stage(0).attempt()).isEqualTo(3);
            assertThat(finished.stage(0).error()).startsWith("Gave up after 3 attempts");
            assertThat(down.invocations()).isEqualTo(3);
        }

        @Test
        @DisplayName("treats unchecked exceptions as permanent")
        void shouldTreatUncheckedExceptionAsPermanent() throws Exception {
            ScriptedStage buggy =
                    new ScriptedStage(
                            "analysis",
                            context -> {
                                throw new IllegalArgumentException("bad index");
                            });
            Pipeline pipeline = Pipeline.of(buggy);
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            Task finished = await(executor.start(task.id()));

            assertThat(finished.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(finished.stage(0).error()).contains("bad index");
            assertThat(buggy.invocations()).isEqualTo(1);
        }

        @Test
        @DisplayName("retries an attempt that exceeded the stage timeout")
        void shouldRetryAfterTimeout() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            ScriptedStage slow =
                    new ScriptedStage(
                            "analysis",
                            context -> {
                                if (calls.incrementAndGet() == 1) {
                                    Thread.sleep(5_000);
                                }
                                return new StageOutcome.Report("done on attempt " + context.attempt());
                            });
            Pipeline pipeline = Pipeline.of(slow);
            PipelineExecutor executor = executor(pipeline, Duration.ofMillis(200), 2);
            Task task = create(pipeline);

            Task finished = await(executor.start(task.id()));

            assertThat(finished.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(finished.stage(0).attempt()).isEqualTo(2);
            assertThat(finished.stage(0).output()).isEqualTo("done on attempt 2");
        }

        @Test
        @DisplayName("fails a task whose stage keeps timing out")
        void shouldFailAfterRepeatedTimeouts() throws Exception {
            ScriptedStage hung =
                    new ScriptedStage(
                            "analysis",
                            context -> {
                                Thread.sleep(5_000);
                                return new StageOutcome.Report("never");
                            });
            Pipeline pipeline = Pipeline.of(hung);
            PipelineExecutor executor = executor(pipeline, Duration.ofMillis(100), 0);
            Task task = create(pipeline);

            Task finished = await(executor.start(task.id()));

            assertThat(finished.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(finished.stage(0).error()).contains("timed out");
        }

        @Test
        @DisplayName("aborts with an internal error when the task does not match the pipeline")
        void shouldAbortOnInconsistency() throws Exception {
            Pipeline pipeline = Pipeline.of(ScriptedStage.reporting("only"));
            PipelineExecutor executor = executor(pipeline);
            Task task = registry.create(new Artifact("a.py", ""), List.of("one", "two"));

            Task finished = await(executor.start(task.id()));

            assertThat(finished.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(finished.error()).startsWith("Internal consistency error");
            assertThat(finished.stages()).extracting(StageRecord::status).containsOnly(StageStatus.IDLE);
            assertThat(eventTypes(task.id())).containsExactly("task.started", "task.failed");
        }
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("returns empty for an unknown task")
        void shouldReturnEmptyForUnknownTask() {
            PipelineExecutor executor = executor(Pipeline.of(ScriptedStage.reporting("only")));

            assertThat(executor.start("missing")).isEmpty();
        }

        @Test
        @DisplayName("returns a completed future for a finished task")
        void shouldReturnCompletedFutureForTerminalTask() throws Exception {
            Pipeline pipeline = Pipeline.of(ScriptedStage.reporting("only"));
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);
            Task finished = await(executor.start(task.id()));

            Optional<CompletableFuture<Task>> again = executor.start(task.id());

            assertThat(again).isPresent();
            assertThat(again.get()).isCompletedWithValue(finished);
            assertThat(eventTypes(task.id())).filteredOn("task.started"::equals).hasSize(1);
        }

        @Test
        @DisplayName("runs a task once when started concurrently")
        void shouldRunOnceWhenStartedConcurrently() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            ScriptedStage gated =
                    new ScriptedStage(
                            "gated",
                            context -> {
                                release.await(WAIT_SECONDS, TimeUnit.SECONDS);
                                return new StageOutcome.Report("released");
                            });
            Pipeline pipeline = Pipeline.of(gated);
            PipelineExecutor executor = executor(pipeline);
            Task task = create(pipeline);

            int callers = 8;
            ExecutorService starters = Executors.newFixedThreadPool(callers);
            CountDownLatch ready = new CountDownLatch(1);
            List<Future<Optional<CompletableFuture<Task>>>> calls = new ArrayList<>();
            try {
                for (int i = 0; i < callers; i++) {
                    calls.add(
                            starters.submit(
                                    () -> {
                                        ready.await();
                                        return executor.start(task.id());
                                    }));
                }
                ready.countDown();

                List<CompletableFuture<Task>> futures = new ArrayList<>();
                for (Future<Optional<CompletableFuture<Task>>> call : calls) {
                    futures.add(call.get(WAIT_SECONDS, TimeUnit.SECONDS).orElseThrow());
                }
                assertThat(executor.isRunning(task.id())).isTrue();
                release.countDown();

                assertThat(futures).allSatisfy(f -> assertThat(f).isSameAs(futures.get(0)));
                Task finished = futures.get(0).get(WAIT_SECONDS, TimeUnit.SECONDS);
                assertThat(finished.status()).isEqualTo(TaskStatus.COMPLETED);
                assertThat(gated.invocations()).isEqualTo(1);
                assertThat(eventTypes(task.id())).filteredOn("task.started"::equals).hasSize(1);
            } finally {
                release.countDown();
                starters.shutdownNow();
            }
        }
    }
}
