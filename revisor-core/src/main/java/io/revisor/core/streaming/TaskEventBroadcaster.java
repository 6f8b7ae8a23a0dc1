package io.revisor.core.streaming;

import io.revisor.core.task.Task;
import io.revisor.core.task.TaskRegistry;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import io.smallrye.mutiny.subscription.BackPressureFailure;
import io.smallrye.mutiny.subscription.Cancellable;
import io.smallrye.mutiny.subscription.MultiEmitter;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fans task events out to subscribers.
///
/// Keeps one [BroadcastProcessor] per task that currently has subscribers. Every
/// subscriber gets its own bounded buffer behind the processor, so a slow subscriber only
/// ever hurts itself: once its buffer overflows it receives a single
/// [TaskEvent.SubscriberOverflow] notice and its stream completes, while publication and
/// the other subscribers carry on.
///
/// ### Gap-free subscription
/// Each stream starts with a [TaskEvent.TaskSnapshot]. The snapshot is read and the
/// subscriber attached to the processor while holding the task's channel lock, which
/// `publish` also takes. Since the executor publishes only after the registry mutation it
/// reports, any event published after the snapshot read carries a newer version. Events at
/// or below the snapshot version are dropped.
///
/// ### Memory Management
/// A channel is removed when:
/// - the terminal event of its task was published
/// - its last subscriber cancelled, completed or overflowed
///
/// Events for tasks without subscribers are dropped.
///
/// ### Usage
/// {@snippet :
/// broadcaster.subscribe(taskId)
///         .orElseThrow(() -> new TaskNotFoundException(taskId))
///         .subscribe().with(event -> send(event));
/// }
///
/// @implNote Thread-safe. `publish` never waits for a subscriber; lock scope is a single
/// task's channel.
///
/// @see TaskEvent for event types
public final class TaskEventBroadcaster implements TaskEventPublisher {

    private static final Logger logger = Logger.getLogger(TaskEventBroadcaster.class.getName());

    public static final int DEFAULT_QUEUE_CAPACITY = 256;

    private final TaskRegistry registry;
    private final int queueCapacity;
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    public TaskEventBroadcaster(TaskRegistry registry) {
        this(registry, DEFAULT_QUEUE_CAPACITY);
    }

    public TaskEventBroadcaster(TaskRegistry registry, int queueCapacity) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        this.queueCapacity = queueCapacity;
    }

    /// Subscribes to a task's events.
    ///
    /// The stream attaches when it is subscribed to, emits the task snapshot first and
    /// completes after the terminal event. A finished task yields its final snapshot
    /// followed by completion.
    ///
    /// @param taskId the task to observe, not null
    /// @return the event stream, or empty if the task is unknown
    public Optional<Multi<TaskEvent>> subscribe(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        if (registry.get(taskId).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Multi.createFrom().deferred(() -> open(taskId)));
    }

    private Multi<TaskEvent> open(String taskId) {
        Listener listener = new Listener(taskId);
        return Multi.createFrom()
                .<TaskEvent>emitter(listener::attach)
                .onOverflow()
                .buffer(queueCapacity)
                .onFailure(BackPressureFailure.class)
                .recoverWithItem(listener::overflowed)
                .onTermination()
                .invoke(listener::detach);
    }

    /// Delivers an event to every current subscriber of its task.
    @Override
    public void publish(TaskEvent event) {
        Objects.requireNonNull(event, "event must not be null");

        Channel channel = channels.get(event.taskId());
        if (channel == null) {
            return;
        }
        synchronized (channel) {
            if (channel.retired) {
                return;
            }
            channel.processor.onNext(event);
            if (event.isTerminal()) {
                retire(channel);
            }
        }
    }

    public int subscriberCount(String taskId) {
        Channel channel = channels.get(taskId);
        if (channel == null) {
            return 0;
        }
        synchronized (channel) {
            return channel.subscribers;
        }
    }

    public int activeChannelCount() {
        return channels.size();
    }

    private void retireIfIdle(Channel channel) {
        if (channel.subscribers == 0 && !channel.retired) {
            retire(channel);
        }
    }

    private void retire(Channel channel) {
        channel.retired = true;
        channels.remove(channel.taskId, channel);
        channel.processor.onComplete();
    }

    /// Subscribers of one task. Guarded by its own monitor.
    private static final class Channel {
        private final String taskId;
        private final BroadcastProcessor<TaskEvent> processor = BroadcastProcessor.create();
        private int subscribers;
        private boolean retired;

        private Channel(String taskId) {
            this.taskId = taskId;
        }
    }

    /// One subscriber's attachment to a channel.
    private final class Listener {
        private final String taskId;
        private final AtomicBoolean detached = new AtomicBoolean();
        private volatile Channel channel;
        private volatile Cancellable upstream;
        private volatile long lastVersion;

        private Listener(String taskId) {
            this.taskId = taskId;
        }

        private void attach(MultiEmitter<? super TaskEvent> emitter) {
            emitter.onTermination(this::detach);
            while (true) {
                Channel candidate = channels.computeIfAbsent(taskId, Channel::new);
                synchronized (candidate) {
                    if (candidate.retired) {
                        continue;
                    }
                    Optional<Task> snapshot = registry.get(taskId);
                    if (snapshot.isEmpty()) {
                        retireIfIdle(candidate);
                        emitter.complete();
                        return;
                    }
                    Task task = snapshot.get();
                    long baseline = task.version();
                    lastVersion = baseline;
                    emitter.emit(TaskEvent.TaskSnapshot.of(task));
                    if (task.isTerminal() || emitter.isCancelled()) {
                        retireIfIdle(candidate);
                        emitter.complete();
                        return;
                    }
                    candidate.subscribers++;
                    channel = candidate;
                    upstream =
                            candidate
                                    .processor
                                    .subscribe()
                                    .with(
                                            event -> {
                                                if (event.version() > baseline) {
                                                    lastVersion = event.version();
                                                    emitter.emit(event);
                                                }
                                            },
                                            emitter::fail,
                                            emitter::complete);
                    if (detached.get()) {
                        release(candidate);
                        return;
                    }
                    logger.fine(
                            () -> "Subscribed to task " + taskId + " at version " + baseline);
                    return;
                }
            }
        }

        private TaskEvent overflowed(Throwable failure) {
            logger.log(
                    Level.WARNING,
                    "Subscriber of task "
                            + taskId
                            + " overflowed at version "
                            + lastVersion
                            + " (capacity "
                            + queueCapacity
                            + "); detached",
                    failure);
            detach();
            return TaskEvent.SubscriberOverflow.now(taskId, lastVersion, queueCapacity);
        }

        private void detach() {
            if (!detached.compareAndSet(false, true)) {
                return;
            }
            Channel attached = channel;
            if (attached == null) {
                return;
            }
            synchronized (attached) {
                release(attached);
            }
            logger.fine(() -> "Unsubscribed from task " + taskId);
        }

        /// Caller holds the channel lock.
        private void release(Channel attached) {
            upstream.cancel();
            attached.subscribers--;
            retireIfIdle(attached);
        }
    }
}
