package io.revisor.server.streaming;

import io.revisor.core.streaming.TaskEvent;
import io.smallrye.mutiny.Multi;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Objects;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// Turns a task's event stream into the [SseFrame]s written to one client.
///
/// The snapshot event becomes a `task.snapshot` frame carrying the task view; every other
/// event is sent as is. While the task is quiet a keep-alive frame goes out
/// every `revisor.sse.keep-alive-interval` so that proxies do not drop the idle connection.
/// Keep-alives stop as soon as the event stream completes.
///
/// @see io.revisor.server.api.ReviewEventResource
@ApplicationScoped
public class TaskEventStreamBridge {

    /// Marks the end of the event stream inside the merged stream; never emitted.
    private static final SseFrame END = SseFrame.keepAlive();

    private final Duration keepAliveInterval;

    @Inject
    public TaskEventStreamBridge(
            @ConfigProperty(name = "revisor.sse.keep-alive-interval", defaultValue = "30s")
                    Duration keepAliveInterval) {
        this.keepAliveInterval =
                Objects.requireNonNull(keepAliveInterval, "keepAliveInterval must not be null");
        if (keepAliveInterval.isZero() || keepAliveInterval.isNegative()) {
            throw new IllegalArgumentException("keepAliveInterval must be positive");
        }
    }

    /// Maps the events to frames and interleaves keep-alives until the events complete.
    ///
    /// @param events a task's event stream, starting with its snapshot
    /// @return frame stream, never null
    public Multi<SseFrame> frames(Multi<TaskEvent> events) {
        Objects.requireNonNull(events, "events must not be null");

        Multi<SseFrame> live =
                events.map(TaskEventStreamBridge::toFrame).onCompletion().continueWith(END);
        Multi<SseFrame> keepAlive =
                Multi.createFrom()
                        .ticks()
                        .startingAfter(keepAliveInterval)
                        .every(keepAliveInterval)
                        .onOverflow()
                        .drop()
                        .map(tick -> SseFrame.keepAlive());

        return Multi.createBy()
                .merging()
                .streams(live, keepAlive)
                .select()
                .first(frame -> frame != END);
    }

    static SseFrame toFrame(TaskEvent event) {
        if (event instanceof TaskEvent.TaskSnapshot snapshot) {
            return SseFrame.snapshot(snapshot.task());
        }
        return SseFrame.of(event);
    }
}
