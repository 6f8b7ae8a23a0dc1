package io.revisor.server.api;

import io.revisor.core.streaming.TaskEvent;
import io.revisor.server.service.ReviewService;
import io.revisor.server.service.ReviewService.TaskNotFoundException;
import io.revisor.server.streaming.SseFrame;
import io.revisor.server.streaming.TaskEventStreamBridge;
import io.revisor.server.validation.ValidTaskId;
import io.smallrye.mutiny.Multi;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.sse.OutboundSseEvent;
import jakarta.ws.rs.sse.Sse;
import org.jboss.logging.Logger;

/// SSE endpoint for live review progress.
///
/// The first event is always a `task.snapshot` with the current [TaskView]; later events
/// carry only changes. Every event's `id` is the task version it reflects, so a client can
/// tell that nothing was skipped between the snapshot and the live events.
///
/// ```
/// event: task.snapshot
/// id: 0
/// data: {"taskId":"3f2a...","status":"PENDING","progress":0,...}
///
/// event: stage.completed
/// id: 3
/// data: {"taskId":"3f2a...","stageIndex":0,"stageName":"structural-analysis",...}
/// ```
///
/// ### Usage
/// ```javascript
/// const source = new EventSource('/api/v1/reviews/3f2a.../events');
/// source.addEventListener('stage.completed', (e) => render(JSON.parse(e.data)));
/// source.addEventListener('task.completed', () => source.close());
/// ```
///
/// ### Event Types
/// - `task.snapshot` - state at subscription time
/// - `task.started`, `stage.started`, `stage.retrying`, `stage.completed`, `stage.failed`
/// - `task.completed` - includes the assembled result
/// - `task.failed` - includes the error
/// - `subscriber.overflow` - this client fell too far behind and was disconnected
///
/// The stream ends after `task.completed`, `task.failed` or `subscriber.overflow`. For a
/// task that has already finished it carries only the snapshot. A quiet stream carries a
/// `: keep-alive` comment every `revisor.sse.keep-alive-interval`.
@Path("/api/v1/reviews")
public class ReviewEventResource {

    private static final Logger LOG = Logger.getLogger(ReviewEventResource.class);

    private final ReviewService reviewService;
    private final TaskEventStreamBridge bridge;

    @Inject
    public ReviewEventResource(ReviewService reviewService, TaskEventStreamBridge bridge) {
        this.reviewService = reviewService;
        this.bridge = bridge;
    }

    /// Subscribes to a task's events via SSE.
    ///
    /// @param taskId the task to observe
    /// @param sse SSE event factory
    /// @return SSE event stream
    @GET
    @Path("/{taskId}/events")
    @Produces(MediaType.SERVER_SENT_EVENTS)
    public Multi<OutboundSseEvent> streamEvents(
            @PathParam("taskId") @ValidTaskId String taskId, @Context Sse sse) {
        Multi<TaskEvent> events;
        try {
            events = reviewService.subscribe(taskId);
        } catch (TaskNotFoundException e) {
            throw new NotFoundException(e.getMessage());
        }

        LOG.infov("SSE subscription: taskId={0}", taskId);

        return bridge.frames(events)
                .map(frame -> toSseEvent(sse, frame))
                .onTermination()
                .invoke(
                        (t, cancelled) -> {
                            if (t != null) {
                                LOG.warnv(t, "SSE stream error for task: {0}", taskId);
                            } else if (cancelled) {
                                LOG.debugv("SSE stream cancelled for task: {0}", taskId);
                            } else {
                                LOG.debugv("SSE stream completed for task: {0}", taskId);
                            }
                        });
    }

    static OutboundSseEvent toSseEvent(Sse sse, SseFrame frame) {
        if (frame.isKeepAlive()) {
            return sse.newEventBuilder().comment(SseFrame.KEEP_ALIVE).build();
        }
        return sse.newEventBuilder()
                .name(frame.name())
                .id(frame.id())
                .mediaType(MediaType.APPLICATION_JSON_TYPE)
                .data(frame.data().getClass(), frame.data())
                .build();
    }
}
