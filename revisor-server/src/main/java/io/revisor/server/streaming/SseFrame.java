package io.revisor.server.streaming;

import io.revisor.core.streaming.TaskEvent;
import io.revisor.core.task.Task;
import io.revisor.server.api.TaskView;
import java.util.Objects;

/// One Server-Sent Event ready to be written: event name, event id and JSON payload.
///
/// The id is the task snapshot version the payload reflects. Keep-alive frames have
/// neither id nor payload and are written as an SSE comment.
///
/// @param name SSE `event` field, not null
/// @param id SSE `id` field, null only for keep-alives
/// @param data payload serialized as JSON, null only for keep-alives
public record SseFrame(String name, String id, Object data) {

    public static final String SNAPSHOT = "task.snapshot";
    public static final String KEEP_ALIVE = "keep-alive";

    public SseFrame {
        Objects.requireNonNull(name, "name must not be null");
        if (!KEEP_ALIVE.equals(name)) {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(data, "data must not be null");
        }
    }

    public static SseFrame snapshot(Task task) {
        return new SseFrame(SNAPSHOT, Long.toString(task.version()), TaskView.from(task));
    }

    public static SseFrame of(TaskEvent event) {
        return new SseFrame(event.type(), Long.toString(event.version()), event);
    }

    public static SseFrame keepAlive() {
        return new SseFrame(KEEP_ALIVE, null, null);
    }

    public boolean isKeepAlive() {
        return KEEP_ALIVE.equals(name);
    }
}
